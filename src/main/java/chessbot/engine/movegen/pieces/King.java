package chessbot.engine.movegen.pieces;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.game.Game;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;
import chessbot.engine.movegen.AttackDetector;
import chessbot.engine.movegen.Move;

import java.util.List;

public final class King {
    static final int[][] KING_OFFSETS = {
            {0, 1}, {1, 1}, {1, 0}, {1, -1}, {0, -1}, {-1, -1}, {-1, 0}, {-1, 1}
    };
    private static final int KING_FILE = 4;

    private King() {}

    public static void generatePseudoLegalMoves(Board board, Square from, Piece piece, List<Move> out) {
        for(int[] offset : KING_OFFSETS) {
            Square to = from.offset(offset[0], offset[1]);
            if(to == null) {
                continue;
            }
            Piece occupant = board.get(to);
            if(occupant == null) {
                out.add(Move.normal(from, to, PieceType.KING));
            } else if(occupant.color() != piece.color()) {
                out.add(Move.capture(from, to, PieceType.KING, occupant.type()));
            }
        }
    }

    public static int countPseudoLegalMoves(Board board, Square from, Piece piece) {
        int count = 0;
        for(int[] offset : KING_OFFSETS) {
            Square to = from.offset(offset[0], offset[1]);
            if(to != null) {
                Piece occupant = board.get(to);
                if(occupant == null || occupant.color() != piece.color()) count++;
            }
        }
        return count;
    }

    /**
     * Adds the castling moves available to the king on {@code from}: kingside first, then queenside.
     * The king may not castle out of, through or into check.
     */
    public static void generateCastleMoves(Game game, Square from, Piece piece, List<Move> out) {
        Color color = piece.color();
        int homeRank = color.homeRank();
        if(piece.hasMoved() || from.rank() != homeRank || from.file() != KING_FILE) {
            return;
        }
        Board board = game.board();
        Color opponent = color.getOppositeColor();
        if(game.canCastleKingSide(color) && isCastleLegal(board, color, opponent, 7, 6, 5)) {
            out.add(Move.castle(from, Square.of(6, homeRank)));
        }
        if(game.canCastleQueenSide(color) && isCastleLegal(board, color, opponent, 0, 2, 3)) {
            out.add(Move.castle(from, Square.of(2, homeRank)));
        }
    }

    private static boolean isCastleLegal(Board board, Color color, Color opponent,
                                         int rookFile, int kingTargetFile, int transitFile) {
        int homeRank = color.homeRank();
        Piece rook = board.get(Square.of(rookFile, homeRank));
        if(rook == null || !rook.is(PieceType.ROOK, color) || rook.hasMoved()) {
            return false;
        }
        int step = rookFile > KING_FILE ? 1 : -1;
        for(int file = KING_FILE + step; file != rookFile; file += step) {
            if(!board.isEmpty(Square.of(file, homeRank))) {
                return false;
            }
        }
        return !AttackDetector.isSquareAttacked(board, Square.of(KING_FILE, homeRank), opponent)
                && !AttackDetector.isSquareAttacked(board, Square.of(transitFile, homeRank), opponent)
                && !AttackDetector.isSquareAttacked(board, Square.of(kingTargetFile, homeRank), opponent);
    }
}
