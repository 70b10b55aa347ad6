package chessbot.engine.movegen;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.game.Game;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.MovePlayed;
import chessbot.engine.game.board.Piece;
import chessbot.engine.movegen.pieces.Bishop;
import chessbot.engine.movegen.pieces.King;
import chessbot.engine.movegen.pieces.Knight;
import chessbot.engine.movegen.pieces.Pawn;
import chessbot.engine.movegen.pieces.Queen;
import chessbot.engine.movegen.pieces.Rook;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.List;

/**
 * Legal move generation. Pseudo-legal moves come from the per piece generators; each one is then
 * played on the board and kept only if it does not leave the mover's king attacked.
 * Moves are produced piece by piece in square order a1..h8.
 */
public final class MoveGenerator {
    // Most positions have far fewer, 218 is the known maximum
    private static final int INITIAL_CAPACITY = 48;

    private MoveGenerator() {}

    public static List<Move> legalMoves(Game game, Color side) {
        List<Move> pseudoLegal = pseudoLegalMoves(game, side);
        List<Move> legal = new ObjectArrayList<>(pseudoLegal.size());
        for(Move move : pseudoLegal) {
            if(isLegal(game.board(), move, side)) {
                legal.add(move);
            }
        }
        return legal;
    }

    /** Legal moves of the piece on {@code square}, empty if the square is empty. */
    public static List<Move> legalMovesFrom(Game game, Square square) {
        Piece piece = game.board().get(square);
        if(piece == null) {
            return List.of();
        }
        List<Move> pseudoLegal = new ObjectArrayList<>(28);
        generatePieceMoves(game, square, piece, pseudoLegal);
        List<Move> legal = new ObjectArrayList<>(pseudoLegal.size());
        for(Move move : pseudoLegal) {
            if(isLegal(game.board(), move, piece.color())) {
                legal.add(move);
            }
        }
        return legal;
    }

    // Stops at the first legal move found
    public static boolean hasLegalMove(Game game, Color side) {
        for(Move move : pseudoLegalMoves(game, side)) {
            if(isLegal(game.board(), move, side)) {
                return true;
            }
        }
        return false;
    }

    public static List<Move> pseudoLegalMoves(Game game, Color side) {
        List<Move> moves = new ObjectArrayList<>(INITIAL_CAPACITY);
        Board board = game.board();
        for(int i = 0; i < 64; i++) {
            Square square = Square.of(i);
            Piece piece = board.get(square);
            if(piece != null && piece.color() == side) {
                generatePieceMoves(game, square, piece, moves);
            }
        }
        return moves;
    }

    /** Pseudo-legal move count of a color, castling excluded. Used as the mobility measure. */
    public static int countPseudoLegalMoves(Board board, Color side) {
        int count = 0;
        for(Piece piece : board.getPieces(side)) {
            Square square = piece.square();
            count += switch (piece.type()) {
                case PAWN -> Pawn.countPseudoLegalMoves(board, square, piece);
                case KNIGHT -> Knight.countPseudoLegalMoves(board, square, piece);
                case BISHOP -> Bishop.countPseudoLegalMoves(board, square, piece);
                case ROOK -> Rook.countPseudoLegalMoves(board, square, piece);
                case QUEEN -> Queen.countPseudoLegalMoves(board, square, piece);
                case KING -> King.countPseudoLegalMoves(board, square, piece);
            };
        }
        return count;
    }

    private static void generatePieceMoves(Game game, Square square, Piece piece, List<Move> out) {
        Board board = game.board();
        switch (piece.type()) {
            case PAWN -> Pawn.generatePseudoLegalMoves(board, square, piece, out);
            case KNIGHT -> Knight.generatePseudoLegalMoves(board, square, piece, out);
            case BISHOP -> Bishop.generatePseudoLegalMoves(board, square, piece, out);
            case ROOK -> Rook.generatePseudoLegalMoves(board, square, piece, out);
            case QUEEN -> Queen.generatePseudoLegalMoves(board, square, piece, out);
            case KING -> {
                King.generatePseudoLegalMoves(board, square, piece, out);
                King.generateCastleMoves(game, square, piece, out);
            }
        }
    }

    private static boolean isLegal(Board board, Move move, Color side) {
        MovePlayed movePlayed = board.playMove(move);
        try {
            Square kingSquare = board.getKingSquare(side);
            return kingSquare == null || !AttackDetector.isSquareAttacked(board, kingSquare, side.getOppositeColor());
        } finally {
            board.undoMove(movePlayed);
        }
    }

    /** Finds the side to move's legal move matching the given squares and promotion, or null if there is none. */
    public static Move findLegalMove(Game game, Square from, Square to, PieceType promotion) {
        Piece piece = game.board().get(from);
        if(piece == null || piece.color() != game.currentPlayer()) {
            return null;
        }
        for(Move move : legalMovesFrom(game, from)) {
            if(move.to().equals(to) && move.promotion() == promotion) {
                return move;
            }
        }
        return null;
    }
}
