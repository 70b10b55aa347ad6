package chessbot.engine.movegen.pieces;

import chessbot.engine.common.Square;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;
import chessbot.engine.movegen.Move;

import java.util.List;

public final class Knight {
    static final int[][] KNIGHT_OFFSETS = {
            {1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}
    };

    private Knight() {}

    public static void generatePseudoLegalMoves(Board board, Square from, Piece piece, List<Move> out) {
        for(int[] offset : KNIGHT_OFFSETS) {
            Square to = from.offset(offset[0], offset[1]);
            if(to == null) {
                continue;
            }
            Piece occupant = board.get(to);
            if(occupant == null) {
                out.add(Move.normal(from, to, piece.type()));
            } else if(occupant.color() != piece.color()) {
                out.add(Move.capture(from, to, piece.type(), occupant.type()));
            }
        }
    }

    public static int countPseudoLegalMoves(Board board, Square from, Piece piece) {
        int count = 0;
        for(int[] offset : KNIGHT_OFFSETS) {
            Square to = from.offset(offset[0], offset[1]);
            if(to != null) {
                Piece occupant = board.get(to);
                if(occupant == null || occupant.color() != piece.color()) count++;
            }
        }
        return count;
    }
}
