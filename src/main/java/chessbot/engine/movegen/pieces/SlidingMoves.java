package chessbot.engine.movegen.pieces;

import chessbot.engine.common.Square;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;
import chessbot.engine.movegen.Move;

import java.util.List;

// Ray walks shared by bishops, rooks and queens
final class SlidingMoves {
    static final int[][] DIAGONAL_DIRECTIONS = {{1, 1}, {1, -1}, {-1, -1}, {-1, 1}};
    static final int[][] ORTHOGONAL_DIRECTIONS = {{0, 1}, {1, 0}, {0, -1}, {-1, 0}};

    private SlidingMoves() {}

    static void generate(Board board, Square from, Piece piece, int[][] directions, List<Move> out) {
        for(int[] direction : directions) {
            Square to = from.offset(direction[0], direction[1]);
            while(to != null) {
                Piece occupant = board.get(to);
                if(occupant == null) {
                    out.add(Move.normal(from, to, piece.type()));
                } else {
                    if(occupant.color() != piece.color()) {
                        out.add(Move.capture(from, to, piece.type(), occupant.type()));
                    }
                    break;
                }
                to = to.offset(direction[0], direction[1]);
            }
        }
    }

    static int count(Board board, Square from, Piece piece, int[][] directions) {
        int count = 0;
        for(int[] direction : directions) {
            Square to = from.offset(direction[0], direction[1]);
            while(to != null) {
                Piece occupant = board.get(to);
                if(occupant != null) {
                    if(occupant.color() != piece.color()) count++;
                    break;
                }
                count++;
                to = to.offset(direction[0], direction[1]);
            }
        }
        return count;
    }
}
