package chessbot.engine.movegen;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;
import chessbot.engine.movegen.pieces.Pawn;

/**
 * Answers "is this square attacked by that color" by looking outward from the square:
 * pawn diagonals, knight and king offsets, then each ray up to its first blocker.
 * Castling never attacks anything, so this never calls back into move generation.
 */
public final class AttackDetector {
    private static final int[][] KNIGHT_OFFSETS = {
            {1, 2}, {2, 1}, {2, -1}, {1, -2}, {-1, -2}, {-2, -1}, {-2, 1}, {-1, 2}
    };
    private static final int[][] KING_OFFSETS = {
            {0, 1}, {1, 1}, {1, 0}, {1, -1}, {0, -1}, {-1, -1}, {-1, 0}, {-1, 1}
    };
    private static final int[][] ORTHOGONAL_DIRECTIONS = {{0, 1}, {1, 0}, {0, -1}, {-1, 0}};
    private static final int[][] DIAGONAL_DIRECTIONS = {{1, 1}, {1, -1}, {-1, -1}, {-1, 1}};

    private AttackDetector() {}

    public static boolean isSquareAttacked(Board board, Square square, Color byColor) {
        // A pawn of byColor attacks from one rank behind, seen from its own direction of travel
        int pawnRank = -byColor.forward();
        for(int side = -1; side <= 1; side += 2) {
            Square from = square.offset(side, pawnRank);
            if(from != null && isPiece(board.get(from), PieceType.PAWN, byColor)
                    && Pawn.attacks(byColor, from, square)) {
                return true;
            }
        }

        for(int[] offset : KNIGHT_OFFSETS) {
            Square from = square.offset(offset[0], offset[1]);
            if(from != null && isPiece(board.get(from), PieceType.KNIGHT, byColor)) {
                return true;
            }
        }

        for(int[] offset : KING_OFFSETS) {
            Square from = square.offset(offset[0], offset[1]);
            if(from != null && isPiece(board.get(from), PieceType.KING, byColor)) {
                return true;
            }
        }

        return isAttackedAlongRays(board, square, byColor, ORTHOGONAL_DIRECTIONS, PieceType.ROOK)
                || isAttackedAlongRays(board, square, byColor, DIAGONAL_DIRECTIONS, PieceType.BISHOP);
    }

    private static boolean isAttackedAlongRays(Board board, Square square, Color byColor,
                                               int[][] directions, PieceType slider) {
        for(int[] direction : directions) {
            Square from = square.offset(direction[0], direction[1]);
            while(from != null) {
                Piece piece = board.get(from);
                if(piece != null) {
                    if(piece.color() == byColor && (piece.type() == slider || piece.type() == PieceType.QUEEN)) {
                        return true;
                    }
                    break;
                }
                from = from.offset(direction[0], direction[1]);
            }
        }
        return false;
    }

    private static boolean isPiece(Piece piece, PieceType type, Color color) {
        return piece != null && piece.is(type, color);
    }
}
