package chessbot.engine.movegen.pieces;

import chessbot.engine.common.Square;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;
import chessbot.engine.movegen.Move;

import java.util.List;

public final class Bishop {
    private Bishop() {}

    public static void generatePseudoLegalMoves(Board board, Square from, Piece piece, List<Move> out) {
        SlidingMoves.generate(board, from, piece, SlidingMoves.DIAGONAL_DIRECTIONS, out);
    }

    public static int countPseudoLegalMoves(Board board, Square from, Piece piece) {
        return SlidingMoves.count(board, from, piece, SlidingMoves.DIAGONAL_DIRECTIONS);
    }
}
