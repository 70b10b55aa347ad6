package chessbot.engine.movegen.pieces;

import chessbot.engine.common.Square;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;
import chessbot.engine.movegen.Move;

import java.util.List;

// A queen moves as a rook and a bishop combined, orthogonal rays first
public final class Queen {
    private Queen() {}

    public static void generatePseudoLegalMoves(Board board, Square from, Piece piece, List<Move> out) {
        Rook.generatePseudoLegalMoves(board, from, piece, out);
        Bishop.generatePseudoLegalMoves(board, from, piece, out);
    }

    public static int countPseudoLegalMoves(Board board, Square from, Piece piece) {
        return Rook.countPseudoLegalMoves(board, from, piece) + Bishop.countPseudoLegalMoves(board, from, piece);
    }
}
