package chessbot.engine.search.evaluator;

import chessbot.engine.common.Color;
import chessbot.engine.game.board.Board;
import chessbot.engine.movegen.MoveGenerator;

// Pseudo-legal move count difference, castling left out
public class Mobility implements EvaluationTerm {
    @Override
    public int evaluate(Board board) {
        return MoveGenerator.countPseudoLegalMoves(board, Color.WHITE)
                - MoveGenerator.countPseudoLegalMoves(board, Color.BLACK);
    }
}
