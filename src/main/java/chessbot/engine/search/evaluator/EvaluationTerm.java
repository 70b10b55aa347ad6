package chessbot.engine.search.evaluator;

import chessbot.engine.game.board.Board;

/** One heuristic of the evaluation, in centipawns from White's point of view (White minus Black). */
@FunctionalInterface
public interface EvaluationTerm {
    int evaluate(Board board);
}
