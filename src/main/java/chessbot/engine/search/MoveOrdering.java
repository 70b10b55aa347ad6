package chessbot.engine.search;

import chessbot.engine.movegen.Move;
import chessbot.engine.search.evaluator.PieceValues;

import java.util.Comparator;
import java.util.List;

/**
 * Captures and promotions first, most valuable victim / least valuable attacker.
 * The sort is stable, so quiet moves and equally scored captures keep their generation order.
 */
final class MoveOrdering {
    private static final int QUIET_SCORE = Integer.MIN_VALUE;
    private static final Comparator<Move> BY_SCORE_DESC =
            Comparator.comparingInt(MoveOrdering::score).reversed();

    private MoveOrdering() {}

    static void orderCapturesFirst(List<Move> moves) {
        moves.sort(BY_SCORE_DESC);
    }

    static int score(Move move) {
        if(!move.isCapture() && !move.isPromotion()) {
            return QUIET_SCORE;
        }
        int score = 0;
        if(move.isCapture()) {
            score += 10 * PieceValues.valueOf(move.captured()) - PieceValues.valueOf(move.pieceType()) / 10;
        }
        if(move.isPromotion()) {
            score += PieceValues.valueOf(move.promotion());
        }
        return score;
    }
}
