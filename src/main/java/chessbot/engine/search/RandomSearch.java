package chessbot.engine.search;

import chessbot.engine.game.Game;
import chessbot.engine.game.GameChanges;
import chessbot.engine.movegen.Move;

import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Weighted random pick among the legal moves. Every move weighs 1; captures, promotions,
 * checks and moves into the central 4x4 block weigh more. Depth and time are ignored.
 */
public class RandomSearch implements SearchStrategy {
    static final double BASE_WEIGHT = 1.0;
    static final double CAPTURE_BONUS = 3.0;
    static final double PROMOTION_BONUS = 4.0;
    static final double CHECK_BONUS = 2.0;
    static final double CENTER_BONUS = 0.5;

    private final Random random;

    public RandomSearch() {
        this(new Random());
    }

    public RandomSearch(Random random) {
        this.random = random;
    }

    @Override
    public SearchResult findBestMove(Game game, int depth, long budgetNs, AtomicBoolean stop, Consumer<String> out) {
        long start = System.nanoTime();
        Move move = pickNextMove(game);
        long timeMs = Math.max(1, (System.nanoTime() - start) / 1_000_000);
        if(move == null) {
            return SearchResult.noMove(0);
        }
        return new SearchResult(move, 0, 1, 1, timeMs, 1000L / timeMs, List.of(move));
    }

    public Move pickNextMove(Game game) {
        List<Move> moves = game.getLegalMoves();
        if(moves.isEmpty()) {
            return null;
        }

        double[] weights = new double[moves.size()];
        double totalWeight = 0;
        for(int i = 0; i < moves.size(); i++) {
            weights[i] = weight(game, moves.get(i));
            totalWeight += weights[i];
        }

        double r = random.nextDouble() * totalWeight;
        double cumulativeWeight = 0;
        for(int i = 0; i < moves.size(); i++) {
            cumulativeWeight += weights[i];
            if(cumulativeWeight >= r) {
                return moves.get(i);
            }
        }
        // Only reachable through floating point rounding
        return moves.get(moves.size() - 1);
    }

    static double weight(Game game, Move move) {
        double weight = BASE_WEIGHT;
        if(move.isCapture()) {
            weight += CAPTURE_BONUS;
        }
        if(move.isPromotion()) {
            weight += PROMOTION_BONUS;
        }
        if(givesCheck(game, move)) {
            weight += CHECK_BONUS;
        }
        int file = move.to().file();
        int rank = move.to().rank();
        if(file >= 2 && file <= 5 && rank >= 2 && rank <= 5) {
            weight += CENTER_BONUS;
        }
        return weight;
    }

    private static boolean givesCheck(Game game, Move move) {
        GameChanges gameChanges = game.playMove(move);
        try {
            return game.inCheck();
        } finally {
            game.undoMove(gameChanges);
        }
    }
}
