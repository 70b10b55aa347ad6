package chessbot.engine.search;

import chessbot.engine.game.Game;
import chessbot.engine.movegen.Move;
import chessbot.engine.utils.notations.FENUtils;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Entry point of the search: turns a difficulty and the caller's limits into a depth and a time
 * budget, runs the difficulty's strategy and, in debug mode, checks that the game came back untouched.
 */
public final class SearchFacade {

    private final SearchConfig cfg;
    private Difficulty difficulty;
    private SearchStrategy strategy;

    public SearchFacade(SearchConfig cfg, Difficulty difficulty) {
        this(cfg, difficulty, difficulty.createStrategy(cfg));
    }

    public SearchFacade(SearchConfig cfg, Difficulty difficulty, SearchStrategy strategy) {
        this.cfg = cfg;
        this.difficulty = difficulty;
        this.strategy = strategy;
    }

    public Difficulty difficulty() {
        return difficulty;
    }

    public void setDifficulty(Difficulty difficulty) {
        if(this.difficulty != difficulty) {
            this.difficulty = difficulty;
            this.strategy = difficulty.createStrategy(cfg);
        }
    }

    /** Search with the difficulty's depth and the given budget, without progress output. */
    public SearchResult findBestMove(Game game, Duration timeBudget) {
        SearchLimits limits = new SearchLimits(-1, timeBudget.toMillis(), -1, -1, false);
        return findBestMove(game, new AtomicBoolean(false), limits, line -> {});
    }

    public SearchResult findBestMove(Game game, AtomicBoolean stop, SearchLimits limits, Consumer<String> out) {
        final int depth = computeDepth(limits);
        final long fallbackNs = limits.infinite() || limits.depth() != -1
                ? cfg.maxHardCapNs
                : difficulty.thinkingTime().toNanos();
        final long clockMs = game.currentPlayer().isWhite() ? limits.wtime() : limits.btime();
        final long budgetNs = TimeControl.computeBudgetNs(limits.moveTimeMs(), clockMs, fallbackNs);

        System.err.println("Searching " + difficulty + " depth " + depth + " budget " + budgetNs / 1_000_000 + "ms");

        String fenBefore = cfg.debug ? FENUtils.getFENFromBoard(game) : null;
        long keyBefore = game.zobristKey();

        SearchResult sr = strategy.findBestMove(game, depth, budgetNs, stop, out);

        if(cfg.debug) {
            verify(game, sr, fenBefore, keyBefore);
        }
        return sr;
    }

    private int computeDepth(SearchLimits limits) {
        if(limits.depth() != -1) {
            return Math.max(1, Math.min(limits.depth(), cfg.maxDepth));
        }
        if(limits.infinite()) {
            return cfg.maxDepth;
        }
        return difficulty.depth();
    }

    private static void verify(Game game, SearchResult sr, String fenBefore, long keyBefore) {
        String fenAfter = FENUtils.getFENFromBoard(game);
        if(!fenAfter.equals(fenBefore) || game.zobristKey() != keyBefore) {
            throw new IllegalStateException("Search did not restore the game: " + fenBefore + " became " + fenAfter);
        }
        Move mv = sr.move();
        if(mv != null) {
            if(!game.getLegalMoves().contains(mv)) {
                throw new IllegalStateException("Illegal bestMove: " + mv);
            }
            // PV head must match bestMove when present
            List<Move> pv = sr.principalVariation();
            if(!pv.isEmpty() && !pv.get(0).equals(mv)) {
                throw new IllegalStateException("BestMove/PV mismatch: " + mv + " vs " + pv.get(0));
            }
        }
    }
}
