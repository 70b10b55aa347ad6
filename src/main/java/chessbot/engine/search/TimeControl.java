package chessbot.engine.search;

import java.util.concurrent.atomic.AtomicBoolean;

final class TimeControl {
    private TimeControl() {}

    /**
     * Budget for one move. An explicit move time wins, then 2% of the remaining clock,
     * then the fallback given by the caller.
     *
     * @param moveTimeMs -1 when not given
     * @param clockMs    remaining time of the side to move, -1 when not given
     */
    static long computeBudgetNs(long moveTimeMs, long clockMs, long fallbackNs) {
        long ms = moveTimeMs;
        if(ms != -1) {
            if(ms <= 10) ms = 10;
            else ms -= 10;
            return ms * 1_000_000L;
        }
        if(clockMs != -1) return Math.max(1L, 2L * clockMs / 100L) * 1_000_000L; // 2% of remaining
        return fallbackNs;
    }

    static boolean aborted(AtomicBoolean stop, long startNs, long budgetNs) {
        return stop.get() || System.nanoTime() - startNs >= budgetNs;
    }
}
