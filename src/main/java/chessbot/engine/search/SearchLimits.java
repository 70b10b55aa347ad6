package chessbot.engine.search;

/**
 * What the caller allows for one search. -1 means "not given" for every field.
 *
 * @param depth      maximum depth in plies
 * @param moveTimeMs exact time for this move
 * @param wtime      White's remaining clock
 * @param btime      Black's remaining clock
 * @param infinite   search until stopped (or until the depth cap)
 */
public record SearchLimits(int depth, long moveTimeMs, long wtime, long btime, boolean infinite) {
    public static final SearchLimits DIFFICULTY_DEFAULTS = new SearchLimits(-1, -1, -1, -1, false);

    public static SearchLimits ofDepth(int depth) {
        return new SearchLimits(depth, -1, -1, -1, false);
    }

    public static SearchLimits ofMoveTime(long moveTimeMs) {
        return new SearchLimits(-1, moveTimeMs, -1, -1, false);
    }
}
