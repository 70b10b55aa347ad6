package chessbot.engine.uci;

/** Engine should return this at the end of search. */
public final class UciResult {
    public static final String NULL_MOVE = "0000";

    public final String bestmove;

    public UciResult(String bestmove) {
        this.bestmove = bestmove;
    }

    public static UciResult best(String bm) { return new UciResult(bm); }

    public static UciResult none() { return new UciResult(NULL_MOVE); }
}
