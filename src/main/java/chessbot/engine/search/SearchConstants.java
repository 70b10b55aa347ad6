package chessbot.engine.search;

public class SearchConstants {
    public static final int INF = 30000;

    // Nominal ply bound for principal variation arrays, well above any depth a difficulty asks for
    public static final int MAX_PLY = 64;

    private SearchConstants() {}
}
