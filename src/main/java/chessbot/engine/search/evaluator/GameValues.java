package chessbot.engine.search.evaluator;

public final class GameValues {
    public static final int CHECKMATE_VALUE = 29000;
    public static final int DRAW_VALUE = 0;
    public static final int STALEMATE_VALUE = DRAW_VALUE;

    private GameValues() {}
}
