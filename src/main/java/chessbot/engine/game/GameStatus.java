package chessbot.engine.game;

/** State of the game from the side to move's point of view. */
public enum GameStatus {
    ACTIVE,
    CHECK,
    CHECKMATE,
    STALEMATE,
    DRAW;

    public boolean isOver() {
        return this == CHECKMATE || this == STALEMATE || this == DRAW;
    }
}
