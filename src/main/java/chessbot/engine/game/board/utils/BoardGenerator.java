package chessbot.engine.game.board.utils;

import chessbot.engine.game.Game;
import chessbot.engine.utils.notations.FENUtils;

public class BoardGenerator {
    public static final String STANDARD_GAME = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";

    private BoardGenerator() {}

    public static Game newStandardGameBoard() {
        return FENUtils.getBoardFrom(STANDARD_GAME);
    }

    public static Game from(String FEN) {
        return FENUtils.getBoardFrom(FEN);
    }
}
