package chessbot.engine.session;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.game.GameStatus;

import java.util.List;
import java.util.Map;

/**
 * Read-only view of the position for a presentation layer.
 *
 * @param captured pieces taken so far, keyed by the color that took them, in capture order
 */
public record BoardSnapshot(String fen, String ascii, Color sideToMove, boolean inCheck, GameStatus status,
                            Map<Color, List<PieceType>> captured) {
    public BoardSnapshot {
        captured = Map.copyOf(captured);
    }
}
