package chessbot.engine.search;

import chessbot.engine.game.Game;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Picks a move for the side to move. Implementations may play and undo moves on {@code game}
 * but must hand it back exactly as they received it.
 */
public interface SearchStrategy {

    /**
     * @param depth    maximum depth in plies
     * @param budgetNs wall-clock budget, only checked where the strategy allows interruption
     * @param stop     external stop request
     * @param out      receives UCI style progress lines
     */
    SearchResult findBestMove(Game game, int depth, long budgetNs, AtomicBoolean stop, Consumer<String> out);
}
