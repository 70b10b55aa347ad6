package chessbot.engine.session;

import chessbot.engine.common.Square;
import chessbot.engine.movegen.Move;

import java.util.List;

/**
 * Result of a click on the board.
 *
 * @param selected   square now selected, null when the selection was cleared or a move was played
 * @param legalMoves legal moves of the selected piece, empty when nothing is selected
 * @param movePlayed the move the click played, null if it played none
 */
public record SelectionResult(Square selected, List<Move> legalMoves, MoveOutcome movePlayed) {
    static final SelectionResult CLEARED = new SelectionResult(null, List.of(), null);

    public SelectionResult {
        legalMoves = List.copyOf(legalMoves);
    }
}
