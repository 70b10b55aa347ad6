package chessbot.engine.exceptions;

import chessbot.engine.common.Square;

public class NoActiveSelectionException extends ChessRuleException {
    public NoActiveSelectionException(Square destination) {
        super("Destination " + destination + " clicked while no piece is selected");
    }
}
