package chessbot.engine.exceptions;

public class EmptyHistoryException extends ChessRuleException {
    public EmptyHistoryException() {
        super("No move to undo");
    }
}
