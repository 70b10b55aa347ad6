package chessbot.engine.exceptions;

/**
 * Base of every rejection raised by the rules engine. All of them are recoverable:
 * the operation is refused and the game is left untouched.
 */
public abstract class ChessRuleException extends RuntimeException {
    protected ChessRuleException(String message) {
        super(message);
    }
}
