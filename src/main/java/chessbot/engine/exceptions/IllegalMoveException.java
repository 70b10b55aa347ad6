package chessbot.engine.exceptions;

import chessbot.engine.movegen.Move;

public class IllegalMoveException extends ChessRuleException {
    private final transient Move move;

    public IllegalMoveException(Move move) {
        super("Move " + move + " is not legal in the current position");
        this.move = move;
    }

    public IllegalMoveException(String message) {
        super(message);
        this.move = null;
    }

    public Move getMove() {
        return move;
    }
}
