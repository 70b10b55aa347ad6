package chessbot.engine.exceptions;

public class InvalidSquareException extends ChessRuleException {
    public InvalidSquareException(int file, int rank) {
        super("Square out of board bounds: file=" + file + ", rank=" + rank);
    }

    public InvalidSquareException(int index) {
        super("Square index out of board bounds: " + index);
    }

    public InvalidSquareException(String notation) {
        super("Invalid square '" + notation + "', expected format 'a1'..'h8'");
    }
}
