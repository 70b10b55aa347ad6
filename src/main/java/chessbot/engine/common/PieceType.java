package chessbot.engine.common;

public enum PieceType {
    PAWN('p'), KNIGHT('n'), BISHOP('b'), ROOK('r'), QUEEN('q'), KING('k');

    public static final PieceType[] VALUES = PieceType.values();
    // Order in which promotion moves are generated
    public static final PieceType[] PROMOTIONS = {QUEEN, ROOK, BISHOP, KNIGHT};

    private final char letter;

    PieceType(char letter) {
        this.letter = letter;
    }

    /** Lowercase FEN letter, uppercase is up to the caller for white pieces. */
    public char letter() {
        return letter;
    }

    public static PieceType fromLetter(char letter) {
        return switch (Character.toLowerCase(letter)) {
            case 'p' -> PAWN;
            case 'n' -> KNIGHT;
            case 'b' -> BISHOP;
            case 'r' -> ROOK;
            case 'q' -> QUEEN;
            case 'k' -> KING;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
    }
}
