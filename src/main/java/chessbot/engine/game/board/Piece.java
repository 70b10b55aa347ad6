package chessbot.engine.game.board;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;

/**
 * A piece standing on the board. Its square and moved flag are only changed by {@link Board},
 * which keeps {@link #square()} equal to the slot holding the piece.
 */
public final class Piece {
    private final PieceType type;
    private final Color color;
    private Square square;
    private boolean hasMoved;

    public Piece(PieceType type, Color color) {
        this(type, color, false);
    }

    public Piece(PieceType type, Color color, boolean hasMoved) {
        this.type = type;
        this.color = color;
        this.hasMoved = hasMoved;
    }

    public PieceType type() {
        return type;
    }

    public Color color() {
        return color;
    }

    /** Null while the piece is off the board. */
    public Square square() {
        return square;
    }

    public boolean hasMoved() {
        return hasMoved;
    }

    public boolean is(PieceType type, Color color) {
        return this.type == type && this.color == color;
    }

    void setSquare(Square square) {
        this.square = square;
    }

    void setMoved(boolean hasMoved) {
        this.hasMoved = hasMoved;
    }

    // Same kind, color and moved flag, wherever the pieces stand
    boolean sameAs(Piece other) {
        return other != null && type == other.type && color == other.color && hasMoved == other.hasMoved;
    }

    /** FEN letter: uppercase for white, lowercase for black. */
    public char toFenLetter() {
        return color.isWhite() ? Character.toUpperCase(type.letter()) : type.letter();
    }

    @Override
    public String toString() {
        return color + " " + type + (square == null ? "" : " on " + square);
    }
}
