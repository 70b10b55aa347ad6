package chessbot.engine.common;

import chessbot.engine.exceptions.InvalidSquareException;

/**
 * A board coordinate. {@code file} 0..7 is a..h, {@code rank} 0..7 is 1..8 and
 * {@code index = rank * 8 + file}, so a1 is 0 and h8 is 63.
 * Instances are interned: there is exactly one Square per coordinate.
 */
public final class Square {
    private static final Square[] SQUARES = new Square[64];
    static {
        for(int i = 0; i < 64; i++) {
            SQUARES[i] = new Square(i & 7, i >>> 3);
        }
    }

    public static boolean isWithinBounds(int file, int rank) {
        return file >= 0 && file < 8 && rank >= 0 && rank < 8;
    }

    public static Square of(int file, int rank) {
        if(!isWithinBounds(file, rank)) {
            throw new InvalidSquareException(file, rank);
        }
        return SQUARES[rank * 8 + file];
    }

    public static Square of(int index) {
        if(index < 0 || index >= 64) {
            throw new InvalidSquareException(index);
        }
        return SQUARES[index];
    }

    public static Square fromAlgebraic(String square) {
        if(square == null || square.length() != 2) {
            throw new InvalidSquareException(square);
        }
        int file = square.charAt(0) - 'a';
        int rank = square.charAt(1) - '1';
        if(!isWithinBounds(file, rank)) {
            throw new InvalidSquareException(square);
        }
        return SQUARES[rank * 8 + file];
    }

    private final int file;
    private final int rank;
    private final int index;

    private Square(int file, int rank) {
        this.file = file;
        this.rank = rank;
        this.index = rank * 8 + file;
    }

    public int file() {
        return file;
    }

    public int rank() {
        return rank;
    }

    public int index() {
        return index;
    }

    // Returns null when the offset leaves the board, which is how generators detect the edge
    public Square offset(int fileDelta, int rankDelta) {
        int f = file + fileDelta;
        int r = rank + rankDelta;
        if(!isWithinBounds(f, r)) {
            return null;
        }
        return SQUARES[r * 8 + f];
    }

    public String toAlgebraic() {
        return "" + (char) ('a' + file) + (char) ('1' + rank);
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj) return true;
        if(!(obj instanceof Square other)) return false;
        return index == other.index;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return toAlgebraic();
    }
}
