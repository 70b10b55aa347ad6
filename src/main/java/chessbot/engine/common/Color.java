package chessbot.engine.common;

public enum Color {
    WHITE, BLACK;

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    public boolean isWhite() {
        return this == WHITE;
    }

    // Direction a pawn of this color walks along the ranks
    public int forward() {
        return this == WHITE ? 1 : -1;
    }

    public int homeRank() {
        return this == WHITE ? 0 : 7;
    }
}
