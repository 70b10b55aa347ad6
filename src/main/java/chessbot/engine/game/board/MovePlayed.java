package chessbot.engine.game.board;

import chessbot.engine.common.Square;
import chessbot.engine.movegen.Move;

/**
 * Everything {@link Board#undoMove(MovePlayed)} needs to restore the board exactly as it was
 * before {@link Board#playMove(Move)}.
 */
public record MovePlayed(Move move, Piece piece, boolean previousHasMoved,
                         Piece pieceEaten, Square pieceEatenSquare,
                         Piece rook, Square rookFrom, Square rookTo, boolean previousRookHasMoved,
                         Piece promotedPiece, Square previousEnPassantSquare) {

    public boolean isCapture() {
        return pieceEaten != null;
    }

    public boolean isCastle() {
        return rook != null;
    }
}
