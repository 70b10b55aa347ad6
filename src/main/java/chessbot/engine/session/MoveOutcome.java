package chessbot.engine.session;

import chessbot.engine.common.PieceType;
import chessbot.engine.movegen.Move;

/**
 * What happened when a move was applied. The flags describe the position after the move,
 * from the point of view of the side now to move.
 *
 * @param captured type of the piece taken, null if none
 */
public record MoveOutcome(Move move, PieceType captured, boolean check, boolean checkmate,
                          boolean stalemate, boolean draw) {

    public boolean isGameOver() {
        return checkmate || stalemate || draw;
    }
}
