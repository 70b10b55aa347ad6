package chessbot.engine.game;

import chessbot.engine.game.board.MovePlayed;

/**
 * Everything {@link Game#undoMove(GameChanges)} needs to put the game back as it was before a move:
 * the board delta plus the game level state the move may have changed.
 */
public record GameChanges(MovePlayed movePlayed, int previousHalfMoveClock, int previousFullMoveClock,
                          boolean previousWhiteCanCastleKingSide, boolean previousWhiteCanCastleQueenSide,
                          boolean previousBlackCanCastleKingSide, boolean previousBlackCanCastleQueenSide,
                          GameStatus previousStatus) {
}
