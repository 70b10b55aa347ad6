package chessbot.engine.utils.notations;

import chessbot.engine.common.PieceType;
import chessbot.engine.exceptions.IllegalMoveException;
import chessbot.engine.game.Game;
import chessbot.engine.game.board.utils.BoardGenerator;
import chessbot.engine.movegen.Move;
import chessbot.engine.movegen.MoveKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MoveIOUtilsTest {

    @Test
    public void parseShouldResolveTheLegalMove() {
        Game game = BoardGenerator.newStandardGameBoard();

        Move move = MoveIOUtils.parseUciMove(game, "g1f3");

        assertEquals(PieceType.KNIGHT, move.pieceType());
        assertEquals(MoveKind.NORMAL, move.kind());
        assertEquals("g1f3", MoveIOUtils.writeAlgebraicNotation(move));
    }

    @Test
    public void promotionLetterShouldPickThePromotion() {
        Game game = BoardGenerator.from("8/P6k/8/8/8/8/8/K7 w - - 0 1");

        assertEquals(PieceType.ROOK, MoveIOUtils.parseUciMove(game, "a7a8r").promotion());
        assertEquals(PieceType.QUEEN, MoveIOUtils.parseUciMove(game, "a7a8Q").promotion());
        assertEquals("a7a8q", MoveIOUtils.writeAlgebraicNotation(MoveIOUtils.parseUciMove(game, "a7a8q")));
        // A promotion needs its letter
        assertThrows(IllegalMoveException.class, () -> MoveIOUtils.parseUciMove(game, "a7a8"));
    }

    @Test
    public void castlingShouldBeWrittenAsTheKingMove() {
        Game game = BoardGenerator.from("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");

        Move castle = MoveIOUtils.parseUciMove(game, "e1c1");

        assertEquals(MoveKind.CASTLE, castle.kind());
        assertEquals("e1c1", castle.toString());
    }

    @Test
    public void badTextShouldBeRejected() {
        Game game = BoardGenerator.newStandardGameBoard();

        assertThrows(IllegalArgumentException.class, () -> MoveIOUtils.parseUciMove(game, null));
        assertThrows(IllegalArgumentException.class, () -> MoveIOUtils.parseUciMove(game, "e2"));
        assertThrows(IllegalArgumentException.class, () -> MoveIOUtils.parseUciMove(game, "z2e4"));
        assertThrows(IllegalArgumentException.class, () -> MoveIOUtils.parseUciMove(game, "e7e8x"));
        assertThrows(IllegalMoveException.class, () -> MoveIOUtils.parseUciMove(game, "e2e5"));
        assertThrows(IllegalMoveException.class, () -> MoveIOUtils.parseUciMove(game, "e7e5"));
    }

    @Test
    public void nullMoveShouldBeWrittenAsZeros() {
        assertEquals("0000", MoveIOUtils.writeAlgebraicNotation((Move) null));
    }

    @Test
    public void moveListShouldBeSpaceSeparated() {
        Game game = BoardGenerator.newStandardGameBoard();
        game.playMoves("e2e4 e7e5 g1f3");

        assertEquals("e2e4 e7e5 g1f3", MoveIOUtils.writeAlgebraicNotation(game.getMoveHistory()));
        assertEquals("", MoveIOUtils.writeAlgebraicNotation(List.of()));
    }
}
