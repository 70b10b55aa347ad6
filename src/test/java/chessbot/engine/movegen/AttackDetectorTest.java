package chessbot.engine.movegen;

import chessbot.engine.common.Color;
import chessbot.engine.common.Square;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.utils.BoardGenerator;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AttackDetectorTest {

    private static Square sq(String notation) {
        return Square.fromAlgebraic(notation);
    }

    @Test
    public void pawnsShouldAttackDiagonallyForwardEvenOnEmptySquares() {
        Board board = BoardGenerator.from("4k3/8/8/4p3/4P3/8/8/4K3 w - - 0 1").board();

        assertTrue(AttackDetector.isSquareAttacked(board, sq("d5"), Color.WHITE));
        assertTrue(AttackDetector.isSquareAttacked(board, sq("f5"), Color.WHITE));
        assertFalse(AttackDetector.isSquareAttacked(board, sq("e5"), Color.WHITE));
        assertFalse(AttackDetector.isSquareAttacked(board, sq("d3"), Color.WHITE));

        assertTrue(AttackDetector.isSquareAttacked(board, sq("d4"), Color.BLACK));
        assertTrue(AttackDetector.isSquareAttacked(board, sq("f4"), Color.BLACK));
        assertFalse(AttackDetector.isSquareAttacked(board, sq("f6"), Color.BLACK));
    }

    @Test
    public void slidersShouldStopAtTheFirstBlocker() {
        Board board = BoardGenerator.from("4k3/8/8/8/R2n4/8/8/4K2B w - - 0 1").board();

        assertTrue(AttackDetector.isSquareAttacked(board, sq("d4"), Color.WHITE));
        assertFalse(AttackDetector.isSquareAttacked(board, sq("h4"), Color.WHITE));
        assertTrue(AttackDetector.isSquareAttacked(board, sq("a8"), Color.WHITE));
        // Bishop h1 along the long diagonal, d4 knight is not in its way to e4
        assertTrue(AttackDetector.isSquareAttacked(board, sq("e4"), Color.WHITE));
    }

    @Test
    public void knightsAndKingsShouldAttackTheirOffsets() {
        Board board = BoardGenerator.from("4k3/8/8/8/3n4/8/8/4K3 w - - 0 1").board();

        assertTrue(AttackDetector.isSquareAttacked(board, sq("e2"), Color.BLACK));
        assertTrue(AttackDetector.isSquareAttacked(board, sq("c6"), Color.BLACK));
        assertTrue(AttackDetector.isSquareAttacked(board, sq("d7"), Color.BLACK));
        assertFalse(AttackDetector.isSquareAttacked(board, sq("d5"), Color.BLACK));
        assertTrue(AttackDetector.isSquareAttacked(board, sq("f2"), Color.WHITE));
    }

    @Test
    public void queensShouldAttackAlongBothKindsOfRays() {
        Board board = BoardGenerator.from("8/8/8/8/3Q4/8/8/k7 w - - 0 1").board();

        assertTrue(AttackDetector.isSquareAttacked(board, sq("h8"), Color.WHITE));
        assertTrue(AttackDetector.isSquareAttacked(board, sq("d1"), Color.WHITE));
        assertFalse(AttackDetector.isSquareAttacked(board, sq("e6"), Color.WHITE));
        assertFalse(AttackDetector.isSquareAttacked(board, sq("d4"), Color.WHITE));
        assertTrue(AttackDetector.isSquareAttacked(board, sq("b2"), Color.BLACK));
    }
}
