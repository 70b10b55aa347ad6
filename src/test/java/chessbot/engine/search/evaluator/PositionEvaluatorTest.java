package chessbot.engine.search.evaluator;

import chessbot.engine.common.Color;
import chessbot.engine.game.Game;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.utils.BoardGenerator;
import chessbot.engine.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PositionEvaluatorTest {
    private static final EvaluationConfig MATERIAL_ONLY = new EvaluationConfig.Builder()
            .materialWeight(1).positionWeight(0).pawnStructureWeight(0).centerControlWeight(0)
            .kingSafetyWeight(0).mobilityWeight(0).build();

    @Test
    public void startPositionShouldBeBalanced() {
        Board board = BoardGenerator.newStandardGameBoard().board();

        assertEquals(0, PositionEvaluator.evaluate(board, Color.WHITE, EvaluationConfig.DEFAULT));
        assertEquals(0, PositionEvaluator.evaluate(board, Color.BLACK, EvaluationConfig.DEFAULT));
        EvaluationConfig everything = new EvaluationConfig.Builder().kingSafetyWeight(1).mobilityWeight(1).build();
        assertEquals(0, PositionEvaluator.evaluate(board, Color.WHITE, everything));
    }

    @Test
    public void scoreShouldBeNegatedForBlack() {
        Board board = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/3QK3 w - - 0 1").board();

        assertEquals(900, PositionEvaluator.evaluate(board, Color.WHITE, MATERIAL_ONLY));
        assertEquals(-900, PositionEvaluator.evaluate(board, Color.BLACK, MATERIAL_ONLY));
    }

    @Test
    public void gameEvaluationShouldTakeTheSideToMove() {
        Game game = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/3QK3 b - - 0 1");
        PositionEvaluator evaluator = new PositionEvaluator(MATERIAL_ONLY);

        assertEquals(-900, evaluator.evaluate(game));
    }

    @Test
    public void weightedSumShouldBeRoundedOnce() {
        PositionEvaluator evaluator = new PositionEvaluator(List.of(
                new PositionEvaluator.WeightedTerm(board -> 15, 0.5),
                new PositionEvaluator.WeightedTerm(board -> 3, 0.1)));
        Board board = new Board();

        // 7.5 + 0.3 = 7.8
        assertEquals(8, evaluator.evaluate(board, Color.WHITE));
        assertEquals(-8, evaluator.evaluate(board, Color.BLACK));
    }

    @Test
    public void zeroWeightTermsShouldNotBeComputed() {
        PositionEvaluator evaluator = new PositionEvaluator(List.of(
                new PositionEvaluator.WeightedTerm(board -> 100, 1),
                new PositionEvaluator.WeightedTerm(board -> {
                    throw new AssertionError("Should not be evaluated");
                }, 0)));

        assertEquals(100, evaluator.evaluate(new Board(), Color.WHITE));
    }

    @Test
    public void negativeWeightsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> new EvaluationConfig.Builder().mobilityWeight(-0.1));
        assertThrows(IllegalArgumentException.class, () -> new EvaluationConfig.Builder().materialWeight(Double.NaN));
    }

    @Test
    public void defaultWeights() {
        EvaluationConfig config = EvaluationConfig.DEFAULT;

        assertEquals(1.0, config.materialWeight);
        assertEquals(0.3, config.positionWeight);
        assertEquals(0.2, config.pawnStructureWeight);
        assertEquals(0.1, config.centerControlWeight);
        assertEquals(0.0, config.kingSafetyWeight);
        assertEquals(0.0, config.mobilityWeight);
    }
}
