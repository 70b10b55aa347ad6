package chessbot.engine.search.evaluator;

import chessbot.engine.common.Color;
import chessbot.engine.game.Game;
import chessbot.engine.game.board.Board;

import java.util.List;

/**
 * Static evaluation: the weighted sum of the evaluation terms, rounded to centipawns,
 * from the point of view of the requested color. Terms with a zero weight are not computed.
 */
public final class PositionEvaluator {
    public record WeightedTerm(EvaluationTerm term, double weight) {}

    private static final EvaluationTerm MATERIAL = new PieceValues();
    private static final EvaluationTerm POSITION = new PieceSquareTables();
    private static final EvaluationTerm PAWN_STRUCTURE = new PawnStructure();
    private static final EvaluationTerm CENTER_CONTROL = new CenterControl();
    private static final EvaluationTerm KING_SAFETY = new KingSafety();
    private static final EvaluationTerm MOBILITY = new Mobility();

    private final List<WeightedTerm> terms;

    public PositionEvaluator(EvaluationConfig config) {
        this(List.of(
                new WeightedTerm(MATERIAL, config.materialWeight),
                new WeightedTerm(POSITION, config.positionWeight),
                new WeightedTerm(PAWN_STRUCTURE, config.pawnStructureWeight),
                new WeightedTerm(CENTER_CONTROL, config.centerControlWeight),
                new WeightedTerm(KING_SAFETY, config.kingSafetyWeight),
                new WeightedTerm(MOBILITY, config.mobilityWeight)));
    }

    public PositionEvaluator(List<WeightedTerm> terms) {
        this.terms = List.copyOf(terms);
    }

    public int evaluate(Board board, Color perspective) {
        double score = 0;
        for(WeightedTerm weightedTerm : terms) {
            if(weightedTerm.weight() != 0) {
                score += weightedTerm.weight() * weightedTerm.term().evaluate(board);
            }
        }
        int whiteScore = (int) Math.round(score);
        return perspective == Color.WHITE ? whiteScore : -whiteScore;
    }

    /** Evaluation from the side to move's point of view, as the search wants it. */
    public int evaluate(Game game) {
        return evaluate(game.board(), game.currentPlayer());
    }

    public static int evaluate(Board board, Color perspective, EvaluationConfig config) {
        return new PositionEvaluator(config).evaluate(board, perspective);
    }
}
