package chessbot.engine.search;

import chessbot.engine.search.evaluator.EvaluationConfig;
import chessbot.engine.search.evaluator.PositionEvaluator;

import java.time.Duration;
import java.util.Locale;

/** Playing strength: which strategy searches, how deep, for how long and with which evaluation weights. */
public enum Difficulty {
    BEGINNER(Algorithm.RANDOM, 1, Duration.ofSeconds(1), new EvaluationConfig.Builder()
            .materialWeight(1.0).positionWeight(0).pawnStructureWeight(0).centerControlWeight(0)
            .kingSafetyWeight(0).mobilityWeight(0).build()),
    EASY(Algorithm.MINIMAX, 2, Duration.ofSeconds(1), EvaluationConfig.DEFAULT),
    MEDIUM(Algorithm.ALPHA_BETA, 3, Duration.ofSeconds(2), EvaluationConfig.DEFAULT),
    HARD(Algorithm.ALPHA_BETA, 4, Duration.ofSeconds(3), new EvaluationConfig.Builder()
            .materialWeight(1.0).positionWeight(0.4).pawnStructureWeight(0.25).centerControlWeight(0.1)
            .kingSafetyWeight(0.2).mobilityWeight(0.1).build()),
    EXPERT(Algorithm.ALPHA_BETA, 5, Duration.ofSeconds(3), new EvaluationConfig.Builder()
            .materialWeight(1.0).positionWeight(0.5).pawnStructureWeight(0.3).centerControlWeight(0)
            .kingSafetyWeight(0.4).mobilityWeight(0.3).build());

    public enum Algorithm { RANDOM, MINIMAX, ALPHA_BETA }

    private final Algorithm algorithm;
    private final int depth;
    private final Duration thinkingTime;
    private final EvaluationConfig evaluationConfig;

    Difficulty(Algorithm algorithm, int depth, Duration thinkingTime, EvaluationConfig evaluationConfig) {
        this.algorithm = algorithm;
        this.depth = depth;
        this.thinkingTime = thinkingTime;
        this.evaluationConfig = evaluationConfig;
    }

    public Algorithm algorithm() {
        return algorithm;
    }

    public int depth() {
        return depth;
    }

    public Duration thinkingTime() {
        return thinkingTime;
    }

    public EvaluationConfig evaluationConfig() {
        return evaluationConfig;
    }

    public SearchStrategy createStrategy(SearchConfig cfg) {
        PositionEvaluator evaluator = new PositionEvaluator(evaluationConfig);
        return switch (algorithm) {
            case RANDOM -> new RandomSearch();
            case MINIMAX -> new MinimaxSearch(evaluator, cfg);
            case ALPHA_BETA -> new AlphaBetaSearch(evaluator, cfg);
        };
    }

    /** Case-insensitive lookup, as typed in a UCI option or a system property. */
    public static Difficulty fromName(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown difficulty " + name, e);
        }
    }
}
