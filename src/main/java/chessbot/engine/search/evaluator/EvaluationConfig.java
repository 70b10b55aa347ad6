package chessbot.engine.search.evaluator;

/** Weights applied to each evaluation term. Immutable, build with {@link Builder}. */
public final class EvaluationConfig {
    public static final EvaluationConfig DEFAULT = new Builder().build();

    public final double materialWeight;
    public final double positionWeight;
    public final double pawnStructureWeight;
    public final double centerControlWeight;
    public final double kingSafetyWeight;
    public final double mobilityWeight;

    private EvaluationConfig(Builder b) {
        materialWeight = b.materialWeight;
        positionWeight = b.positionWeight;
        pawnStructureWeight = b.pawnStructureWeight;
        centerControlWeight = b.centerControlWeight;
        kingSafetyWeight = b.kingSafetyWeight;
        mobilityWeight = b.mobilityWeight;
    }

    @Override
    public String toString() {
        return "EvaluationConfig{material=" + materialWeight
                + ", position=" + positionWeight
                + ", pawnStructure=" + pawnStructureWeight
                + ", centerControl=" + centerControlWeight
                + ", kingSafety=" + kingSafetyWeight
                + ", mobility=" + mobilityWeight + '}';
    }

    public static class Builder {
        private double materialWeight = 1.0;
        private double positionWeight = 0.3;
        private double pawnStructureWeight = 0.2;
        private double centerControlWeight = 0.1;
        private double kingSafetyWeight = 0.0;
        private double mobilityWeight = 0.0;

        public Builder materialWeight(double v){materialWeight=checked(v);return this;}
        public Builder positionWeight(double v){positionWeight=checked(v);return this;}
        public Builder pawnStructureWeight(double v){pawnStructureWeight=checked(v);return this;}
        public Builder centerControlWeight(double v){centerControlWeight=checked(v);return this;}
        public Builder kingSafetyWeight(double v){kingSafetyWeight=checked(v);return this;}
        public Builder mobilityWeight(double v){mobilityWeight=checked(v);return this;}
        public EvaluationConfig build(){return new EvaluationConfig(this);}

        private static double checked(double weight) {
            if(weight < 0 || Double.isNaN(weight)) {
                throw new IllegalArgumentException("Evaluation weights must be non-negative, got " + weight);
            }
            return weight;
        }
    }
}
