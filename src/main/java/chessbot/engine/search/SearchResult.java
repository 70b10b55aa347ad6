package chessbot.engine.search;

import chessbot.engine.movegen.Move;
import chessbot.engine.utils.notations.MoveIOUtils;

import java.util.List;

/**
 * Outcome of a search. {@code move} is null only when the root position has no legal move.
 *
 * @param depth last fully completed depth
 */
public record SearchResult(Move move, int score, int depth, long nodes, long timeMs, long nps,
                           List<Move> principalVariation) {

    public SearchResult {
        principalVariation = List.copyOf(principalVariation);
    }

    public static SearchResult noMove(int score) {
        return new SearchResult(null, score, 0, 0, 0, 0, List.of());
    }

    @Override
    public String toString() {
        return "SearchResult\n" +
                "best move: " + MoveIOUtils.writeAlgebraicNotation(move) + "\n" +
                "score: " + score + "\n" +
                "depth: " + depth + "\n" +
                "search time (ms): " + timeMs + "\n" +
                "nodes/sec: " + nps + "\n" +
                "PV: " + MoveIOUtils.writeAlgebraicNotation(principalVariation);
    }

    public String toUCIInfo() {
        StringBuilder sb = new StringBuilder("info")
                .append(" depth ").append(depth)
                .append(" time ").append(timeMs)
                .append(" score cp ").append(score)
                .append(" nps ").append(nps)
                .append(" nodes ").append(nodes);
        if(!principalVariation.isEmpty()) {
            sb.append(" pv ").append(MoveIOUtils.writeAlgebraicNotation(principalVariation));
        }
        return sb.toString();
    }
}
