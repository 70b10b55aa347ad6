package chessbot.engine.search;

import chessbot.engine.game.Game;
import chessbot.engine.game.GameChanges;
import chessbot.engine.movegen.Move;
import chessbot.engine.movegen.MoveGenerator;
import chessbot.engine.search.evaluator.GameValues;
import chessbot.engine.search.evaluator.PositionEvaluator;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static chessbot.engine.search.SearchConstants.INF;
import static chessbot.engine.search.SearchConstants.MAX_PLY;

/**
 * Iterative deepening driver shared by the tree searches. Depths run from 1 upward; the clock
 * and the stop flag are looked at between root moves only, and never during depth 1, so a
 * result always exists when the root has a move. A depth cut short is thrown away.
 * Subclasses score a child node with {@link #negamax}.
 */
abstract class DepthFirstSearch implements SearchStrategy {
    protected final PositionEvaluator evaluator;
    protected final SearchConfig cfg;

    // Principal variation storage
    protected final Move[][] pv = new Move[MAX_PLY + 1][MAX_PLY + 1];
    protected final int[] pvLen = new int[MAX_PLY + 1];

    protected long nodes;

    protected DepthFirstSearch(PositionEvaluator evaluator, SearchConfig cfg) {
        this.evaluator = evaluator;
        this.cfg = cfg;
    }

    @Override
    public SearchResult findBestMove(Game game, int depth, long budgetNs, AtomicBoolean stop, Consumer<String> out) {
        final long start = System.nanoTime();
        final int maxDepth = Math.max(1, Math.min(depth, cfg.maxDepth));
        nodes = 0;

        List<Move> rootMoves = game.getLegalMoves();
        if(rootMoves.isEmpty()) {
            return SearchResult.noMove(game.inCheck() ? -GameValues.CHECKMATE_VALUE : GameValues.STALEMATE_VALUE);
        }

        SearchResult last = null;
        for(int currentDepth = 1; currentDepth <= maxDepth; currentDepth++) {
            boolean interruptible = currentDepth > 1;
            if(interruptible && TimeControl.aborted(stop, start, budgetNs)) break;

            SearchResult result = searchRoot(game, rootMoves, currentDepth, interruptible, stop, start, budgetNs);
            if(result == null) {
                out.accept("info string depth " + currentDepth + " interrupted, keeping depth " + last.depth());
                break;
            }
            last = result;
            out.accept(result.toUCIInfo());
        }
        return last;
    }

    private SearchResult searchRoot(Game game, List<Move> rootMoves, int depth, boolean interruptible,
                                    AtomicBoolean stop, long start, long budgetNs) {
        pvLen[0] = 0;
        Move bestMove = null;
        int bestScore = -INF;
        int alpha = -INF;
        final int beta = INF;

        for(Move move : rootMoves) {
            if(interruptible && TimeControl.aborted(stop, start, budgetNs)) {
                return null;
            }
            GameChanges gameChanges = game.playMove(move);
            int score = -negamax(game, depth - 1, 1, -beta, -alpha);
            game.undoMove(gameChanges);

            // Strictly better only: the first of equal moves in generation order is kept
            if(score > bestScore) {
                bestScore = score;
                bestMove = move;
                updatePv(0, move);
            }
            if(bestScore > alpha) alpha = bestScore;
        }

        long timeMs = Math.max(1, (System.nanoTime() - start) / 1_000_000);
        long nps = (nodes * 1000L) / timeMs;
        List<Move> pvLine = new ArrayList<>(pvLen[0]);
        for(int i = 0; i < pvLen[0]; i++) {
            pvLine.add(pv[0][i]);
        }
        return new SearchResult(bestMove, bestScore, depth, nodes, timeMs, nps, pvLine);
    }

    /** Score of the position for the side to move, searched {@code depth} more plies. */
    protected abstract int negamax(Game game, int depth, int ply, int alpha, int beta);

    /** Score at the depth horizon: mate and stalemate first, then draws by rule, then the static evaluation. */
    protected int leafScore(Game game, int ply) {
        if(!MoveGenerator.hasLegalMove(game, game.currentPlayer())) {
            return noMoveScore(game, ply);
        }
        if(game.isADraw()) {
            return GameValues.DRAW_VALUE;
        }
        return evaluator.evaluate(game);
    }

    /** Score of an inner node that is already decided, or null when it must be expanded. */
    protected Integer terminalScore(Game game, List<Move> moves, int ply) {
        if(moves.isEmpty()) {
            return noMoveScore(game, ply);
        }
        if(game.isADraw()) {
            return GameValues.DRAW_VALUE;
        }
        return null;
    }

    // Sooner mates score higher
    private static int noMoveScore(Game game, int ply) {
        return game.inCheck() ? -(GameValues.CHECKMATE_VALUE - ply) : GameValues.STALEMATE_VALUE;
    }

    // Current move followed by the child's line
    protected void updatePv(int ply, Move move) {
        pv[ply][ply] = move;
        int childLen = pvLen[ply + 1];
        if(childLen > ply + 1) {
            System.arraycopy(pv[ply + 1], ply + 1, pv[ply], ply + 1, childLen - (ply + 1));
            pvLen[ply] = childLen;
        } else {
            pvLen[ply] = ply + 1;
        }
    }
}
