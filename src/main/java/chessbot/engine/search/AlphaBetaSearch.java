package chessbot.engine.search;

import chessbot.engine.game.Game;
import chessbot.engine.game.GameChanges;
import chessbot.engine.movegen.Move;
import chessbot.engine.search.evaluator.PositionEvaluator;

import java.util.List;

import static chessbot.engine.search.SearchConstants.INF;

/** Negamax with alpha-beta pruning. */
public class AlphaBetaSearch extends DepthFirstSearch {

    public AlphaBetaSearch(PositionEvaluator evaluator, SearchConfig cfg) {
        super(evaluator, cfg);
    }

    @Override
    protected int negamax(Game game, int depth, int ply, int alpha, int beta) {
        nodes++;
        pvLen[ply] = ply;                 // PV at a leaf ends here

        if(depth <= 0) {
            return leafScore(game, ply);
        }

        List<Move> moves = game.getLegalMoves();
        Integer terminal = terminalScore(game, moves, ply);
        if(terminal != null) {
            return terminal;
        }
        if(cfg.useMoveOrdering) {
            MoveOrdering.orderCapturesFirst(moves);
        }

        int best = -INF;
        for(Move move : moves) {
            GameChanges gameChanges = game.playMove(move);
            int score = -negamax(game, depth - 1, ply + 1, -beta, -alpha);
            game.undoMove(gameChanges);

            if(score > best) {
                best = score;
                updatePv(ply, move);
            }
            if(best > alpha) alpha = best;
            if(alpha >= beta) break; // cut
        }
        return best;
    }
}
