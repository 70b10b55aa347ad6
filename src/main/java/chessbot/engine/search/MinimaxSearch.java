package chessbot.engine.search;

import chessbot.engine.game.Game;
import chessbot.engine.game.GameChanges;
import chessbot.engine.movegen.Move;
import chessbot.engine.search.evaluator.PositionEvaluator;

import java.util.List;

import static chessbot.engine.search.SearchConstants.INF;

/**
 * Full-width minimax in negamax form: every move of every node is searched.
 * Gives the reference scores alpha-beta has to reproduce, and plays the easy level.
 */
public class MinimaxSearch extends DepthFirstSearch {

    public MinimaxSearch(PositionEvaluator evaluator, SearchConfig cfg) {
        super(evaluator, cfg);
    }

    @Override
    protected int negamax(Game game, int depth, int ply, int alpha, int beta) {
        nodes++;
        pvLen[ply] = ply;

        if(depth <= 0) {
            return leafScore(game, ply);
        }

        List<Move> moves = game.getLegalMoves();
        Integer terminal = terminalScore(game, moves, ply);
        if(terminal != null) {
            return terminal;
        }

        int best = -INF;
        for(Move move : moves) {
            GameChanges gameChanges = game.playMove(move);
            int score = -negamax(game, depth - 1, ply + 1, -INF, INF);
            game.undoMove(gameChanges);
            if(score > best) {
                best = score;
                updatePv(ply, move);
            }
        }
        return best;
    }
}
