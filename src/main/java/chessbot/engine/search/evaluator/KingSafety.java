package chessbot.engine.search.evaluator;

import chessbot.engine.common.Color;
import chessbot.engine.common.Square;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;

public class KingSafety implements EvaluationTerm {
    static final int SHELTER_BONUS = 10;
    static final int CORNER_DISTANCE_PENALTY = 2;
    // At or below this many pieces the king may leave its corner
    static final int ENDGAME_PIECE_COUNT = 12;

    @Override
    public int evaluate(Board board) {
        boolean openingOrMiddlegame = board.countPieces() > ENDGAME_PIECE_COUNT;
        return evaluate(board, Color.WHITE, openingOrMiddlegame) - evaluate(board, Color.BLACK, openingOrMiddlegame);
    }

    static int evaluate(Board board, Color color, boolean openingOrMiddlegame) {
        Square kingSquare = board.getKingSquare(color);
        if(kingSquare == null) {
            return 0;
        }
        int score = SHELTER_BONUS * countAdjacentFriends(board, kingSquare, color);
        if(openingOrMiddlegame) {
            score -= CORNER_DISTANCE_PENALTY * cornerDistance(kingSquare);
        }
        return score;
    }

    static int countAdjacentFriends(Board board, Square kingSquare, Color color) {
        int count = 0;
        for(int df = -1; df <= 1; df++) {
            for(int dr = -1; dr <= 1; dr++) {
                if(df == 0 && dr == 0) {
                    continue;
                }
                Square square = kingSquare.offset(df, dr);
                if(square != null) {
                    Piece piece = board.get(square);
                    if(piece != null && piece.color() == color) {
                        count++;
                    }
                }
            }
        }
        return count;
    }

    // Manhattan distance to the nearest corner
    static int cornerDistance(Square square) {
        int fileDistance = Math.min(square.file(), 7 - square.file());
        int rankDistance = Math.min(square.rank(), 7 - square.rank());
        return fileDistance + rankDistance;
    }
}
