package chessbot.engine.search.evaluator;

import chessbot.engine.common.Color;
import chessbot.engine.common.Square;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;

// Occupation of d4, e4, d5 and e5, whatever the piece
public class CenterControl implements EvaluationTerm {
    static final int CENTER_OCCUPATION_BONUS = 10;
    private static final Square[] CENTER = {
            Square.of(3, 3), Square.of(4, 3), Square.of(3, 4), Square.of(4, 4)
    };

    @Override
    public int evaluate(Board board) {
        int score = 0;
        for(Square square : CENTER) {
            Piece piece = board.get(square);
            if(piece != null) {
                score += piece.color() == Color.WHITE ? CENTER_OCCUPATION_BONUS : -CENTER_OCCUPATION_BONUS;
            }
        }
        return score;
    }
}
