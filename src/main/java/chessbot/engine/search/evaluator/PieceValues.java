package chessbot.engine.search.evaluator;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;

public class PieceValues implements EvaluationTerm {
    public static final int PAWN_VALUE = 100;
    public static final int KNIGHT_VALUE = 320;
    public static final int BISHOP_VALUE = 330;
    public static final int ROOK_VALUE = 500;
    public static final int QUEEN_VALUE = 900;
    public static final int KING_VALUE = 20000;

    // Indexed by PieceType ordinal
    private static final int[] VAL = {
            PAWN_VALUE,
            KNIGHT_VALUE,
            BISHOP_VALUE,
            ROOK_VALUE,
            QUEEN_VALUE,
            KING_VALUE
    };

    public static int valueOf(PieceType pieceType) {
        return VAL[pieceType.ordinal()];
    }

    @Override
    public int evaluate(Board board) {
        int score = 0;
        for(int i = 0; i < 64; i++) {
            Piece piece = board.get(Square.of(i));
            if(piece != null) {
                score += piece.color() == Color.WHITE ? valueOf(piece.type()) : -valueOf(piece.type());
            }
        }
        return score;
    }
}
