package chessbot.engine.utils.notations;

import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.exceptions.IllegalMoveException;
import chessbot.engine.exceptions.InvalidSquareException;
import chessbot.engine.game.Game;
import chessbot.engine.movegen.Move;
import chessbot.engine.movegen.MoveGenerator;

import java.util.List;
import java.util.stream.Collectors;

public class MoveIOUtils {

    private MoveIOUtils() {}

    /** UCI long algebraic notation: "e2e4", "e7e8q". Castling is written as the king's two squares. */
    public static String writeAlgebraicNotation(Move move) {
        if(move == null) {
            return "0000";
        }
        String promotedPiece = move.promotion() == null ? "" : String.valueOf(move.promotion().letter());
        return move.from().toAlgebraic() + move.to().toAlgebraic() + promotedPiece;
    }

    public static String writeAlgebraicNotation(List<Move> moves) {
        return moves.stream().map(MoveIOUtils::writeAlgebraicNotation).collect(Collectors.joining(" "));
    }

    /**
     * Resolves UCI move text against the legal moves of the position.
     *
     * @throws IllegalArgumentException when the text is not a move
     * @throws IllegalMoveException     when it is well formed but not legal here
     */
    public static Move parseUciMove(Game game, String text) {
        if(text == null || (text.length() != 4 && text.length() != 5)) {
            throw new IllegalArgumentException("Move should be formatted like 'e2e4' or 'e7e8q', got " + text);
        }
        Square from;
        Square to;
        try {
            from = Square.fromAlgebraic(text.substring(0, 2));
            to = Square.fromAlgebraic(text.substring(2, 4));
        } catch (InvalidSquareException e) {
            throw new IllegalArgumentException("Invalid move " + text, e);
        }
        PieceType promotion = null;
        if(text.length() == 5) {
            promotion = getPieceTypeFromLetter(text.charAt(4));
        }
        Move move = MoveGenerator.findLegalMove(game, from, to, promotion);
        if(move == null) {
            throw new IllegalMoveException("Illegal move " + text + " in this position");
        }
        return move;
    }

    public static PieceType getPieceTypeFromLetter(char letter) {
        return switch (letter) {
            case 'n', 'N' -> PieceType.KNIGHT;
            case 'q', 'Q' -> PieceType.QUEEN;
            case 'r', 'R' -> PieceType.ROOK;
            case 'b', 'B' -> PieceType.BISHOP;
            default -> throw new IllegalArgumentException("Unknown promotion letter " + letter);
        };
    }
}
