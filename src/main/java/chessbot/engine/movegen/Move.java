package chessbot.engine.movegen;

import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.utils.notations.MoveIOUtils;

/**
 * A fully described move. A promotion that also takes a piece has kind {@link MoveKind#PROMOTION}
 * and a non-null {@code captured} type.
 *
 * @param captured  type of the piece taken, null when nothing is taken
 * @param promotion type the pawn turns into, null unless kind is PROMOTION
 */
public record Move(Square from, Square to, PieceType pieceType, MoveKind kind,
                   PieceType captured, PieceType promotion) {

    public static Move normal(Square from, Square to, PieceType pieceType) {
        return new Move(from, to, pieceType, MoveKind.NORMAL, null, null);
    }

    public static Move capture(Square from, Square to, PieceType pieceType, PieceType captured) {
        return new Move(from, to, pieceType, MoveKind.CAPTURE, captured, null);
    }

    public static Move castle(Square from, Square to) {
        return new Move(from, to, PieceType.KING, MoveKind.CASTLE, null, null);
    }

    public static Move promote(Square from, Square to, PieceType promotion, PieceType captured) {
        return new Move(from, to, PieceType.PAWN, MoveKind.PROMOTION, captured, promotion);
    }

    public static Move enPassant(Square from, Square to) {
        return new Move(from, to, PieceType.PAWN, MoveKind.EN_PASSANT, PieceType.PAWN, null);
    }

    public boolean isCapture() {
        return captured != null;
    }

    public boolean isPromotion() {
        return kind == MoveKind.PROMOTION;
    }

    public boolean isCastleKingSide() {
        return kind == MoveKind.CASTLE && to.file() > from.file();
    }

    public boolean isCastleQueenSide() {
        return kind == MoveKind.CASTLE && to.file() < from.file();
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeAlgebraicNotation(this);
    }
}
