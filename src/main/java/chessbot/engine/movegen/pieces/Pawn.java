package chessbot.engine.movegen.pieces;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;
import chessbot.engine.movegen.Move;
import it.unimi.dsi.fastutil.objects.ObjectArrayList;

import java.util.List;

public final class Pawn {
    private Pawn() {}

    public static void generatePseudoLegalMoves(Board board, Square from, Piece piece, List<Move> out) {
        Color color = piece.color();
        int forward = color.forward();
        int lastRank = color.getOppositeColor().homeRank();

        Square oneStep = from.offset(0, forward);
        if(oneStep == null) {
            return;
        }
        if(board.isEmpty(oneStep)) {
            addPawnMove(from, oneStep, null, lastRank, out);
            // Double push only from the starting rank, through an empty square
            if(from.rank() == startingRank(color)) {
                Square twoSteps = oneStep.offset(0, forward);
                if(twoSteps != null && board.isEmpty(twoSteps)) {
                    out.add(Move.normal(from, twoSteps, PieceType.PAWN));
                }
            }
        }

        for(int side = -1; side <= 1; side += 2) {
            Square to = from.offset(side, forward);
            if(to == null) {
                continue;
            }
            Piece occupant = board.get(to);
            if(occupant != null) {
                if(occupant.color() != color) {
                    addPawnMove(from, to, occupant.type(), lastRank, out);
                }
            } else if(to.equals(board.getEnPassantSquare()) && to.rank() == enPassantTargetRank(color)) {
                out.add(Move.enPassant(from, to));
            }
        }
    }

    public static int countPseudoLegalMoves(Board board, Square from, Piece piece) {
        List<Move> buffer = new ObjectArrayList<>(12);
        generatePseudoLegalMoves(board, from, piece, buffer);
        return buffer.size();
    }

    /** Capture geometry only: the target square is attacked whether or not something stands on it. */
    public static boolean attacks(Color color, Square from, Square target) {
        return target.rank() - from.rank() == color.forward()
                && Math.abs(target.file() - from.file()) == 1;
    }

    public static int startingRank(Color color) {
        return color.isWhite() ? 1 : 6;
    }

    // The en passant square behind an enemy pawn, never the one the mover's own double push left
    private static int enPassantTargetRank(Color color) {
        return color.isWhite() ? 5 : 2;
    }

    private static void addPawnMove(Square from, Square to, PieceType captured, int lastRank, List<Move> out) {
        if(to.rank() == lastRank) {
            for(PieceType promotion : PieceType.PROMOTIONS) {
                out.add(Move.promote(from, to, promotion, captured));
            }
        } else if(captured != null) {
            out.add(Move.capture(from, to, PieceType.PAWN, captured));
        } else {
            out.add(Move.normal(from, to, PieceType.PAWN));
        }
    }
}
