package chessbot.engine.search.evaluator;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;

public class PawnStructure implements EvaluationTerm {
    static final int ISOLATED_PAWN_PENALTY = -20;
    static final int DOUBLED_PAWN_PENALTY = -10;

    @Override
    public int evaluate(Board board) {
        return evaluate(board, Color.WHITE) - evaluate(board, Color.BLACK);
    }

    static int evaluate(Board board, Color color) {
        int[] pawnsPerFile = pawnsPerFile(board, color);
        return ISOLATED_PAWN_PENALTY * countIsolatedPawns(pawnsPerFile)
                + DOUBLED_PAWN_PENALTY * countDoubledPawns(pawnsPerFile);
    }

    // Every pawn with no friendly pawn on a neighbour file
    static int countIsolatedPawns(int[] pawnsPerFile) {
        int isolated = 0;
        for(int file = 0; file < 8; file++) {
            if(pawnsPerFile[file] == 0) {
                continue;
            }
            boolean left = file > 0 && pawnsPerFile[file - 1] > 0;
            boolean right = file < 7 && pawnsPerFile[file + 1] > 0;
            if(!left && !right) {
                isolated += pawnsPerFile[file];
            }
        }
        return isolated;
    }

    // One per pawn beyond the first on the same file
    static int countDoubledPawns(int[] pawnsPerFile) {
        int doubled = 0;
        for(int count : pawnsPerFile) {
            if(count > 1) {
                doubled += count - 1;
            }
        }
        return doubled;
    }

    static int[] pawnsPerFile(Board board, Color color) {
        int[] pawnsPerFile = new int[8];
        for(Piece piece : board.getPieces(color)) {
            if(piece.type() == PieceType.PAWN) {
                pawnsPerFile[piece.square().file()]++;
            }
        }
        return pawnsPerFile;
    }
}
