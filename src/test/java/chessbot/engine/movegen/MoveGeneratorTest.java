package chessbot.engine.movegen;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.game.Game;
import chessbot.engine.game.board.utils.BoardGenerator;
import chessbot.engine.utils.notations.MoveIOUtils;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class MoveGeneratorTest {

    private static List<String> legalMoveTexts(String fen) {
        Game game = BoardGenerator.from(fen);
        return game.getLegalMoves().stream().map(MoveIOUtils::writeAlgebraicNotation).toList();
    }

    @Test
    public void bothCastlesShouldBeAvailableOnAClearBackRank() {
        List<String> moves = legalMoveTexts("r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1");

        assertTrue(moves.contains("e1g1"));
        assertTrue(moves.contains("e1c1"));
    }

    @Test
    public void castleMovesShouldBeFlaggedAsSuch() {
        Game game = BoardGenerator.from("r3k2r/8/8/8/8/8/8/R3K2R b KQkq - 0 1");
        List<Move> castles = game.getLegalMoves().stream().filter(m -> m.kind() == MoveKind.CASTLE).toList();

        assertEquals(2, castles.size());
        assertTrue(castles.get(0).isCastleKingSide());
        assertTrue(castles.get(1).isCastleQueenSide());
    }

    @Test
    public void castlingShouldNotPassThroughAnAttackedSquare() {
        List<String> moves = legalMoveTexts("r3kr2/8/8/8/8/8/8/R3K2R w KQq - 0 1");

        assertFalse(moves.contains("e1g1"));
        assertTrue(moves.contains("e1c1"));
    }

    @Test
    public void castlingShouldNotLeaveCheck() {
        List<String> moves = legalMoveTexts("4r1k1/8/8/8/8/8/8/R3K2R w KQ - 0 1");

        assertFalse(moves.contains("e1g1"));
        assertFalse(moves.contains("e1c1"));
    }

    @Test
    public void anAttackedRookPathSquareShouldNotPreventQueenSideCastling() {
        // b1 is attacked but the king never walks over it
        List<String> moves = legalMoveTexts("1r2k3/8/8/8/8/8/8/R3K3 w Q - 0 1");

        assertTrue(moves.contains("e1c1"));
    }

    @Test
    public void castlingShouldNeedTheRightAndEmptySquares() {
        assertFalse(legalMoveTexts("r3k2r/8/8/8/8/8/8/R3K2R w - - 0 1").contains("e1g1"));
        assertFalse(legalMoveTexts("r3k2r/8/8/8/8/8/8/RN2K1NR w KQkq - 0 1").contains("e1g1"));
        assertFalse(legalMoveTexts("r3k2r/8/8/8/8/8/8/RN2K1NR w KQkq - 0 1").contains("e1c1"));
    }

    @Test
    public void pinnedPieceShouldHaveNoLegalMove() {
        Game game = BoardGenerator.from("4k3/4r3/8/8/8/8/4B3/4K3 w - - 0 1");

        assertTrue(game.getLegalMovesFrom(Square.fromAlgebraic("e2")).isEmpty());
        assertTrue(game.getLegalMovesFrom(Square.fromAlgebraic("e4")).isEmpty());
    }

    @Test
    public void promotionsShouldComeInQueenRookBishopKnightOrder() {
        Game game = BoardGenerator.from("8/P6k/8/8/8/8/8/K7 w - - 0 1");

        List<Move> moves = game.getLegalMovesFrom(Square.fromAlgebraic("a7"));

        assertEquals(4, moves.size());
        assertEquals(PieceType.QUEEN, moves.get(0).promotion());
        assertEquals(PieceType.ROOK, moves.get(1).promotion());
        assertEquals(PieceType.BISHOP, moves.get(2).promotion());
        assertEquals(PieceType.KNIGHT, moves.get(3).promotion());
    }

    @Test
    public void enPassantShouldBeGeneratedOnlyRightAfterTheDoublePush() {
        Game game = BoardGenerator.from("4k3/8/8/8/5p2/8/4P3/4K3 w - - 0 1");
        game.playMoves("e2e4");

        Move enPassant = MoveGenerator.findLegalMove(game, Square.fromAlgebraic("f4"), Square.fromAlgebraic("e3"), null);
        assertNotNull(enPassant);
        assertEquals(MoveKind.EN_PASSANT, enPassant.kind());
        assertEquals(PieceType.PAWN, enPassant.captured());

        game.playMoves("e8d8 e1d1");
        assertNull(MoveGenerator.findLegalMove(game, Square.fromAlgebraic("f4"), Square.fromAlgebraic("e3"), null));
    }

    @Test
    public void countPseudoLegalMovesShouldMatchTheStartPosition() {
        Game game = BoardGenerator.newStandardGameBoard();

        assertEquals(20, MoveGenerator.countPseudoLegalMoves(game.board(), Color.WHITE));
        assertEquals(20, MoveGenerator.countPseudoLegalMoves(game.board(), Color.BLACK));
        assertTrue(MoveGenerator.hasLegalMove(game, Color.WHITE));
    }
}
