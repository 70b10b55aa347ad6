package chessbot.engine.session;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.exceptions.IllegalMoveException;
import chessbot.engine.exceptions.NoActiveSelectionException;
import chessbot.engine.game.GameStatus;
import chessbot.engine.movegen.Move;
import chessbot.engine.search.Difficulty;
import chessbot.engine.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class GameSessionTest {

    private static Square sq(String notation) {
        return Square.fromAlgebraic(notation);
    }

    @Test
    public void aiShouldStillMoveInADrawnPositionWithLegalMoves() {
        GameSession session = GameSession.newGame(Difficulty.BEGINNER);
        session.game().playMoves("g1f3 g8f6 f3g1 f6g8 g1f3 g8f6 f3g1 f6g8");
        assertEquals(GameStatus.DRAW, session.snapshot().status());

        Optional<Move> move = session.requestAiMove(Duration.ofSeconds(5));

        assertTrue(move.isPresent());
        assertTrue(session.game().getLegalMoves().contains(move.get()));
    }

    @Test
    public void clickingOwnPieceShouldSelectItWithItsMoves() {
        GameSession session = GameSession.newGame(Difficulty.BEGINNER);

        SelectionResult result = session.select(sq("g1"));

        assertEquals(sq("g1"), result.selected());
        assertEquals(2, result.legalMoves().size());
        assertNull(result.movePlayed());
        assertEquals(sq("g1"), session.selected());
    }

    @Test
    public void clickingAnotherOwnPieceShouldReselect() {
        GameSession session = GameSession.newGame(Difficulty.BEGINNER);
        session.select(sq("g1"));

        SelectionResult result = session.select(sq("e2"));

        assertEquals(sq("e2"), result.selected());
        assertEquals(2, result.legalMoves().size());
    }

    @Test
    public void clickingOpponentOrEmptySquareShouldClear() {
        GameSession session = GameSession.newGame(Difficulty.BEGINNER);
        session.select(sq("g1"));

        SelectionResult result = session.select(sq("e7"));

        assertNull(result.selected());
        assertTrue(result.legalMoves().isEmpty());
        assertNull(session.selected());
        assertNull(session.select(sq("e4")).selected());
    }

    @Test
    public void clickingADestinationShouldPlayTheMove() {
        GameSession session = GameSession.newGame(Difficulty.BEGINNER);
        session.select(sq("e2"));

        SelectionResult result = session.select(sq("e4"));

        assertNotNull(result.movePlayed());
        assertEquals("e2e4", result.movePlayed().move().toString());
        assertNull(result.selected());
        assertEquals(Color.BLACK, session.game().currentPlayer());
    }

    @Test
    public void moveWithoutSelectionShouldThrow() {
        GameSession session = GameSession.newGame(Difficulty.BEGINNER);

        assertThrows(NoActiveSelectionException.class, () -> session.moveSelectedTo(sq("e4")));
    }

    @Test
    public void unreachableDestinationShouldThrowAndKeepTheGame() {
        GameSession session = GameSession.newGame(Difficulty.BEGINNER);
        session.select(sq("e2"));
        String fen = session.snapshot().fen();

        assertThrows(IllegalMoveException.class, () -> session.moveSelectedTo(sq("e5")));
        assertEquals(fen, session.snapshot().fen());
        assertEquals(sq("e2"), session.selected());
    }

    @Test
    public void applyShouldReportTheOutcome() {
        GameSession session = GameSession.newGame(Difficulty.BEGINNER);
        session.game().playMoves("f2f3 e7e5 g2g4");
        Move mate = session.game().getLegalMovesFrom(sq("d8")).stream()
                .filter(m -> m.to().equals(sq("h4"))).findFirst().orElseThrow();

        MoveOutcome outcome = session.apply(mate);

        assertTrue(outcome.check());
        assertTrue(outcome.checkmate());
        assertTrue(outcome.isGameOver());
        assertFalse(outcome.draw());
        assertEquals(GameStatus.CHECKMATE, session.snapshot().status());
        assertEquals(Optional.empty(), session.requestAiMove(Duration.ofSeconds(1)));
    }

    @Test
    public void applyShouldRejectAMoveOfTheWrongSide() {
        GameSession session = GameSession.newGame(Difficulty.BEGINNER);
        Move blackMove = Move.normal(sq("e7"), sq("e5"), PieceType.PAWN);

        IllegalMoveException e = assertThrows(IllegalMoveException.class, () -> session.apply(blackMove));
        assertEquals(blackMove, e.getMove());
        assertFalse(session.game().canUndo());
    }

    @Test
    public void captureShouldBeReportedAndListedInTheSnapshot() {
        GameSession session = GameSession.newGame(Difficulty.BEGINNER);
        session.game().playMoves("e2e4 d7d5");
        session.select(sq("e4"));

        MoveOutcome outcome = session.moveSelectedTo(sq("d5"));

        assertEquals(PieceType.PAWN, outcome.captured());
        BoardSnapshot snapshot = session.snapshot();
        assertEquals(List.of(PieceType.PAWN), snapshot.captured().get(Color.WHITE));
        assertEquals(List.of(), snapshot.captured().get(Color.BLACK));
        assertEquals(Color.BLACK, snapshot.sideToMove());
        assertFalse(snapshot.inCheck());
    }

    @Test
    public void undoShouldTakeBackAndReportEmptyHistory() {
        GameSession session = GameSession.newGame(Difficulty.BEGINNER);
        assertFalse(session.undo());

        session.select(sq("e2"));
        session.select(sq("e4"));

        assertTrue(session.undo());
        assertEquals(FENUtils.getFENFromBoard(GameSession.newGame(Difficulty.BEGINNER).game()), session.snapshot().fen());
    }

    @Test
    public void promotionClickShouldQueenByDefault() {
        GameSession session = GameSession.fromFen("8/P6k/8/8/8/8/8/K7 w - - 0 1", Difficulty.BEGINNER);
        session.select(sq("a7"));

        SelectionResult result = session.select(sq("a8"));

        assertEquals(PieceType.QUEEN, result.movePlayed().move().promotion());
    }

    @Test
    public void promotionClickWithoutAutoQueenShouldOfferTheChoice() {
        GameSession session = GameSession.fromFen("8/P6k/8/8/8/8/8/K7 w - - 0 1", Difficulty.BEGINNER);
        session.setAutoQueenPromotion(false);
        session.select(sq("a7"));

        SelectionResult result = session.select(sq("a8"));

        assertNull(result.movePlayed());
        assertEquals(4, result.legalMoves().size());
        assertEquals(sq("a7"), result.selected());

        MoveOutcome outcome = session.apply(result.legalMoves().get(3));
        assertEquals(PieceType.KNIGHT, outcome.move().promotion());
    }

    @Test
    public void aiMoveShouldBeLegalAndNotPlayed() {
        GameSession session = GameSession.newGame(Difficulty.MEDIUM);

        Optional<Move> move = session.requestAiMove(Duration.ofSeconds(30));

        assertTrue(move.isPresent());
        assertTrue(session.game().getLegalMoves().contains(move.get()));
        assertFalse(session.game().canUndo());
    }

    @Test
    public void difficultyShouldBeChangeable() {
        GameSession session = GameSession.newGame(Difficulty.EASY);

        session.setDifficulty(Difficulty.HARD);

        assertEquals(Difficulty.HARD, session.difficulty());
        assertTrue(session.isAutoQueenPromotion());
    }
}
