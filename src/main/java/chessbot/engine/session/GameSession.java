package chessbot.engine.session;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.exceptions.IllegalMoveException;
import chessbot.engine.exceptions.NoActiveSelectionException;
import chessbot.engine.game.Game;
import chessbot.engine.game.GameStatus;
import chessbot.engine.game.board.Piece;
import chessbot.engine.game.board.utils.BoardGenerator;
import chessbot.engine.movegen.Move;
import chessbot.engine.search.Difficulty;
import chessbot.engine.search.SearchConfig;
import chessbot.engine.search.SearchFacade;
import chessbot.engine.utils.notations.FENUtils;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One game as a user interface sees it: click to select and move, undo, ask the computer for a move,
 * read back the position. Rejected requests leave the game untouched. Not thread-safe.
 */
public class GameSession {
    private final Game game;
    private final SearchFacade search;

    private Square selected;
    private List<Move> selectedMoves = List.of();
    private boolean autoQueenPromotion = true;

    public GameSession(Game game, SearchFacade search) {
        this.game = game;
        this.search = search;
    }

    public static GameSession newGame(Difficulty difficulty) {
        return new GameSession(BoardGenerator.newStandardGameBoard(),
                new SearchFacade(new SearchConfig.Builder().build(), difficulty));
    }

    public static GameSession fromFen(String fen, Difficulty difficulty) {
        return new GameSession(FENUtils.getBoardFrom(fen),
                new SearchFacade(new SearchConfig.Builder().build(), difficulty));
    }

    public Game game() {
        return game;
    }

    public Difficulty difficulty() {
        return search.difficulty();
    }

    public void setDifficulty(Difficulty difficulty) {
        search.setDifficulty(difficulty);
    }

    public boolean isAutoQueenPromotion() {
        return autoQueenPromotion;
    }

    public void setAutoQueenPromotion(boolean autoQueenPromotion) {
        this.autoQueenPromotion = autoQueenPromotion;
    }

    /**
     * A click on {@code square}. Selects (or re-selects) a piece of the side to move, plays the
     * selected piece's move when the square is one of its destinations, clears the selection otherwise.
     * Without auto-queen, a click on a promotion square keeps the selection and lists the promotion moves
     * so the caller can {@link #apply} the one the user picks.
     */
    public SelectionResult select(Square square) {
        if(selected != null) {
            List<Move> toSquare = movesTo(square);
            if(!toSquare.isEmpty()) {
                if(toSquare.size() > 1 && !autoQueenPromotion) {
                    return new SelectionResult(selected, toSquare, null);
                }
                MoveOutcome outcome = apply(pickMove(toSquare));
                return new SelectionResult(null, List.of(), outcome);
            }
        }

        Piece piece = game.board().get(square);
        if(piece != null && piece.color() == game.currentPlayer()) {
            selected = square;
            selectedMoves = game.getLegalMovesFrom(square);
            return new SelectionResult(selected, selectedMoves, null);
        }

        clearSelection();
        return SelectionResult.CLEARED;
    }

    /**
     * Moves the selected piece to {@code square}, promoting to a queen.
     *
     * @throws NoActiveSelectionException when nothing is selected
     * @throws IllegalMoveException       when the selected piece cannot go there
     */
    public MoveOutcome moveSelectedTo(Square square) {
        if(selected == null) {
            throw new NoActiveSelectionException(square);
        }
        List<Move> toSquare = movesTo(square);
        if(toSquare.isEmpty()) {
            throw new IllegalMoveException("Piece on " + selected + " cannot move to " + square);
        }
        return apply(pickMove(toSquare));
    }

    /** @throws IllegalMoveException when {@code move} is not legal in the current position */
    public MoveOutcome apply(Move move) {
        if(move == null || !game.getLegalMoves().contains(move)) {
            throw new IllegalMoveException(move);
        }
        game.playMove(move);
        clearSelection();

        GameStatus status = game.getStatus();
        return new MoveOutcome(move, move.captured(),
                status == GameStatus.CHECK || status == GameStatus.CHECKMATE,
                status == GameStatus.CHECKMATE,
                status == GameStatus.STALEMATE,
                status == GameStatus.DRAW);
    }

    /** Takes back the last move. Returns false when there is nothing to take back. */
    public boolean undo() {
        if(!game.canUndo()) {
            return false;
        }
        game.undoMove();
        clearSelection();
        return true;
    }

    /**
     * The computer's choice for the side to move; the move is not played.
     * Empty only after checkmate or stalemate. A drawn position with legal moves still gets a move.
     */
    public Optional<Move> requestAiMove(Duration timeBudget) {
        GameStatus status = game.getStatus();
        if(status == GameStatus.CHECKMATE || status == GameStatus.STALEMATE) {
            return Optional.empty();
        }
        return Optional.ofNullable(search.findBestMove(game, timeBudget).move());
    }

    public BoardSnapshot snapshot() {
        return new BoardSnapshot(FENUtils.getFENFromBoard(game), Game.boardAscii(game), game.currentPlayer(),
                game.inCheck(), game.getStatus(), capturedPieces());
    }

    public Square selected() {
        return selected;
    }

    private List<Move> movesTo(Square square) {
        List<Move> moves = new ArrayList<>(4);
        for(Move move : selectedMoves) {
            if(move.to().equals(square)) {
                moves.add(move);
            }
        }
        return moves;
    }

    // Queen first among promotions, otherwise the only candidate
    private static Move pickMove(List<Move> candidates) {
        for(Move move : candidates) {
            if(move.promotion() == PieceType.QUEEN) {
                return move;
            }
        }
        return candidates.get(0);
    }

    private void clearSelection() {
        selected = null;
        selectedMoves = List.of();
    }

    private Map<Color, List<PieceType>> capturedPieces() {
        Map<Color, List<PieceType>> captured = new EnumMap<>(Color.class);
        captured.put(Color.WHITE, new ArrayList<>());
        captured.put(Color.BLACK, new ArrayList<>());
        List<Move> history = game.getMoveHistory();
        // The last move was played by the side not to move, and colors alternate backwards from there
        Color mover = game.currentPlayer().getOppositeColor();
        for(int i = history.size() - 1; i >= 0; i--) {
            Move move = history.get(i);
            if(move.captured() != null) {
                captured.get(mover).add(0, move.captured());
            }
            mover = mover.getOppositeColor();
        }
        captured.replaceAll((color, pieces) -> List.copyOf(pieces));
        return captured;
    }
}
