package chessbot.engine.game;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.exceptions.EmptyHistoryException;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.MovePlayed;
import chessbot.engine.game.board.Piece;
import chessbot.engine.movegen.AttackDetector;
import chessbot.engine.movegen.Move;
import chessbot.engine.movegen.MoveGenerator;
import chessbot.engine.utils.notations.FENUtils;
import chessbot.engine.utils.notations.MoveIOUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * A game in progress: the board plus side to move, castling rights, clocks and the undo history.
 * A new Game has an empty board; use {@link chessbot.engine.game.board.utils.BoardGenerator} to get a playable one.
 * Not thread-safe.
 */
public class Game {
    private final Board board;

    private final RepetitionCounter repetitionCounter = new RepetitionCounter();
    private final Deque<GameChanges> history = new ArrayDeque<>();
    private final List<Move> moveHistory = new ArrayList<>();

    private Color currentPlayer = Color.WHITE;
    public boolean whiteCanCastleKingSide = true;
    public boolean whiteCanCastleQueenSide = true;
    public boolean blackCanCastleKingSide = true;
    public boolean blackCanCastleQueenSide = true;

    public int halfMoveClock = 0;
    public int fullMoveClock = 1;

    // Lazily computed, null when unknown
    private GameStatus status;

    public Game() {
        this.board = new Board();
    }

    public Board board() {
        return board;
    }

    public Color currentPlayer() {
        return currentPlayer;
    }

    public void setCurrentPlayer(Color currentPlayer) {
        this.currentPlayer = currentPlayer;
        this.status = null;
    }

    /**
     * Forgets the undo history and starts counting repetitions from the current position.
     * Called once the position has been set up.
     */
    public void resetHistory() {
        history.clear();
        moveHistory.clear();
        repetitionCounter.clear();
        repetitionCounter.inc(zobristKey());
        status = null;
    }

    public List<Move> getLegalMoves() {
        return MoveGenerator.legalMoves(this, currentPlayer);
    }

    public List<Move> getLegalMovesFrom(Square square) {
        return MoveGenerator.legalMovesFrom(this, square);
    }

    public GameChanges playMove(Move move) {
        Color mover = currentPlayer;
        MovePlayed movePlayed = board.playMove(move);
        GameChanges gameChanges = new GameChanges(movePlayed, halfMoveClock, fullMoveClock,
                whiteCanCastleKingSide, whiteCanCastleQueenSide,
                blackCanCastleKingSide, blackCanCastleQueenSide, status);

        if(mover == Color.BLACK) {
            fullMoveClock++;
        }

        if(move.pieceType() == PieceType.KING) {
            if(mover.isWhite()) {
                whiteCanCastleKingSide = false;
                whiteCanCastleQueenSide = false;
            } else {
                blackCanCastleKingSide = false;
                blackCanCastleQueenSide = false;
            }
        }

        // A rook leaving its corner, or being taken there, loses that side's right
        int from = move.from().index();
        int to = move.to().index();
        if(from == 7 || to == 7) whiteCanCastleKingSide = false;
        if(from == 0 || to == 0) whiteCanCastleQueenSide = false;
        if(from == 63 || to == 63) blackCanCastleKingSide = false;
        if(from == 56 || to == 56) blackCanCastleQueenSide = false;

        if(move.pieceType() == PieceType.PAWN || movePlayed.isCapture()) {
            halfMoveClock = 0;
        } else {
            halfMoveClock++;
        }

        currentPlayer = mover.getOppositeColor();
        status = null;
        history.push(gameChanges);
        moveHistory.add(move);
        repetitionCounter.inc(zobristKey());
        return gameChanges;
    }

    /** Undoes the last move played. */
    public GameChanges undoMove() {
        if(history.isEmpty()) {
            throw new EmptyHistoryException();
        }
        GameChanges gameChanges = history.peek();
        undoMove(gameChanges);
        return gameChanges;
    }

    /** Undoes {@code gameChanges}, which must be the most recent move played. */
    public void undoMove(GameChanges gameChanges) {
        if(history.peek() != gameChanges) {
            throw new IllegalStateException("Moves must be undone in reverse order, last is " + history.peek());
        }
        repetitionCounter.dec(zobristKey());
        history.pop();
        moveHistory.remove(moveHistory.size() - 1);

        board.undoMove(gameChanges.movePlayed());
        whiteCanCastleKingSide = gameChanges.previousWhiteCanCastleKingSide();
        whiteCanCastleQueenSide = gameChanges.previousWhiteCanCastleQueenSide();
        blackCanCastleKingSide = gameChanges.previousBlackCanCastleKingSide();
        blackCanCastleQueenSide = gameChanges.previousBlackCanCastleQueenSide();
        halfMoveClock = gameChanges.previousHalfMoveClock();
        fullMoveClock = gameChanges.previousFullMoveClock();
        currentPlayer = currentPlayer.getOppositeColor();
        status = gameChanges.previousStatus();
    }

    public boolean canUndo() {
        return !history.isEmpty();
    }

    /** Moves played since the position was set up, oldest first. */
    public List<Move> getMoveHistory() {
        return Collections.unmodifiableList(moveHistory);
    }

    public boolean inCheck() {
        return isInCheck(currentPlayer);
    }

    public boolean isInCheck(Color color) {
        Square kingSquare = board.getKingSquare(color);
        return kingSquare != null && AttackDetector.isSquareAttacked(board, kingSquare, color.getOppositeColor());
    }

    public GameStatus getStatus() {
        if(status == null) {
            status = computeStatus();
        }
        return status;
    }

    private GameStatus computeStatus() {
        boolean inCheck = inCheck();
        if(!MoveGenerator.hasLegalMove(this, currentPlayer)) {
            return inCheck ? GameStatus.CHECKMATE : GameStatus.STALEMATE;
        }
        if(isADraw()) {
            return GameStatus.DRAW;
        }
        return inCheck ? GameStatus.CHECK : GameStatus.ACTIVE;
    }

    public boolean isADraw() {
        return isInsufficientMaterial()
                || isThreefoldRepetition()
                || halfMoveClock >= 100;  // 50-moves rule
    }

    public boolean isThreefoldRepetition() {
        return repetitionCounter.get(zobristKey()) >= 3;
    }

    // K v K, K+B v K and K+N v K
    public boolean isInsufficientMaterial() {
        int minors = 0;
        for(int i = 0; i < 64; i++) {
            Piece piece = board.get(Square.of(i));
            if(piece == null || piece.type() == PieceType.KING) {
                continue;
            }
            if(piece.type() != PieceType.BISHOP && piece.type() != PieceType.KNIGHT) {
                return false;
            }
            minors++;
        }
        return minors <= 1;
    }

    public long zobristKey() {
        return board.zobristKey()
                ^ ZobristHashKeys.castlingKey(whiteCanCastleKingSide, whiteCanCastleQueenSide,
                        blackCanCastleKingSide, blackCanCastleQueenSide)
                ^ ZobristHashKeys.sideKey(currentPlayer);
    }

    public void setWhiteCanCastleKingSide(boolean whiteCanCastleKingSide) {
        this.whiteCanCastleKingSide = whiteCanCastleKingSide;
        this.status = null;
    }

    public void setWhiteCanCastleQueenSide(boolean whiteCanCastleQueenSide) {
        this.whiteCanCastleQueenSide = whiteCanCastleQueenSide;
        this.status = null;
    }

    public void setBlackCanCastleKingSide(boolean blackCanCastleKingSide) {
        this.blackCanCastleKingSide = blackCanCastleKingSide;
        this.status = null;
    }

    public void setBlackCanCastleQueenSide(boolean blackCanCastleQueenSide) {
        this.blackCanCastleQueenSide = blackCanCastleQueenSide;
        this.status = null;
    }

    public boolean canCastleKingSide(Color color) {
        return color.isWhite() ? whiteCanCastleKingSide : blackCanCastleKingSide;
    }

    public boolean canCastleQueenSide(Color color) {
        return color.isWhite() ? whiteCanCastleQueenSide : blackCanCastleQueenSide;
    }

    /** Plays space separated moves in UCI notation, e.g. "e2e4 e7e5". */
    public List<GameChanges> playMoves(String moves) {
        if(moves.isBlank()) {
            return List.of();
        }
        return playMoves(Arrays.stream(moves.trim().split("\\s+")).toList());
    }

    public List<GameChanges> playMoves(List<String> moveList) {
        List<GameChanges> gameChangesList = new ArrayList<>(moveList.size());
        for(String move : moveList) {
            gameChangesList.add(playMove(MoveIOUtils.parseUciMove(this, move)));
        }
        return gameChangesList;
    }

    @Override
    public String toString() {
        return boardAscii(this);
    }

    /** Returns an ASCII diagram of the board (ranks 8..1). */
    public static String boardAscii(Game game) {
        Board b = game.board();
        StringBuilder sb = new StringBuilder(8 * (8 + 4));
        for (int rank = 7; rank >= 0; rank--) {
            sb.append(rank + 1).append("  ");
            for (int file = 0; file < 8; file++) {
                Piece piece = b.get(Square.of(file, rank));
                sb.append(piece == null ? '.' : piece.toFenLetter()).append(' ');
            }
            sb.append('\n');
        }
        sb.append("\n   a b c d e f g h");
        return sb.toString();
    }

    /** Returns a pretty board followed by the computed FEN on the next line. */
    public static String boardWithFen(Game game) {
        StringBuilder sb = new StringBuilder();
        sb.append(boardAscii(game)).append('\n');
        sb.append("FEN: ").append(FENUtils.getFENFromBoard(game));
        sb.append("\nZobrist: 0x").append(Long.toHexString(game.zobristKey()));
        return sb.toString();
    }
}
