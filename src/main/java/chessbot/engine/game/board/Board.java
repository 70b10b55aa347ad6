package chessbot.engine.game.board;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.game.ZobristHashKeys;
import chessbot.engine.movegen.Move;
import chessbot.engine.movegen.MoveKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 64 slots, each holding at most one {@link Piece}. The board also owns the en-passant target square
 * and the incremental Zobrist key of the placement and en-passant file.
 */
public class Board {
    private final Piece[] pieceAt = new Piece[64];
    private final Square[] kingSquares = new Square[2];
    private Square enPassantSquare;
    private long zobristKey = 0;

    public Board() {
    }

    // Deep copy: pieces are cloned so the copy can be mutated freely
    private Board(Board other) {
        for(int i = 0; i < 64; i++) {
            Piece piece = other.pieceAt[i];
            if(piece != null) {
                Piece clone = new Piece(piece.type(), piece.color(), piece.hasMoved());
                clone.setSquare(piece.square());
                pieceAt[i] = clone;
            }
        }
        kingSquares[0] = other.kingSquares[0];
        kingSquares[1] = other.kingSquares[1];
        enPassantSquare = other.enPassantSquare;
        zobristKey = other.zobristKey;
    }

    public Board copy() {
        return new Board(this);
    }

    public Piece get(Square square) {
        return pieceAt[square.index()];
    }

    public boolean isEmpty(Square square) {
        return pieceAt[square.index()] == null;
    }

    public void place(Square square, Piece piece) {
        if(pieceAt[square.index()] != null) {
            throw new IllegalStateException("Square " + square + " is already occupied by " + pieceAt[square.index()]);
        }
        pieceAt[square.index()] = piece;
        piece.setSquare(square);
        if(piece.type() == PieceType.KING) {
            kingSquares[piece.color().ordinal()] = square;
        }
        zobristKey ^= ZobristHashKeys.pieceKey(piece, square);
    }

    /** Returns the removed piece, or null if the square was empty. */
    public Piece remove(Square square) {
        Piece piece = pieceAt[square.index()];
        if(piece == null) {
            return null;
        }
        pieceAt[square.index()] = null;
        piece.setSquare(null);
        if(piece.type() == PieceType.KING && square.equals(kingSquares[piece.color().ordinal()])) {
            kingSquares[piece.color().ordinal()] = null;
        }
        zobristKey ^= ZobristHashKeys.pieceKey(piece, square);
        return piece;
    }

    /** Null if that color has no king on the board (only possible in hand-made test setups). */
    public Square getKingSquare(Color color) {
        return kingSquares[color.ordinal()];
    }

    public Square getEnPassantSquare() {
        return enPassantSquare;
    }

    public void setEnPassantSquare(Square enPassantSquare) {
        zobristKey ^= ZobristHashKeys.enPassantKey(this.enPassantSquare);
        this.enPassantSquare = enPassantSquare;
        zobristKey ^= ZobristHashKeys.enPassantKey(enPassantSquare);
    }

    public long zobristKey() {
        return zobristKey;
    }

    /** Pieces of a color in square order a1..h8. */
    public List<Piece> getPieces(Color color) {
        List<Piece> pieces = new ArrayList<>(16);
        for(Piece piece : pieceAt) {
            if(piece != null && piece.color() == color) {
                pieces.add(piece);
            }
        }
        return pieces;
    }

    public int countPieces() {
        int count = 0;
        for(Piece piece : pieceAt) {
            if(piece != null) count++;
        }
        return count;
    }

    public MovePlayed playMove(Move move) {
        Square from = move.from();
        Square to = move.to();
        Piece piece = pieceAt[from.index()];
        if(piece == null) {
            throw new IllegalStateException("No piece on " + from + " to play " + move);
        }
        boolean previousHasMoved = piece.hasMoved();
        Square previousEnPassantSquare = enPassantSquare;

        Piece pieceEaten = null;
        Square pieceEatenSquare = null;
        Piece rook = null;
        Square rookFrom = null;
        Square rookTo = null;
        boolean previousRookHasMoved = false;
        Piece promotedPiece = null;

        if(move.kind() == MoveKind.EN_PASSANT) {
            // The passed pawn stands beside the start square, not on the destination
            pieceEatenSquare = Square.of(to.file(), from.rank());
            pieceEaten = remove(pieceEatenSquare);
        } else if(move.kind() == MoveKind.CASTLE) {
            boolean kingSide = to.file() > from.file();
            rookFrom = Square.of(kingSide ? 7 : 0, from.rank());
            rookTo = Square.of(kingSide ? 5 : 3, from.rank());
            rook = remove(rookFrom);
            previousRookHasMoved = rook.hasMoved();
        } else if(pieceAt[to.index()] != null) {
            pieceEatenSquare = to;
            pieceEaten = remove(to);
        }

        remove(from);
        if(move.promotion() != null) {
            promotedPiece = new Piece(move.promotion(), piece.color(), true);
            place(to, promotedPiece);
        } else {
            place(to, piece);
        }
        piece.setMoved(true);

        if(rook != null) {
            place(rookTo, rook);
            rook.setMoved(true);
        }

        if(piece.type() == PieceType.PAWN && Math.abs(to.rank() - from.rank()) == 2) {
            setEnPassantSquare(Square.of(from.file(), (from.rank() + to.rank()) / 2));
        } else {
            setEnPassantSquare(null);
        }

        return new MovePlayed(move, piece, previousHasMoved, pieceEaten, pieceEatenSquare,
                rook, rookFrom, rookTo, previousRookHasMoved, promotedPiece, previousEnPassantSquare);
    }

    public void undoMove(MovePlayed movePlayed) {
        Move move = movePlayed.move();
        Piece piece = movePlayed.piece();

        remove(move.to());
        place(move.from(), piece);
        piece.setMoved(movePlayed.previousHasMoved());

        if(movePlayed.rook() != null) {
            Piece rook = movePlayed.rook();
            remove(movePlayed.rookTo());
            place(movePlayed.rookFrom(), rook);
            rook.setMoved(movePlayed.previousRookHasMoved());
        }

        if(movePlayed.pieceEaten() != null) {
            place(movePlayed.pieceEatenSquare(), movePlayed.pieceEaten());
        }

        setEnPassantSquare(movePlayed.previousEnPassantSquare());
    }

    @Override
    public boolean equals(Object o) {
        if(this == o) return true;
        if(!(o instanceof Board other)) return false;
        if(zobristKey != other.zobristKey) return false;
        if(enPassantSquare != other.enPassantSquare) return false;
        for(int i = 0; i < 64; i++) {
            Piece piece = pieceAt[i];
            Piece otherPiece = other.pieceAt[i];
            if(piece == null ? otherPiece != null : !piece.sameAs(otherPiece)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(zobristKey);
    }
}
