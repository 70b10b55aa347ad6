package chessbot.engine.game;

import chessbot.engine.common.Color;
import chessbot.engine.common.Square;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;

import java.util.Random;

// https://www.chessprogramming.org/Zobrist_Hashing
public final class ZobristHashKeys {
    private static final long[][][] PIECE_KEYS = new long[2][6][64];
    private static final long[] EN_PASSANT_FILE_KEYS = new long[8];
    private static final long WHITE_KING_SIDE_CASTLE_KEY;
    private static final long WHITE_QUEEN_SIDE_CASTLE_KEY;
    private static final long BLACK_KING_SIDE_CASTLE_KEY;
    private static final long BLACK_QUEEN_SIDE_CASTLE_KEY;
    private static final long BLACK_TO_MOVE_KEY;

    static {
        // Fixed seed so keys (and therefore repetition detection) are reproducible between runs
        Random random = new Random(0x5EED_C0FFEEL);
        for(int color = 0; color < 2; color++) {
            for(int type = 0; type < 6; type++) {
                for(int sq = 0; sq < 64; sq++) {
                    PIECE_KEYS[color][type][sq] = random.nextLong();
                }
            }
        }
        for(int file = 0; file < 8; file++) {
            EN_PASSANT_FILE_KEYS[file] = random.nextLong();
        }
        WHITE_KING_SIDE_CASTLE_KEY = random.nextLong();
        WHITE_QUEEN_SIDE_CASTLE_KEY = random.nextLong();
        BLACK_KING_SIDE_CASTLE_KEY = random.nextLong();
        BLACK_QUEEN_SIDE_CASTLE_KEY = random.nextLong();
        BLACK_TO_MOVE_KEY = random.nextLong();
    }

    private ZobristHashKeys() {}

    public static long pieceKey(Piece piece, Square square) {
        return PIECE_KEYS[piece.color().ordinal()][piece.type().ordinal()][square.index()];
    }

    public static long enPassantKey(Square enPassantSquare) {
        return enPassantSquare == null ? 0L : EN_PASSANT_FILE_KEYS[enPassantSquare.file()];
    }

    public static long castlingKey(boolean whiteKingSide, boolean whiteQueenSide,
                                   boolean blackKingSide, boolean blackQueenSide) {
        long key = 0;
        if(whiteKingSide) key ^= WHITE_KING_SIDE_CASTLE_KEY;
        if(whiteQueenSide) key ^= WHITE_QUEEN_SIDE_CASTLE_KEY;
        if(blackKingSide) key ^= BLACK_KING_SIDE_CASTLE_KEY;
        if(blackQueenSide) key ^= BLACK_QUEEN_SIDE_CASTLE_KEY;
        return key;
    }

    public static long sideKey(Color sideToMove) {
        return sideToMove == Color.BLACK ? BLACK_TO_MOVE_KEY : 0L;
    }

    // Full recomputation; the board maintains its part incrementally on the hot path
    public static long getHashKey(Game game) {
        Board board = game.board();
        long key = 0;
        for(int i = 0; i < 64; i++) {
            Square square = Square.of(i);
            Piece piece = board.get(square);
            if(piece != null) {
                key ^= pieceKey(piece, square);
            }
        }
        key ^= enPassantKey(board.getEnPassantSquare());
        key ^= castlingKey(game.whiteCanCastleKingSide, game.whiteCanCastleQueenSide,
                game.blackCanCastleKingSide, game.blackCanCastleQueenSide);
        key ^= sideKey(game.currentPlayer());
        return key;
    }
}
