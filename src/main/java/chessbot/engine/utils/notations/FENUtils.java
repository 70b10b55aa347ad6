package chessbot.engine.utils.notations;

import chessbot.engine.common.Color;
import chessbot.engine.common.PieceType;
import chessbot.engine.common.Square;
import chessbot.engine.exceptions.InvalidSquareException;
import chessbot.engine.game.Game;
import chessbot.engine.game.board.Board;
import chessbot.engine.game.board.Piece;
import chessbot.engine.movegen.pieces.Pawn;

// FEN Visualizer: https://www.redhotpawn.com/chess/chess-fen-viewer.php
public class FENUtils {

    private FENUtils() {}

    // https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
    public static Game getBoardFrom(String FEN) {
        if(FEN == null) {
            throw new IllegalArgumentException("Invalid FEN record: null");
        }
        String[] fenFields = FEN.trim().split("\\s+");

        // The two clocks are optional, a lot of tools drop them
        if(fenFields.length != 6 && fenFields.length != 4) {
            throw new IllegalArgumentException("Invalid FEN record: " + FEN);
        }

        Game game = new Game();
        injectPiecePlacement(game, fenFields[0]);
        injectCurrentTurn(game, fenFields[1]);
        injectCastlingRights(game, fenFields[2]);
        injectEnPassantSquare(game, fenFields[3]);
        if(fenFields.length == 6) {
            injectHalfMoveClock(game, fenFields[4]);
            injectFullMoveNumber(game, fenFields[5]);
        }
        markUnmovedPieces(game);

        game.resetHistory();
        return game;
    }

    public static String getFENFromBoard(Game game) {
        StringBuilder fen = new StringBuilder();
        injectPiecePlacement(game, fen);
        injectCurrentTurn(game, fen);
        injectCastlingRights(game, fen);
        injectEnPassantSquare(game, fen);
        injectHalfMoveClock(game, fen);
        injectFullMoveNumber(game, fen);
        return fen.toString();
    }

    private static void injectHalfMoveClock(Game game, StringBuilder fen) {
        fen.append(' ').append(game.halfMoveClock);
    }

    private static void injectEnPassantSquare(Game game, StringBuilder fen) {
        fen.append(' ');
        Square enPassantSquare = game.board().getEnPassantSquare();
        if(enPassantSquare != null) {
            fen.append(enPassantSquare.toAlgebraic());
        } else {
            fen.append('-');
        }
    }

    private static void injectCastlingRights(Game game, StringBuilder fen) {
        fen.append(' ');
        StringBuilder castlingRights = new StringBuilder();
        if(game.whiteCanCastleKingSide) {
            castlingRights.append("K");
        }
        if(game.whiteCanCastleQueenSide) {
            castlingRights.append("Q");
        }
        if(game.blackCanCastleKingSide) {
            castlingRights.append("k");
        }
        if(game.blackCanCastleQueenSide) {
            castlingRights.append("q");
        }

        if(castlingRights.isEmpty()) {
            fen.append('-');
        } else {
            fen.append(castlingRights);
        }
    }

    private static void injectCurrentTurn(Game game, StringBuilder fen) {
        fen.append(' ').append(game.currentPlayer() == Color.BLACK ? 'b' : 'w');
    }

    private static void injectPiecePlacement(Game game, StringBuilder fen) {
        Board board = game.board();
        for(int rank = 7; rank >= 0; rank--) {
            int emptySpaceCounter = 0;
            if(rank != 7) {
                fen.append('/');
            }
            for(int file = 0; file < 8; file++) {
                Piece piece = board.get(Square.of(file, rank));
                if(piece == null) {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(piece.toFenLetter());
            }

            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
    }

    private static void injectFullMoveNumber(Game game, StringBuilder fen) {
        fen.append(' ').append(game.fullMoveClock);
    }

    private static void injectFullMoveNumber(Game game, String fullMoveNumber) {
        game.fullMoveClock = parseClock(fullMoveNumber);
    }

    private static void injectHalfMoveClock(Game game, String halfMoveClock) {
        game.halfMoveClock = parseClock(halfMoveClock);
    }

    private static int parseClock(String clock) {
        try {
            int value = Integer.parseInt(clock);
            if(value < 0) {
                throw new IllegalArgumentException("Negative FEN clock " + clock);
            }
            return value;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid FEN clock " + clock, e);
        }
    }

    private static void injectEnPassantSquare(Game game, String enPassantSquare) {
        if("-".equals(enPassantSquare)) {
            game.board().setEnPassantSquare(null);
            return;
        }
        try {
            game.board().setEnPassantSquare(Square.fromAlgebraic(enPassantSquare));
        } catch (InvalidSquareException e) {
            throw new IllegalArgumentException("Invalid FEN en passant square " + enPassantSquare, e);
        }
    }

    private static void injectCastlingRights(Game game, String castlingRights) {
        boolean whiteCanCastleKingSide = false;
        boolean whiteCanCastleQueenSide = false;
        boolean blackCanCastleKingSide = false;
        boolean blackCanCastleQueenSide = false;

        if(!"-".equals(castlingRights)) {
            for(char character : castlingRights.toCharArray()) {
                switch (character) {
                    case 'K' -> whiteCanCastleKingSide = true;
                    case 'k' -> blackCanCastleKingSide = true;
                    case 'Q' -> whiteCanCastleQueenSide = true;
                    case 'q' -> blackCanCastleQueenSide = true;
                    default -> throw new IllegalArgumentException("Invalid FEN castling rights " + castlingRights);
                }
            }
        }
        game.setBlackCanCastleKingSide(blackCanCastleKingSide);
        game.setBlackCanCastleQueenSide(blackCanCastleQueenSide);
        game.setWhiteCanCastleKingSide(whiteCanCastleKingSide);
        game.setWhiteCanCastleQueenSide(whiteCanCastleQueenSide);
    }

    private static void injectCurrentTurn(Game game, String currentTurn) {
        switch (currentTurn) {
            case "w" -> game.setCurrentPlayer(Color.WHITE);
            case "b" -> game.setCurrentPlayer(Color.BLACK);
            default -> throw new IllegalArgumentException("Invalid FEN side to move " + currentTurn);
        }
    }

    private static void injectPiecePlacement(Game game, String piecePlacement) {
        String[] piecePlacementRows = piecePlacement.split("/");
        if(piecePlacementRows.length != 8) {
            throw new IllegalArgumentException("Invalid FEN piece placement " + piecePlacement);
        }
        int rank = 7;
        for(String piecePlacementRow : piecePlacementRows) {
            int file = 0;
            for(char character : piecePlacementRow.toCharArray()) {
                if(character >= '1' && character <= '8') {
                    file += character - '0';
                    continue;
                }
                if(file > 7) {
                    throw new IllegalArgumentException("Invalid FEN piece placement " + piecePlacement);
                }
                Color color = Character.isUpperCase(character) ? Color.WHITE : Color.BLACK;
                PieceType pieceType = PieceType.fromLetter(character);
                // Every piece starts as moved, markUnmovedPieces fixes the ones that count
                game.board().place(Square.of(file, rank), new Piece(pieceType, color, true));
                file++;
            }
            if(file != 8) {
                throw new IllegalArgumentException("Invalid FEN piece placement " + piecePlacement);
            }
            rank--;
        }
    }

    /*
     * FEN carries no has-moved flags. Kings and rooks are unmoved when a castling right still
     * involves them, pawns are unmoved on their starting rank.
     */
    private static void markUnmovedPieces(Game game) {
        Board board = game.board();
        for(Color color : Color.values()) {
            boolean kingSide = game.canCastleKingSide(color);
            boolean queenSide = game.canCastleQueenSide(color);
            int homeRank = color.homeRank();
            if(kingSide || queenSide) {
                replaceAsUnmoved(board, Square.of(4, homeRank), PieceType.KING, color);
            }
            if(kingSide) {
                replaceAsUnmoved(board, Square.of(7, homeRank), PieceType.ROOK, color);
            }
            if(queenSide) {
                replaceAsUnmoved(board, Square.of(0, homeRank), PieceType.ROOK, color);
            }
            for(int file = 0; file < 8; file++) {
                replaceAsUnmoved(board, Square.of(file, Pawn.startingRank(color)), PieceType.PAWN, color);
            }
        }
    }

    private static void replaceAsUnmoved(Board board, Square square, PieceType type, Color color) {
        Piece piece = board.get(square);
        if(piece != null && piece.is(type, color)) {
            board.remove(square);
            board.place(square, new Piece(type, color, false));
        }
    }
}
