package chessbot.engine.movegen;

public enum MoveKind {
    NORMAL, CAPTURE, CASTLE, PROMOTION, EN_PASSANT
}
