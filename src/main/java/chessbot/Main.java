package chessbot;

import chessbot.engine.uci.UciEngine;
import chessbot.engine.uci.UciEngineImpl;
import chessbot.engine.uci.UciServer;

public class Main {
    public static void main(String[] args) {
        UciEngine engine = new UciEngineImpl();
        new UciServer("ChessBot", "ChessBot developers", engine).run();
    }
}
