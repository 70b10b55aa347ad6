package chessbot.engine.uci;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/** Bridge between the UCI text loop and the engine. */
public interface UciEngine {
    /** Called on "ucinewgame". */
    void newGame();

    /** Called on "isready". Do any lazy init; return when ready. */
    default void onIsReady() {}

    /** "option name ..." lines printed after "id" on "uci". */
    default List<String> options() { return List.of(); }

    /** Called on "setoption name X value Y". */
    default void setOption(String name, String value) {}

    /** "position startpos [moves ...]" */
    void setPositionStartpos(List<String> uciMoves);

    /** "position fen <fen> [moves ...]" */
    void setPositionFEN(String fen, List<String> uciMoves);

    /**
     * Runs a search per the GoParams. The stop flag is set when the GUI sends "stop".
     * Progress goes to {@code infoSink} as "info ..." lines.
     */
    UciResult search(UciServer.GoParams go, AtomicBoolean stopFlag, Consumer<String> infoSink);

    /** Debug hook for the "print" command. */
    default void debugDump(Consumer<String> out) {}
}
