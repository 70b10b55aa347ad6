package chessbot.engine.uci;

import chessbot.engine.search.SearchLimits;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Minimal UCI server for cutechess / GUIs.
 * Searches run one at a time on a daemon thread, which is joined before the game is touched again.
 */
public final class UciServer {
    private final String name;
    private final String author;
    private final UciEngine engine;

    private final PrintWriter out;
    private final BufferedReader in;

    private Thread searchThread;
    private final AtomicBoolean stopFlag = new AtomicBoolean(false);

    public UciServer(String name, String author, UciEngine engine) {
        this(name, author, engine,
                new BufferedReader(new InputStreamReader(System.in, StandardCharsets.US_ASCII)),
                new PrintWriter(new BufferedWriter(new OutputStreamWriter(System.out, StandardCharsets.US_ASCII)), true));
    }

    public UciServer(String name, String author, UciEngine engine, BufferedReader in, PrintWriter out) {
        this.name = Objects.requireNonNull(name);
        this.author = Objects.requireNonNull(author);
        this.engine = Objects.requireNonNull(engine);
        this.in = Objects.requireNonNull(in);
        this.out = Objects.requireNonNull(out);
    }

    /** Run the UCI loop on the current thread until "quit" or end of input. */
    public void run() {
        try {
            String line;
            while ((line = in.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) continue;
                if (!handle(line)) break;
            }
        } catch (IOException e) {
            // GUIs sometimes close pipes abruptly
            System.err.println("UCI input closed: " + e.getMessage());
        } finally {
            requestStopAndJoin();
        }
    }

    /** Handles one command line. Returns false on "quit". */
    boolean handle(String line) {
        if (line.equals("uci")) {
            send("id name " + name);
            send("id author " + author);
            engine.options().forEach(this::send);
            send("uciok");
        } else if (line.equals("isready")) {
            engine.onIsReady();
            send("readyok");
        } else if (line.startsWith("setoption")) {
            requestStopAndJoin();
            handleSetOption(line);
        } else if (line.equals("ucinewgame")) {
            requestStopAndJoin();
            engine.newGame();
        } else if (line.startsWith("position")) {
            requestStopAndJoin();
            handlePosition(line);
        } else if (line.startsWith("go")) {
            handleGo(line);
        } else if (line.equals("stop")) {
            requestStopAndJoin();
        } else if (line.equals("quit")) {
            requestStopAndJoin();
            return false;
        } else if (line.equals("print")) { // handy debug
            requestStopAndJoin();
            engine.debugDump(this::send);
        } else {
            // ignore unknown commands per UCI tolerance
            System.err.println("Unknown UCI command ignored: " + line);
        }
        return true;
    }

    /* -------------------- command handlers -------------------- */

    private void handleSetOption(String line) {
        // Syntax: setoption name <id> [value <x>]
        String rest = line.substring("setoption".length()).trim();
        if (rest.isEmpty()) return;

        String name = null, value = null;
        List<String> toks = Arrays.asList(rest.split("\\s+"));
        for (int i = 0; i < toks.size(); i++) {
            String t = toks.get(i);
            if (t.equals("name")) {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < toks.size() && !toks.get(i).equals("value")) {
                    if (sb.length() > 0) sb.append(' ');
                    sb.append(toks.get(i++));
                }
                i--; // step back one, for loop will ++
                name = sb.toString();
            } else if (t.equals("value")) {
                StringBuilder sb = new StringBuilder();
                i++;
                while (i < toks.size()) {
                    if (sb.length() > 0) sb.append(' ');
                    sb.append(toks.get(i++));
                }
                i--;
                value = sb.toString();
            }
        }
        if (name != null) {
            try {
                engine.setOption(name, value == null ? "" : value);
            } catch (IllegalArgumentException e) {
                send("info string " + e.getMessage());
            }
        }
    }

    private void handlePosition(String line) {
        // position [startpos | fen <FEN...>] [moves <m1> <m2> ...]
        String rest = line.substring("position".length()).trim();
        try {
            if (rest.startsWith("startpos")) {
                List<String> moves = Collections.emptyList();
                int idx = rest.indexOf("moves");
                if (idx >= 0) {
                    moves = splitMoves(rest.substring(idx + "moves".length()).trim());
                }
                engine.setPositionStartpos(moves);
            } else if (rest.startsWith("fen")) {
                String afterFen = rest.substring(3).trim();
                // Stop the FEN at "moves"
                String fen, movesPart = null;
                int movesIdx = afterFen.indexOf(" moves ");
                if (movesIdx >= 0) {
                    fen = afterFen.substring(0, movesIdx).trim();
                    movesPart = afterFen.substring(movesIdx + 7).trim();
                } else {
                    fen = afterFen.trim();
                }
                List<String> moves = movesPart == null ? Collections.emptyList() : splitMoves(movesPart);
                engine.setPositionFEN(fen, moves);
            }
        } catch (RuntimeException e) {
            // Keep the loop alive on malformed positions, the GUI sees why
            System.err.println("Rejected position command '" + line + "': " + e.getMessage());
            send("info string invalid position: " + e.getMessage());
        }
    }

    private static List<String> splitMoves(String s) {
        if (s.isEmpty()) return Collections.emptyList();
        String[] arr = s.trim().split("\\s+");
        return Arrays.asList(arr);
    }

    private void handleGo(String line) {
        GoParams gp = parseGo(line);
        requestStopAndJoin(); // ensure no previous search running
        stopFlag.set(false);
        searchThread = new Thread(() -> {
            try {
                UciResult res = engine.search(gp, stopFlag, this::sendInfo);
                if (res == null || res.bestmove == null || res.bestmove.isEmpty()) {
                    // UCI requires bestmove anyway
                    send("bestmove " + UciResult.NULL_MOVE);
                } else {
                    send("bestmove " + res.bestmove);
                }
            } catch (RuntimeException e) {
                System.err.println("Search failed: " + e);
                e.printStackTrace(System.err);
                send("bestmove " + UciResult.NULL_MOVE);
            }
        }, "uci-search");
        searchThread.setDaemon(true);
        searchThread.start();
    }

    static GoParams parseGo(String line) {
        GoParams gp = new GoParams();
        String[] t = line.split("\\s+");
        for (int i = 1; i < t.length; i++) {
            switch (t[i]) {
                case "wtime": gp.wtime = parseLong(t, ++i); break;
                case "btime": gp.btime = parseLong(t, ++i); break;
                case "movetime": gp.movetime = parseLong(t, ++i); break;
                case "depth": gp.depth = (int) parseLong(t, ++i); break;
                case "infinite": gp.infinite = true; break;
                default: /* ignore others (winc, binc, movestogo...) */ break;
            }
        }
        return gp;
    }

    private static long parseLong(String[] tok, int i) {
        if (i >= tok.length) return -1;
        try { return Long.parseLong(tok[i]); } catch (NumberFormatException e) { return -1; }
    }

    /* -------------------- lifecycle helpers -------------------- */

    private void requestStopAndJoin() {
        Thread t = searchThread;
        if (t != null && t.isAlive()) {
            stopFlag.set(true);
        }
        joinSearch();
    }

    private void joinSearch() {
        Thread t = searchThread;
        if (t == null) return;
        try {
            t.join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        searchThread = null;
    }

    private synchronized void send(String line) {
        out.println(line);
        out.flush();
    }

    private void sendInfo(String infoLine) {
        if (infoLine == null || infoLine.isEmpty()) return;
        if (!infoLine.startsWith("info")) send("info " + infoLine);
        else send(infoLine);
    }

    /** Search parameters passed on "go". All values are milliseconds, -1 when not given. */
    public static final class GoParams {
        public long wtime = -1, btime = -1;
        public long movetime = -1;
        public int depth = -1;
        public boolean infinite = false;

        public SearchLimits toLimits() {
            return new SearchLimits(depth, movetime, wtime, btime, infinite);
        }
    }
}
