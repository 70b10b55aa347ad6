package chessbot.engine.uci;

import chessbot.engine.game.Game;
import chessbot.engine.game.board.utils.BoardGenerator;
import chessbot.engine.search.Difficulty;
import chessbot.engine.search.SearchConfig;
import chessbot.engine.search.SearchFacade;
import chessbot.engine.search.SearchLimits;
import chessbot.engine.search.SearchResult;
import chessbot.engine.utils.notations.FENUtils;
import chessbot.engine.utils.notations.MoveIOUtils;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.stream.Collectors;

public class UciEngineImpl implements UciEngine {
    private Game game;

    // Used when "go" carries neither a depth nor any time, 0 keeps the difficulty's own thinking time
    private volatile long defaultMoveTimeMs = Long.getLong("movetime.default", 0L);

    public final SearchConfig cfg = new SearchConfig.Builder()
            .debug(Boolean.parseBoolean(System.getProperty("debug", "false")))
            .build();

    private final SearchFacade engine = new SearchFacade(cfg,
            Difficulty.fromName(System.getProperty("difficulty", Difficulty.MEDIUM.name())));

    public UciEngineImpl() {
        setPositionStartpos(List.of());
    }

    @Override
    public void newGame() {
        setPositionStartpos(List.of());
    }

    @Override
    public List<String> options() {
        String levels = Arrays.stream(Difficulty.values())
                .map(d -> " var " + d.name())
                .collect(Collectors.joining());
        return List.of(
                "option name Difficulty type combo default " + engine.difficulty().name() + levels,
                "option name MoveTime type spin default " + defaultMoveTimeMs + " min 0 max 600000");
    }

    @Override
    public void setOption(String name, String value) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "difficulty" -> engine.setDifficulty(Difficulty.fromName(value));
            case "movetime" -> defaultMoveTimeMs = clampLong(value, 0, 600_000, defaultMoveTimeMs);
            default -> System.err.println("Unknown option " + name + " ignored");
        }
    }

    @Override
    public void setPositionStartpos(List<String> uciMoves) {
        setPositionFEN(BoardGenerator.STANDARD_GAME, uciMoves);
    }

    @Override
    public void setPositionFEN(String fen, List<String> uciMoves) {
        // Parse into a fresh game so a bad move keeps the previous position
        Game newGame = FENUtils.getBoardFrom(fen);
        newGame.playMoves(uciMoves);
        game = newGame;
    }

    public Game game() {
        return game;
    }

    public Difficulty difficulty() {
        return engine.difficulty();
    }

    @Override
    public UciResult search(UciServer.GoParams go, AtomicBoolean stopFlag, Consumer<String> infoSink) {
        if (game == null) {
            return UciResult.none();
        }
        SearchLimits limits = go.toLimits();
        if (defaultMoveTimeMs > 0 && limits.depth() == -1 && !limits.infinite()
                && limits.moveTimeMs() == -1 && limits.wtime() == -1 && limits.btime() == -1) {
            limits = SearchLimits.ofMoveTime(defaultMoveTimeMs);
        }
        SearchResult searchResult = engine.findBestMove(game, stopFlag, limits, infoSink);
        if (searchResult.move() == null) {
            infoSink.accept("info string no legal move, game status " + game.getStatus());
            return UciResult.none();
        }
        return UciResult.best(MoveIOUtils.writeAlgebraicNotation(searchResult.move()));
    }

    @Override
    public void debugDump(Consumer<String> out) {
        if (game == null) {
            out.accept("info string no position");
            return;
        }
        for (String line : Game.boardWithFen(game).split("\n")) {
            out.accept(line);
        }
        out.accept("Status: " + game.getStatus() + ", difficulty: " + engine.difficulty());
    }

    private static long clampLong(String s, long lo, long hi, long dflt) {
        try { long v = Long.parseLong(s.trim()); return Math.min(hi, Math.max(lo, v)); }
        catch (NumberFormatException e) { return dflt; }
    }
}
