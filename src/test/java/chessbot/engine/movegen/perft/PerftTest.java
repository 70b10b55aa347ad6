package chessbot.engine.movegen.perft;

import chessbot.engine.game.Game;
import chessbot.engine.game.GameChanges;
import chessbot.engine.game.board.utils.BoardGenerator;
import chessbot.engine.movegen.Move;
import chessbot.engine.utils.notations.FENUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class PerftTest {

    private static Stream<Arguments> perftCases() {
        return PerftTestSet.PERFT_TEST_FEN_MAP.entrySet().stream()
                .flatMap(entry -> entry.getValue().entrySet().stream()
                        .map(depthAndCount -> Arguments.of(
                                PerftTestSet.FEN_TEST_NAMES.get(entry.getKey()),
                                entry.getKey(),
                                depthAndCount.getKey(),
                                depthAndCount.getValue())));
    }

    @ParameterizedTest(name = "{0} at depth {2}")
    @MethodSource("perftCases")
    public void perftShouldMatchKnownNodeCounts(String name, String fen, int depth, long expectedNodes) {
        // Given
        Game game = FENUtils.getBoardFrom(fen);
        String fenBefore = FENUtils.getFENFromBoard(game);
        long keyBefore = game.zobristKey();

        // When
        long nodes = perft(game, depth);

        // Then
        assertEquals(expectedNodes, nodes, name);
        assertEquals(fenBefore, FENUtils.getFENFromBoard(game), "Perft must leave the position untouched");
        assertEquals(keyBefore, game.zobristKey());
    }

    @Test
    public void divideShouldSplitNodesPerRootMove() {
        Game game = BoardGenerator.newStandardGameBoard();

        Map<String, Long> divided = divide(game, 2);

        assertEquals(20, divided.size());
        assertEquals(400L, divided.values().stream().mapToLong(Long::longValue).sum());
        assertEquals(20L, divided.get("e2e4"));
    }

    static long perft(Game game, int depth) {
        if(depth == 0) {
            return 1;
        }
        List<Move> moves = game.getLegalMoves();
        if(depth == 1) {
            return moves.size();
        }
        long nodes = 0;
        for(Move move : moves) {
            GameChanges gameChanges = game.playMove(move);
            nodes += perft(game, depth - 1);
            game.undoMove(gameChanges);
        }
        return nodes;
    }

    // Per-move breakdown, handy when a count is off
    static Map<String, Long> divide(Game game, int depth) {
        Map<String, Long> result = new TreeMap<>();
        for(Move move : game.getLegalMoves()) {
            GameChanges gameChanges = game.playMove(move);
            result.put(move.toString(), perft(game, depth - 1));
            game.undoMove(gameChanges);
        }
        return result;
    }
}
