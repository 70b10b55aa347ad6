package chessbot.engine.game;

import it.unimi.dsi.fastutil.longs.Long2IntOpenHashMap;

/**
 * Counts how many times each position (by Zobrist key) has occurred in the current game.
 * Every {@code inc} done when a move is played is matched by a {@code dec} when it is undone.
 */
public final class RepetitionCounter {
    private final Long2IntOpenHashMap counts;

    public RepetitionCounter() {
        this(256);
    }

    public RepetitionCounter(int expectedPositions) {
        this.counts = new Long2IntOpenHashMap(expectedPositions);
        this.counts.defaultReturnValue(0);
    }

    public void inc(long key) {
        counts.addTo(key, 1);
    }

    /** Decrement; the entry is dropped when it reaches zero. */
    public void dec(long key) {
        int count = counts.get(key);
        if(count <= 1) {
            counts.remove(key);
        } else {
            counts.put(key, count - 1);
        }
    }

    /** Current count (0 if absent). */
    public int get(long key) {
        return counts.get(key);
    }

    public void clear() {
        counts.clear();
    }
}
