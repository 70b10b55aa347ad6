package chessbot.engine.game;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class RepetitionCounterTest {

    @Test
    public void countsShouldGoUpAndDown() {
        RepetitionCounter counter = new RepetitionCounter();

        counter.inc(42L);
        counter.inc(42L);
        counter.inc(7L);

        assertEquals(2, counter.get(42L));
        assertEquals(1, counter.get(7L));
        assertEquals(0, counter.get(8L));

        counter.dec(42L);
        counter.dec(7L);
        assertEquals(1, counter.get(42L));
        assertEquals(0, counter.get(7L));
    }

    @Test
    public void clearShouldForgetEverything() {
        RepetitionCounter counter = new RepetitionCounter(16);
        counter.inc(1L);
        counter.inc(2L);

        counter.clear();

        assertEquals(0, counter.get(1L));
        assertEquals(0, counter.get(2L));
    }
}
