package com.github.rudygunawan.memoizor.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the immutable statistics snapshot.
 */
class MemoStatsTest {

    @Test
    void testRatesWithNoRequests() {
        MemoStats empty = new MemoStats(0, 0, 0, 0, 0);
        assertEquals(0, empty.requestCount());
        assertEquals(1.0, empty.hitRate());
        assertEquals(0.0, empty.missRate());
    }

    @Test
    void testRates() {
        MemoStats stats = new MemoStats(3, 1, 1, 0, 0);
        assertEquals(4, stats.requestCount());
        assertEquals(0.75, stats.hitRate(), 0.0001);
        assertEquals(0.25, stats.missRate(), 0.0001);
    }

    @Test
    void testMinusFloorsAtZeroAndPlusAdds() {
        MemoStats later = new MemoStats(5, 4, 3, 2, 1);
        MemoStats earlier = new MemoStats(2, 4, 5, 0, 1);

        assertEquals(new MemoStats(3, 0, 0, 2, 0), later.minus(earlier));
        assertEquals(new MemoStats(7, 8, 8, 2, 2), later.plus(earlier));
        assertEquals(later.hashCode(), new MemoStats(5, 4, 3, 2, 1).hashCode());
    }
}
