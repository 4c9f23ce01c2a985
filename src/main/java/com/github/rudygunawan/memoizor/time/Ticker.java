package com.github.rudygunawan.memoizor.time;

/**
 * A time source that returns the current time in nanoseconds.
 *
 * <p>The memoizor engine reads this ticker to stamp entry creation (for TTL expiry) and last access
 * (for overflow eviction). Tests can supply a fake ticker to move time forward without sleeping.
 *
 * <p><b>Testing Usage:</b>
 * <pre>{@code
 * FakeTicker ticker = new FakeTicker();
 *
 * MemoizedFunction<Integer> doubled = Memoizor.newBuilder()
 *     .ticker(ticker)
 *     .ttl(500, TimeUnit.MILLISECONDS)
 *     .build(inv -> inv.<Integer>arg(0) * 2);
 *
 * doubled.call(4);
 * ticker.advance(500, TimeUnit.MILLISECONDS);
 *
 * // The entry has expired and is removed on this lookup
 * assertSame(StorageController.NOT_CACHED, doubled.get(4));
 * }</pre>
 */
@FunctionalInterface
public interface Ticker {

    /**
     * Returns the number of nanoseconds elapsed since some fixed but arbitrary point in time.
     *
     * @return the number of nanoseconds elapsed since some arbitrary point in time
     */
    long read();

    /**
     * Returns a ticker that reads the current time using {@link System#nanoTime()}.
     *
     * @return a ticker that uses the system's nanosecond-precision clock
     */
    static Ticker systemTicker() {
        return SystemTicker.INSTANCE;
    }

    /**
     * Default system ticker implementation using System.nanoTime().
     */
    enum SystemTicker implements Ticker {
        INSTANCE;

        @Override
        public long read() {
            return System.nanoTime();
        }

        @Override
        public String toString() {
            return "Ticker.systemTicker()";
        }
    }
}
