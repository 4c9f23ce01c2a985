package com.github.rudygunawan.memoizor.metrics;

/**
 * Live counters of one memoized function.
 * This is used by MicrometerMemoizorMetrics to collect and expose metrics.
 */
public interface MemoizorMetrics {

    /**
     * Returns the name metrics are tagged with.
     */
    String name();

    /**
     * Returns the number of records counted toward {@code maxRecords}. Always zero when no record
     * limit is configured.
     */
    long recordCount();

    /**
     * Returns the total number of retrievals that found a value.
     */
    long hitCount();

    /**
     * Returns the total number of retrievals that found nothing or an expired value.
     */
    long missCount();

    /**
     * Returns the total number of saves.
     */
    long saveCount();

    /**
     * Returns the total number of keys removed by overflow eviction.
     */
    long evictionCount();

    /**
     * Returns the total number of keys removed because their TTL elapsed.
     */
    long expirationCount();

    /**
     * Returns the hit ratio, from 0.0 to 1.0.
     */
    default double hitRatio() {
        long hits = hitCount();
        long total = hits + missCount();
        return total == 0 ? 0.0 : (double) hits / total;
    }
}
