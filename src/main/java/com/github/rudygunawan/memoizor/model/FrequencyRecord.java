package com.github.rudygunawan.memoizor.model;

/**
 * Access bookkeeping for one stored key, used by overflow eviction.
 *
 * <p>Instances are mutable and are only touched while the owning engine holds its lock.
 */
public class FrequencyRecord {
    /** Last-access value given to records that have never been read. */
    public static final long NEVER_ACCESSED = Long.MAX_VALUE;

    private final Object key;
    private long frequency;
    private long lastAccess = NEVER_ACCESSED;

    public FrequencyRecord(Object key) {
        this.key = key;
    }

    public Object getKey() {
        return key;
    }

    public long getFrequency() {
        return frequency;
    }

    public long getLastAccess() {
        return lastAccess;
    }

    /**
     * Counts one retrieval at the given tick.
     */
    public void recordAccess(long now) {
        frequency++;
        lastAccess = now;
    }

    @Override
    public String toString() {
        return "FrequencyRecord{key=" + key + ", frequency=" + frequency + ", lastAccess=" + lastAccess + '}';
    }
}
