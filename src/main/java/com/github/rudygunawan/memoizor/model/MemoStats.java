package com.github.rudygunawan.memoizor.model;

import java.util.Objects;

/**
 * Statistics about the behaviour of one memoized function. Instances of this class are immutable.
 *
 * <ul>
 *   <li>A retrieval that finds a stored value increments {@code hitCount}.
 *   <li>A retrieval that finds nothing, or finds an expired entry, increments {@code missCount}.
 *   <li>Every save increments {@code saveCount}.
 *   <li>Each key removed by overflow eviction increments {@code evictionCount}.
 *   <li>Each entry removed because its TTL elapsed increments {@code expirationCount}.
 * </ul>
 */
public class MemoStats {
    private final long hitCount;
    private final long missCount;
    private final long saveCount;
    private final long evictionCount;
    private final long expirationCount;

    public MemoStats(long hitCount, long missCount, long saveCount, long evictionCount, long expirationCount) {
        this.hitCount = hitCount;
        this.missCount = missCount;
        this.saveCount = saveCount;
        this.evictionCount = evictionCount;
        this.expirationCount = expirationCount;
    }

    /**
     * Returns {@code hitCount + missCount}.
     */
    public long requestCount() {
        return hitCount + missCount;
    }

    public long hitCount() {
        return hitCount;
    }

    public long missCount() {
        return missCount;
    }

    public long saveCount() {
        return saveCount;
    }

    public long evictionCount() {
        return evictionCount;
    }

    public long expirationCount() {
        return expirationCount;
    }

    /**
     * Returns the ratio of retrievals which were hits, or {@code 1.0} when nothing was retrieved yet.
     */
    public double hitRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 1.0 : (double) hitCount / requestCount;
    }

    /**
     * Returns the ratio of retrievals which were misses, or {@code 0.0} when nothing was retrieved yet.
     */
    public double missRate() {
        long requestCount = requestCount();
        return (requestCount == 0) ? 0.0 : (double) missCount / requestCount;
    }

    /**
     * Returns a new {@code MemoStats} representing the difference between this snapshot and
     * {@code other}, floored at zero.
     */
    public MemoStats minus(MemoStats other) {
        return new MemoStats(
                Math.max(0, hitCount - other.hitCount),
                Math.max(0, missCount - other.missCount),
                Math.max(0, saveCount - other.saveCount),
                Math.max(0, evictionCount - other.evictionCount),
                Math.max(0, expirationCount - other.expirationCount));
    }

    /**
     * Returns a new {@code MemoStats} representing the sum of this snapshot and {@code other}.
     */
    public MemoStats plus(MemoStats other) {
        return new MemoStats(
                hitCount + other.hitCount,
                missCount + other.missCount,
                saveCount + other.saveCount,
                evictionCount + other.evictionCount,
                expirationCount + other.expirationCount);
    }

    @Override
    public int hashCode() {
        return Objects.hash(hitCount, missCount, saveCount, evictionCount, expirationCount);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof MemoStats)) {
            return false;
        }
        MemoStats other = (MemoStats) obj;
        return hitCount == other.hitCount
                && missCount == other.missCount
                && saveCount == other.saveCount
                && evictionCount == other.evictionCount
                && expirationCount == other.expirationCount;
    }

    @Override
    public String toString() {
        return "MemoStats{"
                + "hitCount=" + hitCount
                + ", missCount=" + missCount
                + ", saveCount=" + saveCount
                + ", evictionCount=" + evictionCount
                + ", expirationCount=" + expirationCount
                + ", hitRate=" + String.format("%.2f%%", hitRate() * 100)
                + '}';
    }
}
