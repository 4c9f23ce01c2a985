package com.github.rudygunawan.memoizor.model;

/**
 * Sentinel returned by storage lookups when no entry exists for a key.
 *
 * <p>It is distinct from every value a memoized function can produce, {@code null} included, so a
 * function that legitimately returns {@code null} still gets its result cached.
 *
 * @see com.github.rudygunawan.memoizor.storage.StorageController#NOT_CACHED
 */
public enum NotCached {
    INSTANCE;

    @Override
    public String toString() {
        return "NOT_CACHED";
    }
}
