package com.github.rudygunawan.memoizor.api;

/**
 * Error-first completion callback used by callback-style functions.
 *
 * <p>A {@code null} error means success; the results follow in order.
 */
@FunctionalInterface
public interface Callback {

    /**
     * @param error the failure, or {@code null} on success
     * @param results zero or more result values
     */
    void complete(Throwable error, Object... results);
}
