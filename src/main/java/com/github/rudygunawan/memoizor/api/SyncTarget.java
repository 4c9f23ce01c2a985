package com.github.rudygunawan.memoizor.api;

/**
 * A synchronous function that can be memoized with {@code Memoizor.sync}.
 *
 * @param <R> the result type
 */
@FunctionalInterface
public interface SyncTarget<R> {

    /**
     * Computes the result for one call.
     *
     * @throws Exception any failure, propagated unchanged to the caller and never cached
     */
    R call(Invocation invocation) throws Exception;
}
