package com.github.rudygunawan.memoizor.api;

import java.util.concurrent.CompletionStage;

/**
 * A future-returning function that can be memoized with {@code Memoizor.async}.
 *
 * @param <R> the result type
 */
@FunctionalInterface
public interface AsyncTarget<R> {

    /**
     * Starts computing the result for one call.
     *
     * <p>Both a thrown exception and an exceptionally completed stage fail the memoized call's
     * future with that exception; neither is cached.
     */
    CompletionStage<R> call(Invocation invocation) throws Exception;
}
