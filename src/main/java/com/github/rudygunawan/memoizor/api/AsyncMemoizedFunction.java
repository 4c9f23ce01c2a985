package com.github.rudygunawan.memoizor.api;

import com.github.rudygunawan.memoizor.model.MemoOptions;

import java.util.concurrent.CompletableFuture;

/**
 * A memoized future-returning function.
 *
 * <p>Concurrent calls with the same key that both miss will both invoke the target and both save;
 * the later save wins.
 *
 * @param <R> the result type
 */
public interface AsyncMemoizedFunction<R> extends MemoizedControl {

    /**
     * Returns a future of the cached result for {@code args}, invoking and caching the target on a
     * miss. The future fails with the target's exception, which is never cached.
     */
    CompletableFuture<R> call(Object... args);

    /**
     * Completes with the stored value for {@code args}, or {@code NOT_CACHED}.
     */
    CompletableFuture<Object> get(Object... args);

    /**
     * Stores {@code value} as the result for {@code args}; completes with {@code value} once the
     * storage controller has finished.
     */
    CompletableFuture<R> save(R value, Object... args);

    /**
     * Completes with the removed value, or {@code NOT_CACHED}.
     */
    CompletableFuture<Object> delete(Object... args);

    CompletableFuture<Void> empty();

    default CompletableFuture<Void> clear() {
        return empty();
    }

    default CompletableFuture<Boolean> disable() {
        return disable(false);
    }

    /**
     * Completes with {@code false} if the function was already disabled.
     */
    CompletableFuture<Boolean> disable(boolean emptyFirst);

    CompletableFuture<Void> setOptions(MemoOptions options, boolean clearStore);
}
