package com.github.rudygunawan.memoizor;

import com.github.rudygunawan.memoizor.api.AsyncMemoizedFunction;
import com.github.rudygunawan.memoizor.api.AsyncTarget;
import com.github.rudygunawan.memoizor.api.CallbackMemoizedFunction;
import com.github.rudygunawan.memoizor.api.CallbackTarget;
import com.github.rudygunawan.memoizor.api.MemoizedFunction;
import com.github.rudygunawan.memoizor.api.SyncTarget;
import com.github.rudygunawan.memoizor.builder.MemoizorBuilder;

/**
 * Entry point for memoizing functions with default options.
 *
 * <pre>{@code
 * MemoizedFunction<Long> fib = Memoizor.sync(inv -> slowFib(inv.<Integer>arg(0)));
 *
 * AsyncMemoizedFunction<User> user = Memoizor.newBuilder()
 *     .name("user")
 *     .ttl(Duration.ofMinutes(5))
 *     .maxRecords(10_000)
 *     .buildAsync(inv -> client.fetchUser(inv.<String>arg(0)));
 * }</pre>
 *
 * @see MemoizorBuilder
 */
public final class Memoizor {

    private Memoizor() {
    }

    /**
     * Returns a builder for memoized functions with custom options.
     */
    public static MemoizorBuilder newBuilder() {
        return MemoizorBuilder.newBuilder();
    }

    /**
     * Memoizes a synchronous function with default options.
     */
    public static <R> MemoizedFunction<R> sync(SyncTarget<R> target) {
        return newBuilder().build(target);
    }

    /**
     * Memoizes a future-returning function with default options.
     */
    public static <R> AsyncMemoizedFunction<R> async(AsyncTarget<R> target) {
        return newBuilder().buildAsync(target);
    }

    /**
     * Memoizes a callback-style function with default options.
     */
    public static CallbackMemoizedFunction callback(CallbackTarget target) {
        return newBuilder().buildCallback(target);
    }
}
