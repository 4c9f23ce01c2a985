package com.github.rudygunawan.memoizor.api;

/**
 * A callback-style function that can be memoized with {@code Memoizor.callback}.
 *
 * <p>One of the invocation's arguments is a {@link Callback} the target must complete. Unless
 * {@code callbackIndex} is configured, it is the last argument.
 * <pre>{@code
 * CallbackMemoizedFunction doubled = Memoizor.callback(inv -> {
 *     Callback done = inv.arg(1);
 *     done.complete(null, inv.<Integer>arg(0) * 2);
 * });
 * doubled.call(4, (err, results) -> System.out.println(results[0]));
 * }</pre>
 */
@FunctionalInterface
public interface CallbackTarget {

    /**
     * Starts the call. Exceptions thrown here are delivered to the caller's callback.
     */
    void call(Invocation invocation) throws Exception;
}
