package com.github.rudygunawan.memoizor.api;

/**
 * Replaces an argument with the value used for cache-key derivation and storage.
 *
 * <p>Coercion never changes what the memoized function receives; it only changes how a call is
 * identified. A typical use is collapsing arguments that should share one cache entry:
 * <pre>{@code
 * Memoizor.newBuilder()
 *     .coerceArgs((arg, index) -> String.valueOf(arg).toLowerCase())
 *     .build(inv -> lookup(inv.arg(0)));
 * }</pre>
 */
@FunctionalInterface
public interface ArgumentCoercer {

    /**
     * @param arg the raw argument
     * @param index the argument's position in the (truncated) argument list
     * @return the value that stands in for {@code arg} when deriving the key
     */
    Object coerce(Object arg, int index);
}
