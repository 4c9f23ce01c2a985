package com.github.rudygunawan.memoizor.api;

import java.util.List;

/**
 * Produces a cache key from a namespace and a resolved argument list.
 *
 * <p>The returned value is used verbatim, without hashing. Implementations are responsible for
 * returning equal keys for equal signatures and distinct keys otherwise.
 */
@FunctionalInterface
public interface KeyGenerator {

    /**
     * @param uid the memoizor namespace
     * @param resolvedArgs the arguments after truncation, coercion and exclusion
     * @return the cache key, never {@code null}
     */
    Object generate(String uid, List<Object> resolvedArgs);
}
