package com.github.rudygunawan.memoizor.model;

/**
 * How a resolved argument list is turned into a cache key.
 */
public enum KeyMode {
    /**
     * Order-independent normalized JSON of the arguments, prefixed with the uid and hashed with MD5.
     * A configured {@link com.github.rudygunawan.memoizor.api.KeyGenerator} replaces the hash.
     */
    DEFAULT,

    /**
     * The string form of each argument joined with a NUL character. No hashing, and any configured
     * key generator is ignored.
     */
    PRIMITIVE
}
