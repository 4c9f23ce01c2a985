package com.github.rudygunawan.memoizor.storage;

import com.github.rudygunawan.memoizor.impl.Futures;
import com.github.rudygunawan.memoizor.model.NotCached;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * The persistence boundary of a memoized function.
 *
 * <p>A controller maps cache keys to stored results. The engine that owns it keeps frequency and
 * TTL bookkeeping on top; the controller itself only stores. Misses are reported with
 * {@link #NOT_CACHED}, never with an exception or {@code null}, since {@code null} is a legitimate
 * stored value.
 *
 * <p>The {@code *Async} operations default to running the synchronous ones in the calling thread.
 * Controllers with genuinely non-blocking I/O override them; see {@link AsyncFileStorageController}.
 *
 * <p>Implementations must be thread-safe: one controller may be shared by several memoized functions
 * with distinct uids.
 */
public interface StorageController {

    /**
     * Returned by {@link #retrieve} and {@link #delete} when nothing is stored under the key.
     */
    Object NOT_CACHED = NotCached.INSTANCE;

    /**
     * Stores {@code value} under {@code key}.
     *
     * @param args the resolved arguments the key was derived from
     * @return {@code value}
     */
    Object save(Object key, Object value, List<Object> args);

    /**
     * Returns the value stored under {@code key}, or {@link #NOT_CACHED}.
     */
    Object retrieve(Object key, List<Object> args);

    /**
     * Removes the value stored under {@code key}.
     *
     * @param args the resolved arguments, or {@code null} when the engine deletes by key alone
     * @return the removed value, or {@link #NOT_CACHED} if nothing was stored
     */
    Object delete(Object key, List<Object> args);

    /**
     * Removes every stored value.
     */
    void empty();

    /**
     * Returns a read-only snapshot of the stored key/value pairs.
     *
     * @throws UnsupportedOperationException if the controller cannot enumerate its contents
     */
    default Map<Object, Object> contents() {
        throw new UnsupportedOperationException(getClass().getSimpleName() + " does not expose its contents");
    }

    default CompletableFuture<Object> saveAsync(Object key, Object value, List<Object> args) {
        return Futures.supply(() -> save(key, value, args));
    }

    default CompletableFuture<Object> retrieveAsync(Object key, List<Object> args) {
        return Futures.supply(() -> retrieve(key, args));
    }

    default CompletableFuture<Object> deleteAsync(Object key, List<Object> args) {
        return Futures.supply(() -> delete(key, args));
    }

    default CompletableFuture<Void> emptyAsync() {
        return Futures.supply(() -> {
            empty();
            return null;
        });
    }
}
