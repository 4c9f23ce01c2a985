package com.github.rudygunawan.memoizor.api;

import com.github.rudygunawan.memoizor.model.MemoOptions;

import java.util.List;

/**
 * A memoized callback-style function.
 *
 * <p>The caller's {@link Callback} is invoked exactly once per call. Results are stored as a list
 * {@code [error, result...]} so that callbacks reporting several values replay them all.
 */
public interface CallbackMemoizedFunction extends MemoizedControl {

    /**
     * Calls the function. One argument (the last, unless {@code callbackIndex} is configured) must
     * be the {@link Callback} to complete.
     */
    void call(Object... args);

    /**
     * Completes {@code done} with the stored results for {@code args}, or with
     * {@code (null, NOT_CACHED)} when nothing is stored.
     */
    void get(List<?> args, Callback done);

    /**
     * Stores a result for {@code args} and completes {@code done} with it spread out.
     *
     * @param value a list {@code [error, result...]} as a callback would report it; any other
     *              value is stored as {@code [null, value]}
     */
    void save(Object value, List<?> args, Callback done);

    /**
     * Removes the stored results for {@code args} and completes {@code done} with the removed list
     * spread out, or with {@code (null, NOT_CACHED)} when nothing was stored.
     */
    void delete(List<?> args, Callback done);

    void empty(Callback done);

    default void clear(Callback done) {
        empty(done);
    }

    /**
     * Stops caching and completes {@code done} with {@code (null, changed)}.
     */
    void disable(boolean emptyFirst, Callback done);

    void setOptions(MemoOptions options, boolean clearStore, Callback done);
}
