package com.github.rudygunawan.memoizor.api;

import com.github.rudygunawan.memoizor.model.MemoOptions;

/**
 * A memoized synchronous function.
 *
 * <p>Calls with equal resolved arguments return the stored result without invoking the target.
 * Exceptions from the target reach the caller unchanged and are never cached.
 * <pre>{@code
 * MemoizedFunction<Integer> doubled = Memoizor.sync(inv -> inv.<Integer>arg(0) * 2);
 * doubled.call(4);  // invokes the target
 * doubled.call(4);  // served from the cache
 * }</pre>
 *
 * @param <R> the result type
 */
public interface MemoizedFunction<R> extends MemoizedControl {

    /**
     * Returns the cached result for {@code args}, invoking and caching the target on a miss.
     *
     * @throws Exception whatever the target throws
     */
    R call(Object... args) throws Exception;

    /**
     * Returns the stored value for {@code args}, or
     * {@link com.github.rudygunawan.memoizor.storage.StorageController#NOT_CACHED} if there is none.
     */
    Object get(Object... args);

    /**
     * Stores {@code value} as the result for {@code args}.
     *
     * @return {@code value}
     */
    R save(R value, Object... args);

    /**
     * Removes the stored value for {@code args}.
     *
     * @return the removed value, or {@code NOT_CACHED} if nothing was stored
     */
    Object delete(Object... args);

    /**
     * Removes every stored value.
     */
    void empty();

    /**
     * Alias for {@link #empty()}.
     */
    default void clear() {
        empty();
    }

    /**
     * Stops caching; calls go straight to the target.
     *
     * @return {@code false} if the function was already disabled
     */
    default boolean disable() {
        return disable(false);
    }

    /**
     * Stops caching, emptying the store first when {@code emptyFirst} is set.
     *
     * @return {@code false} if the function was already disabled
     */
    boolean disable(boolean emptyFirst);

    /**
     * Replaces the options. The store is emptied when {@code clearStore} is set, and always when the
     * change affects how keys are derived.
     */
    void setOptions(MemoOptions options, boolean clearStore);
}
