package com.github.rudygunawan.memoizor.api;

import com.github.rudygunawan.memoizor.listener.MemoizorListener;
import com.github.rudygunawan.memoizor.metrics.MemoizorMetrics;
import com.github.rudygunawan.memoizor.model.MemoOptions;
import com.github.rudygunawan.memoizor.model.MemoStats;
import com.github.rudygunawan.memoizor.storage.StorageController;

import java.util.Map;

/**
 * Management operations shared by every memoized function, whatever its calling convention.
 *
 * <p>Operations whose completion depends on the storage controller ({@code get}, {@code save},
 * {@code delete}, {@code empty}, {@code disable}, {@code setOptions}) are declared by the
 * mode-specific sub-interfaces in synchronous, future or callback form.
 */
public interface MemoizedControl {

    /**
     * Returns the cache key the given raw arguments resolve to under the current options.
     */
    Object key(Object... args);

    /**
     * Returns {@code true} while calls go through the cache.
     */
    boolean isEnabled();

    /**
     * Routes calls through the cache again.
     *
     * @return {@code false} if the function was already enabled
     */
    boolean enable();

    /**
     * Returns a read-only snapshot of everything the storage controller holds. Entries past their
     * TTL stay visible here until a lookup for their key removes them.
     */
    Map<Object, Object> storeContents();

    /**
     * Returns the options currently in effect.
     */
    MemoOptions options();

    /**
     * Returns a snapshot of the hit, miss, save, eviction and expiration counters.
     */
    MemoStats stats();

    /**
     * Returns the live counters for metrics binding.
     */
    MemoizorMetrics metrics();

    void addListener(MemoizorListener listener);

    void removeListener(MemoizorListener listener);

    /**
     * Returns the storage controller results are kept in.
     */
    StorageController storageController();

    /**
     * Replaces the storage controller. Frequency and TTL bookkeeping start over, since it described
     * the previous controller's entries.
     *
     * @throws NullPointerException if {@code controller} is null
     */
    void setStorageController(StorageController controller);
}
