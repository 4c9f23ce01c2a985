package com.github.rudygunawan.memoizor.impl;

import com.github.rudygunawan.memoizor.key.ArgumentResolver;
import com.github.rudygunawan.memoizor.key.KeyDeriver;
import com.github.rudygunawan.memoizor.listener.EventType;
import com.github.rudygunawan.memoizor.listener.MemoizorEvent;
import com.github.rudygunawan.memoizor.listener.MemoizorListener;
import com.github.rudygunawan.memoizor.metrics.MemoizorMetrics;
import com.github.rudygunawan.memoizor.model.FrequencyRecord;
import com.github.rudygunawan.memoizor.model.MemoOptions;
import com.github.rudygunawan.memoizor.model.MemoStats;
import com.github.rudygunawan.memoizor.storage.StorageController;
import com.github.rudygunawan.memoizor.time.Ticker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.rudygunawan.memoizor.storage.StorageController.NOT_CACHED;

/**
 * The cache engine behind every memoized function: options, the enabled flag, TTL and frequency
 * bookkeeping, overflow eviction and event emission, wrapped around a {@link StorageController}.
 *
 * <p>The execution adapters ({@link SyncMemoizor}, {@link AsyncMemoizor}, {@link CallbackMemoizor})
 * only resolve arguments, derive keys and decide when to call the target; everything that touches
 * the store goes through here.
 *
 * <h3>Expiry</h3>
 * TTL is passive. A value past its TTL stays in the store until a retrieval of its key notices the
 * age, deletes it and reports a miss.
 *
 * <h3>Overflow eviction</h3>
 * When {@code maxRecords} is set and a save pushes the record counter above it, the engine takes
 * the most recently accessed {@code 1/lruHistoryFactor} of the tracked records, orders them by
 * ascending access frequency and deletes the first {@code lruPercentPadding} percent (at least
 * one) through {@link #delete}. The key being saved is never its own victim, except with
 * {@code maxRecords = 0}, where every save evicts everything including itself. The counter is
 * incremented by every save, including re-saves of a stored key, so it can run ahead of the true
 * record count until eviction or {@link #empty()} brings it back.
 *
 * <h3>Preloaded records</h3>
 * Records a controller already holds when it is attached (a reopened file store, say) are tracked
 * as if saved at that moment: they count toward {@code maxRecords}, start their TTL, and are
 * trimmed right away if they exceed the limit. Controllers that cannot list their contents are
 * attached untracked.
 *
 * <h3>Thread safety</h3>
 * All bookkeeping, and every synchronous storage call, happens under one lock per engine. The
 * {@code *Async} operations update bookkeeping under the lock and compose the controller's futures
 * outside it.
 *
 * <h3>Logging</h3>
 * Logger name: "com.github.rudygunawan.memoizor.Memoizor"
 * <ul>
 *   <li>WARNING: a listener threw</li>
 *   <li>FINE: evictions, expirations, option and controller changes</li>
 *   <li>FINER: individual retrieve/save/delete operations</li>
 * </ul>
 */
public class MemoizorEngine implements MemoizorMetrics {

    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.memoizor.Memoizor");

    private static final Comparator<FrequencyRecord> MOST_RECENT_FIRST =
            Comparator.comparingLong(FrequencyRecord::getLastAccess).reversed();
    private static final Comparator<FrequencyRecord> LEAST_FREQUENT_FIRST =
            Comparator.comparingLong(FrequencyRecord::getFrequency);

    private final ReentrantLock lock = new ReentrantLock();
    private final KeyDeriver keyDeriver = new KeyDeriver();
    private final Ticker ticker;
    private final List<MemoizorListener> listeners;

    // Guarded by lock. Insertion order breaks ties between records saved but never read.
    private final Map<Object, FrequencyRecord> frequencies = new LinkedHashMap<>();
    private final Map<Object, Long> createdAt = new HashMap<>();
    private final AtomicLong currentRecords = new AtomicLong();

    private volatile MemoOptions options;
    private volatile StorageController storage;
    private volatile boolean enabled = true;

    private final AtomicLong hitCount = new AtomicLong();
    private final AtomicLong missCount = new AtomicLong();
    private final AtomicLong saveCount = new AtomicLong();
    private final AtomicLong evictionCount = new AtomicLong();
    private final AtomicLong expirationCount = new AtomicLong();

    public MemoizorEngine(MemoOptions options, StorageController storage, Ticker ticker,
                          List<MemoizorListener> listeners) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
        this.storage = Objects.requireNonNull(storage, "storage controller cannot be null");
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        this.listeners = new CopyOnWriteArrayList<>(listeners);
        lock.lock();
        try {
            trackStoredRecords();
        } finally {
            lock.unlock();
        }
    }

    public MemoOptions options() {
        return options;
    }

    public StorageController storageController() {
        return storage;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public List<Object> resolveArguments(Object[] rawArgs) {
        return ArgumentResolver.resolve(rawArgs, options);
    }

    public Object key(List<Object> resolvedArgs) {
        return keyDeriver.derive(resolvedArgs, options);
    }

    public Object keyFor(Object[] rawArgs) {
        return key(resolveArguments(rawArgs));
    }

    // ---------------------------------------------------------------- synchronous operations

    public Object retrieve(Object key, List<Object> args) {
        emit(new MemoizorEvent(EventType.RETRIEVE, name(), key, null, args, null));
        Object value;
        lock.lock();
        try {
            if (isExpired(key)) {
                expire(key);
                delete(key, args);
                return NOT_CACHED;
            }
            recordAccess(key);
            value = storage.retrieve(key, args);
        } finally {
            lock.unlock();
        }
        recordLookup(key, value);
        emit(new MemoizorEvent(EventType.RETRIEVED, name(), key, value, args, null));
        return value;
    }

    public Object save(Object key, Object value, List<Object> args) {
        emit(new MemoizorEvent(EventType.SAVE, name(), key, value, args, null));
        List<Object> victims;
        lock.lock();
        try {
            storage.save(key, value, args);
            victims = recordSave(key);
            if (!victims.isEmpty()) {
                announceOverflow(victims);
                for (Object victim : victims) {
                    delete(victim, null);
                }
            }
        } finally {
            lock.unlock();
        }
        return value;
    }

    public Object delete(Object key, List<Object> args) {
        emit(new MemoizorEvent(EventType.DELETE, name(), key, null, args, null));
        Object removed;
        lock.lock();
        try {
            removed = storage.delete(key, args);
            untrack(key);
        } finally {
            lock.unlock();
        }
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer(name() + ": deleted key=" + key + " (" + (removed == NOT_CACHED ? "absent" : "present") + ")");
        }
        emit(new MemoizorEvent(EventType.DELETED, name(), key, removed, args, null));
        return removed;
    }

    public void empty() {
        emit(MemoizorEvent.of(EventType.EMPTY, name()));
        lock.lock();
        try {
            storage.empty();
            resetBookkeeping();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        empty();
    }

    /**
     * @return {@code false} if caching was already enabled
     */
    public boolean enable() {
        lock.lock();
        try {
            if (enabled) {
                return false;
            }
            enabled = true;
        } finally {
            lock.unlock();
        }
        emit(MemoizorEvent.of(EventType.ENABLE, name()));
        return true;
    }

    /**
     * Stops caching. When {@code emptyFirst} is set the store is emptied even if caching was already
     * disabled.
     *
     * @return {@code false} if caching was already disabled
     */
    public boolean disable(boolean emptyFirst) {
        if (emptyFirst) {
            empty();
        }
        return markDisabled();
    }

    /**
     * Replaces the options. The store is emptied when {@code clearStore} is set or when the new
     * options derive keys differently (uid, key generator, coercion or key mode changed).
     */
    public void setOptions(MemoOptions newOptions, boolean clearStore) {
        if (swapOptions(newOptions, clearStore)) {
            empty();
        }
    }

    /**
     * Swaps the storage controller and starts bookkeeping over. Nothing is copied between
     * controllers.
     */
    public void setStorageController(StorageController controller) {
        Objects.requireNonNull(controller, "storage controller cannot be null");
        lock.lock();
        try {
            storage = controller;
            resetBookkeeping();
            trackStoredRecords();
        } finally {
            lock.unlock();
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(name() + ": storage controller replaced by " + controller.getClass().getName());
        }
    }

    public Map<Object, Object> contents() {
        return storage.contents();
    }

    // ---------------------------------------------------------------- asynchronous operations

    public CompletableFuture<Object> retrieveAsync(Object key, List<Object> args) {
        emit(new MemoizorEvent(EventType.RETRIEVE, name(), key, null, args, null));
        StorageController controller;
        lock.lock();
        try {
            if (isExpired(key)) {
                expire(key);
                return deleteAsync(key, args).thenApply(removed -> NOT_CACHED);
            }
            recordAccess(key);
            controller = storage;
        } finally {
            lock.unlock();
        }
        return Futures.compose(() -> controller.retrieveAsync(key, args)).thenApply(value -> {
            recordLookup(key, value);
            emit(new MemoizorEvent(EventType.RETRIEVED, name(), key, value, args, null));
            return value;
        });
    }

    public CompletableFuture<Object> saveAsync(Object key, Object value, List<Object> args) {
        emit(new MemoizorEvent(EventType.SAVE, name(), key, value, args, null));
        StorageController controller = storage;
        return Futures.compose(() -> controller.saveAsync(key, value, args)).thenCompose(saved -> {
            List<Object> victims;
            lock.lock();
            try {
                victims = recordSave(key);
            } finally {
                lock.unlock();
            }
            if (victims.isEmpty()) {
                return CompletableFuture.completedFuture(value);
            }
            announceOverflow(victims);
            CompletableFuture<?>[] deletions = victims.stream()
                    .map(victim -> deleteAsync(victim, null))
                    .toArray(CompletableFuture[]::new);
            return CompletableFuture.allOf(deletions).thenApply(ignored -> value);
        });
    }

    public CompletableFuture<Object> deleteAsync(Object key, List<Object> args) {
        emit(new MemoizorEvent(EventType.DELETE, name(), key, null, args, null));
        StorageController controller = storage;
        return Futures.compose(() -> controller.deleteAsync(key, args)).thenApply(removed -> {
            lock.lock();
            try {
                untrack(key);
            } finally {
                lock.unlock();
            }
            emit(new MemoizorEvent(EventType.DELETED, name(), key, removed, args, null));
            return removed;
        });
    }

    public CompletableFuture<Void> emptyAsync() {
        emit(MemoizorEvent.of(EventType.EMPTY, name()));
        StorageController controller = storage;
        return Futures.compose(controller::emptyAsync).thenRun(() -> {
            lock.lock();
            try {
                resetBookkeeping();
            } finally {
                lock.unlock();
            }
        });
    }

    public CompletableFuture<Boolean> disableAsync(boolean emptyFirst) {
        CompletableFuture<Void> emptied = emptyFirst ? emptyAsync() : CompletableFuture.completedFuture(null);
        return emptied.thenApply(ignored -> markDisabled());
    }

    public CompletableFuture<Void> setOptionsAsync(MemoOptions newOptions, boolean clearStore) {
        try {
            return swapOptions(newOptions, clearStore) ? emptyAsync() : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    // ---------------------------------------------------------------- listeners and statistics

    public void addListener(MemoizorListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
    }

    public void removeListener(MemoizorListener listener) {
        listeners.remove(listener);
    }

    public MemoStats stats() {
        return new MemoStats(hitCount.get(), missCount.get(), saveCount.get(), evictionCount.get(),
                expirationCount.get());
    }

    @Override
    public String name() {
        return options.getName();
    }

    @Override
    public long recordCount() {
        return currentRecords.get();
    }

    @Override
    public long hitCount() {
        return hitCount.get();
    }

    @Override
    public long missCount() {
        return missCount.get();
    }

    @Override
    public long saveCount() {
        return saveCount.get();
    }

    @Override
    public long evictionCount() {
        return evictionCount.get();
    }

    @Override
    public long expirationCount() {
        return expirationCount.get();
    }

    // ---------------------------------------------------------------- bookkeeping, lock held

    private boolean isExpired(Object key) {
        MemoOptions current = options;
        if (!current.hasTtl()) {
            return false;
        }
        Long created = createdAt.get(key);
        return created != null && ticker.read() - created >= current.getTtlNanos();
    }

    private void expire(Object key) {
        expirationCount.incrementAndGet();
        missCount.incrementAndGet();
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(name() + ": expired key=" + key);
        }
    }

    private void recordAccess(Object key) {
        if (!options.hasMaxRecords()) {
            return;
        }
        FrequencyRecord record = frequencies.get(key);
        if (record != null) {
            record.recordAccess(ticker.read());
        }
    }

    /**
     * Updates TTL and frequency bookkeeping for a completed save.
     *
     * @return the keys overflow eviction chose, possibly empty
     */
    private List<Object> recordSave(Object key) {
        saveCount.incrementAndGet();
        MemoOptions current = options;
        if (current.hasTtl()) {
            createdAt.put(key, ticker.read());
        }
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer(name() + ": saved key=" + key);
        }
        if (!current.hasMaxRecords()) {
            return Collections.emptyList();
        }
        frequencies.computeIfAbsent(key, FrequencyRecord::new);
        if (currentRecords.incrementAndGet() <= current.getMaxRecords()) {
            return Collections.emptyList();
        }
        return selectVictims(key, current);
    }

    private List<Object> selectVictims(Object savedKey, MemoOptions current) {
        if (current.getMaxRecords() == 0) {
            return new ArrayList<>(frequencies.keySet());
        }
        List<FrequencyRecord> candidates = new ArrayList<>(frequencies.size());
        for (FrequencyRecord record : frequencies.values()) {
            if (!Objects.equals(record.getKey(), savedKey)) {
                candidates.add(record);
            }
        }
        if (candidates.isEmpty()) {
            return Collections.emptyList();
        }

        // List.sort is stable, so ties keep insertion order
        candidates.sort(MOST_RECENT_FIRST);
        int historySize = (int) Math.ceil((double) candidates.size() / current.getLruHistoryFactor());
        List<FrequencyRecord> history = new ArrayList<>(candidates.subList(0, historySize));
        history.sort(LEAST_FREQUENT_FIRST);

        // ceil(padding% of the history), in integer arithmetic
        int deleteCount = (int) ((current.getLruPercentPadding() * (long) history.size() + 99) / 100);
        deleteCount = Math.min(Math.max(deleteCount, 1), history.size());

        List<Object> victims = new ArrayList<>(deleteCount);
        for (int i = 0; i < deleteCount; i++) {
            victims.add(history.get(i).getKey());
        }
        return victims;
    }

    private void announceOverflow(List<Object> victims) {
        evictionCount.addAndGet(victims.size());
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(name() + ": store exceeds " + options.getMaxRecords() + " records, evicting "
                    + victims.size() + " record(s): " + victims);
        }
        emit(new MemoizorEvent(EventType.OVERFLOW, name(), null, null, null, victims));
    }

    private void untrack(Object key) {
        createdAt.remove(key);
        if (frequencies.remove(key) != null) {
            currentRecords.decrementAndGet();
        }
    }

    /**
     * Tracks the records the current controller already holds, then evicts until they fit.
     */
    private void trackStoredRecords() {
        MemoOptions current = options;
        if (!current.hasTtl() && !current.hasMaxRecords()) {
            return;
        }
        Map<Object, Object> stored;
        try {
            stored = storage.contents();
        } catch (UnsupportedOperationException e) {
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine(name() + ": " + storage.getClass().getName()
                        + " cannot list its records, existing records are not tracked");
            }
            return;
        }
        if (stored.isEmpty()) {
            return;
        }

        long now = ticker.read();
        for (Object key : stored.keySet()) {
            if (current.hasTtl()) {
                createdAt.put(key, now);
            }
            if (current.hasMaxRecords() && frequencies.putIfAbsent(key, new FrequencyRecord(key)) == null) {
                currentRecords.incrementAndGet();
            }
        }
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(name() + ": tracking " + stored.size() + " existing record(s)");
        }

        while (current.hasMaxRecords() && currentRecords.get() > current.getMaxRecords()) {
            List<Object> victims = selectVictims(null, current);
            if (victims.isEmpty()) {
                break;
            }
            announceOverflow(victims);
            for (Object victim : victims) {
                delete(victim, null);
            }
        }
    }

    private void resetBookkeeping() {
        frequencies.clear();
        createdAt.clear();
        currentRecords.set(0);
    }

    // ---------------------------------------------------------------- helpers

    private void recordLookup(Object key, Object value) {
        if (value == NOT_CACHED) {
            missCount.incrementAndGet();
        } else {
            hitCount.incrementAndGet();
        }
        if (LOGGER.isLoggable(Level.FINER)) {
            LOGGER.finer(name() + ": retrieved key=" + key + " (" + (value == NOT_CACHED ? "miss" : "hit") + ")");
        }
    }

    private boolean markDisabled() {
        lock.lock();
        try {
            if (!enabled) {
                return false;
            }
            enabled = false;
        } finally {
            lock.unlock();
        }
        emit(MemoizorEvent.of(EventType.DISABLE, name()));
        return true;
    }

    /**
     * @return {@code true} if the store must be emptied
     */
    private boolean swapOptions(MemoOptions newOptions, boolean clearStore) {
        Objects.requireNonNull(newOptions, "options cannot be null");
        MemoOptions previous;
        lock.lock();
        try {
            previous = options;
            options = newOptions;
            keyDeriver.reset();
        } finally {
            lock.unlock();
        }
        boolean keysChanged = newOptions.derivesKeysDifferentlyFrom(previous);
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine(name() + ": options replaced" + (keysChanged ? ", key derivation changed" : ""));
        }
        return clearStore || keysChanged;
    }

    private void emit(MemoizorEvent event) {
        for (MemoizorListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "MemoizorListener threw exception for event: " + event.getType()
                        + " (memoizor: " + event.getName() + ")", e);
            }
        }
    }
}
