package com.github.rudygunawan.memoizor.builder;

import com.github.rudygunawan.memoizor.api.ArgumentCoercer;
import com.github.rudygunawan.memoizor.api.AsyncMemoizedFunction;
import com.github.rudygunawan.memoizor.api.AsyncTarget;
import com.github.rudygunawan.memoizor.api.CallbackMemoizedFunction;
import com.github.rudygunawan.memoizor.api.CallbackTarget;
import com.github.rudygunawan.memoizor.api.KeyGenerator;
import com.github.rudygunawan.memoizor.api.MemoizedFunction;
import com.github.rudygunawan.memoizor.api.SyncTarget;
import com.github.rudygunawan.memoizor.impl.AsyncMemoizor;
import com.github.rudygunawan.memoizor.impl.CallbackMemoizor;
import com.github.rudygunawan.memoizor.impl.MemoizorEngine;
import com.github.rudygunawan.memoizor.impl.SyncMemoizor;
import com.github.rudygunawan.memoizor.listener.MemoizorListener;
import com.github.rudygunawan.memoizor.model.KeyMode;
import com.github.rudygunawan.memoizor.model.MemoOptions;
import com.github.rudygunawan.memoizor.storage.LocalStorageController;
import com.github.rudygunawan.memoizor.storage.StorageController;
import com.github.rudygunawan.memoizor.time.Ticker;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * A builder of memoized functions having any combination of the following features:
 *
 * <ul>
 *   <li>time-based expiration of stored results, measured since they were saved
 *   <li>a record limit, enforced by batched least-frequently-used eviction among recent entries
 *   <li>argument truncation, exclusion and coercion before key derivation
 *   <li>custom key generation, or raw primitive keys
 *   <li>pluggable storage controllers (in-memory, weak, file-backed)
 *   <li>event listeners
 * </ul>
 *
 * <p>Numeric options are clamped rather than rejected, so out-of-range values still produce a
 * working configuration: the TTL is at least 60 milliseconds, {@code maxRecords} at least 0,
 * {@code maxArgs}, the LRU padding and the LRU history factor at least 1.
 *
 * <p>Usage example:
 * <pre>{@code
 * MemoizedFunction<Report> reports = Memoizor.newBuilder()
 *     .name("reports")
 *     .ttl(10, TimeUnit.MINUTES)
 *     .maxRecords(500)
 *     .ignoreArgs(1)
 *     .build(inv -> generateReport(inv.arg(0), inv.arg(1)));
 * }</pre>
 */
public class MemoizorBuilder {
    /** Smallest accepted time-to-live. */
    public static final long MIN_TTL_NANOS = TimeUnit.MILLISECONDS.toNanos(60);

    private static final int UNSET_INT = -1;
    private static final long UNSET = -1;
    private static final int DEFAULT_LRU_PERCENT_PADDING = 10;
    private static final int DEFAULT_LRU_HISTORY_FACTOR = 2;
    private static final String DEFAULT_NAME = "anonymous";
    private static final String UID_PREFIX = "MEMOIZOR:";

    private String name = DEFAULT_NAME;
    private String uid;
    private long ttlNanos = UNSET;
    private long maxRecords = UNSET;
    private int lruPercentPadding = DEFAULT_LRU_PERCENT_PADDING;
    private int lruHistoryFactor = DEFAULT_LRU_HISTORY_FACTOR;
    private int maxArgs = UNSET_INT;
    private int[] ignoreArgs = new int[0];
    private ArgumentCoercer coercer;
    private List<ArgumentCoercer> coercers;
    private KeyGenerator keyGenerator;
    private Object binding;
    private int callbackIndex = UNSET_INT;
    private KeyMode mode = KeyMode.DEFAULT;
    private StorageController storageController;
    private Ticker ticker = Ticker.systemTicker();
    private final List<MemoizorListener> listeners = new ArrayList<>();

    private MemoizorBuilder() {
    }

    /**
     * Constructs a new {@code MemoizorBuilder} instance with default settings.
     */
    public static MemoizorBuilder newBuilder() {
        return new MemoizorBuilder();
    }

    /**
     * Returns a builder pre-filled with {@code options}, for deriving changed options to pass to
     * {@code setOptions}.
     */
    public static MemoizorBuilder from(MemoOptions options) {
        Objects.requireNonNull(options, "options cannot be null");
        MemoizorBuilder builder = new MemoizorBuilder();
        builder.name = options.getName();
        builder.uid = options.getUid();
        builder.ttlNanos = options.getTtlNanos();
        builder.maxRecords = options.getMaxRecords();
        builder.lruPercentPadding = options.getLruPercentPadding();
        builder.lruHistoryFactor = options.getLruHistoryFactor();
        builder.maxArgs = options.getMaxArgs();
        builder.ignoreArgs = options.getIgnoreArgs().stream().mapToInt(Integer::intValue).toArray();
        builder.coercer = options.getCoercer();
        builder.coercers = options.getCoercers();
        builder.keyGenerator = options.getKeyGenerator();
        builder.binding = options.getBinding();
        builder.callbackIndex = options.getCallbackIndex();
        builder.mode = options.getMode();
        return builder;
    }

    /**
     * Names the memoized function for logging, events and metrics. Unless {@link #uid(String)} is
     * set, the name also determines the key namespace.
     */
    public MemoizorBuilder name(String name) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        return this;
    }

    /**
     * Sets the namespace mixed into every derived key. Distinct logical caches sharing one backing
     * store must use distinct uids.
     */
    public MemoizorBuilder uid(String uid) {
        this.uid = Objects.requireNonNull(uid, "uid cannot be null");
        return this;
    }

    /**
     * Expires stored results once {@code duration} has passed since they were saved. Expiry is
     * checked lazily on the next lookup of the same key.
     */
    public MemoizorBuilder ttl(long duration, TimeUnit unit) {
        Objects.requireNonNull(unit, "unit cannot be null");
        this.ttlNanos = Math.max(MIN_TTL_NANOS, unit.toNanos(duration));
        return this;
    }

    public MemoizorBuilder ttl(Duration duration) {
        Objects.requireNonNull(duration, "duration cannot be null");
        return ttl(duration.toNanos(), TimeUnit.NANOSECONDS);
    }

    /**
     * Removes any configured time-to-live.
     */
    public MemoizorBuilder noTtl() {
        this.ttlNanos = UNSET;
        return this;
    }

    /**
     * Limits the number of stored results. When a save pushes the record count past the limit, a
     * batch of entries is evicted; see {@link #lruPercentPadding(int)}. A limit of 0 stores nothing:
     * every save is evicted right away.
     */
    public MemoizorBuilder maxRecords(long maxRecords) {
        this.maxRecords = Math.max(0, maxRecords);
        return this;
    }

    /**
     * Removes any configured record limit.
     */
    public MemoizorBuilder noMaxRecords() {
        this.maxRecords = UNSET;
        return this;
    }

    /**
     * Percentage of the eviction candidates removed in one overflow batch. Defaults to 10.
     */
    public MemoizorBuilder lruPercentPadding(int percent) {
        this.lruPercentPadding = Math.max(1, percent);
        return this;
    }

    /**
     * Only the most recently accessed {@code 1/factor} of the tracked entries are considered for
     * eviction. Defaults to 2.
     */
    public MemoizorBuilder lruHistoryFactor(int factor) {
        this.lruHistoryFactor = Math.max(1, factor);
        return this;
    }

    /**
     * Considers only the first {@code maxArgs} arguments when deriving keys.
     */
    public MemoizorBuilder maxArgs(int maxArgs) {
        this.maxArgs = Math.max(1, maxArgs);
        return this;
    }

    /**
     * Excludes the arguments at these positions from key derivation. Positions refer to the
     * argument list after {@link #maxArgs(int)} truncation.
     *
     * @throws IllegalArgumentException if any index is negative
     */
    public MemoizorBuilder ignoreArgs(int... indices) {
        Objects.requireNonNull(indices, "indices cannot be null");
        for (int index : indices) {
            if (index < 0) {
                throw new IllegalArgumentException("ignoreArgs values must be non-negative, got " + index);
            }
        }
        this.ignoreArgs = indices.clone();
        return this;
    }

    /**
     * Coerces every argument with one function before key derivation.
     */
    public MemoizorBuilder coerceArgs(ArgumentCoercer coercer) {
        this.coercer = Objects.requireNonNull(coercer, "coercer cannot be null");
        this.coercers = null;
        return this;
    }

    /**
     * Coerces the argument at each position with the function at the same position. Null entries
     * leave their argument unchanged.
     */
    public MemoizorBuilder coerceArgs(ArgumentCoercer... coercers) {
        Objects.requireNonNull(coercers, "coercers cannot be null");
        this.coercers = Collections.unmodifiableList(new ArrayList<>(Arrays.asList(coercers)));
        this.coercer = null;
        return this;
    }

    /**
     * Removes any configured coercion.
     */
    public MemoizorBuilder noCoercion() {
        this.coercer = null;
        this.coercers = null;
        return this;
    }

    /**
     * Derives keys with {@code keyGenerator} instead of hashing. Ignored in
     * {@link KeyMode#PRIMITIVE} mode.
     */
    public MemoizorBuilder keyGenerator(KeyGenerator keyGenerator) {
        this.keyGenerator = Objects.requireNonNull(keyGenerator, "keyGenerator cannot be null");
        return this;
    }

    /**
     * Fixes the receiver the target sees through {@code Invocation.receiver()}.
     */
    public MemoizorBuilder binding(Object receiver) {
        this.binding = receiver;
        return this;
    }

    /**
     * Position of the completion callback among the arguments (callback mode only). Defaults to the
     * last argument.
     *
     * @throws IllegalArgumentException if {@code index} is negative
     */
    public MemoizorBuilder callbackIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("callbackIndex must not be negative");
        }
        this.callbackIndex = index;
        return this;
    }

    public MemoizorBuilder mode(KeyMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode cannot be null");
        return this;
    }

    /**
     * Stores results in {@code controller} instead of a fresh {@link LocalStorageController}.
     */
    public MemoizorBuilder storageController(StorageController controller) {
        this.storageController = Objects.requireNonNull(controller, "storage controller cannot be null");
        return this;
    }

    /**
     * Specifies a nanosecond-precision time source for TTL and access bookkeeping. By default,
     * {@link Ticker#systemTicker()} is used.
     */
    public MemoizorBuilder ticker(Ticker ticker) {
        this.ticker = Objects.requireNonNull(ticker, "ticker cannot be null");
        return this;
    }

    public MemoizorBuilder listener(MemoizorListener listener) {
        this.listeners.add(Objects.requireNonNull(listener, "listener cannot be null"));
        return this;
    }

    /**
     * Builds the options alone, for {@code setOptions}.
     */
    public MemoOptions buildOptions() {
        return new MemoOptions(this);
    }

    /**
     * Memoizes a synchronous function.
     *
     * @throws NullPointerException if {@code target} is null
     */
    public <R> MemoizedFunction<R> build(SyncTarget<R> target) {
        Objects.requireNonNull(target, "Cannot memoize a null target");
        return new SyncMemoizor<>(target, newEngine());
    }

    /**
     * Memoizes a future-returning function.
     *
     * @throws NullPointerException if {@code target} is null
     */
    public <R> AsyncMemoizedFunction<R> buildAsync(AsyncTarget<R> target) {
        Objects.requireNonNull(target, "Cannot memoize a null target");
        return new AsyncMemoizor<>(target, newEngine());
    }

    /**
     * Memoizes a callback-style function.
     *
     * @throws NullPointerException if {@code target} is null
     */
    public CallbackMemoizedFunction buildCallback(CallbackTarget target) {
        Objects.requireNonNull(target, "Cannot memoize a null target");
        return new CallbackMemoizor(target, newEngine());
    }

    private MemoizorEngine newEngine() {
        StorageController controller = storageController != null ? storageController : new LocalStorageController();
        return new MemoizorEngine(buildOptions(), controller, ticker, listeners);
    }

    // Getters read by MemoOptions

    public String getName() {
        return name;
    }

    public String getUid() {
        return uid != null ? uid : UID_PREFIX + name;
    }

    public long getTtlNanos() {
        return ttlNanos;
    }

    public long getMaxRecords() {
        return maxRecords;
    }

    public int getLruPercentPadding() {
        return lruPercentPadding;
    }

    public int getLruHistoryFactor() {
        return lruHistoryFactor;
    }

    public int getMaxArgs() {
        return maxArgs;
    }

    public int[] getIgnoreArgs() {
        return ignoreArgs.clone();
    }

    public ArgumentCoercer getCoercer() {
        return coercer;
    }

    public List<ArgumentCoercer> getCoercers() {
        return coercers;
    }

    public KeyGenerator getKeyGenerator() {
        return keyGenerator;
    }

    public Object getBinding() {
        return binding;
    }

    public int getCallbackIndex() {
        return callbackIndex;
    }

    public KeyMode getMode() {
        return mode;
    }
}
