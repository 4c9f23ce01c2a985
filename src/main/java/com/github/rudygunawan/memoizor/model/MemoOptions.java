package com.github.rudygunawan.memoizor.model;

import com.github.rudygunawan.memoizor.api.ArgumentCoercer;
import com.github.rudygunawan.memoizor.api.KeyGenerator;
import com.github.rudygunawan.memoizor.builder.MemoizorBuilder;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Validated, immutable configuration of one memoized function.
 *
 * <p>Instances come from {@link MemoizorBuilder#buildOptions()}. To change a live function's
 * options, derive a builder with {@link #toBuilder()}, adjust it and pass the result to
 * {@code setOptions}.
 */
public final class MemoOptions {
    private final String name;
    private final String uid;
    private final long ttlNanos;
    private final long maxRecords;
    private final int lruPercentPadding;
    private final int lruHistoryFactor;
    private final int maxArgs;
    private final List<Integer> ignoreArgs;
    private final Set<Integer> ignoredIndices;
    private final ArgumentCoercer coercer;
    private final List<ArgumentCoercer> coercers;
    private final KeyGenerator keyGenerator;
    private final Object binding;
    private final int callbackIndex;
    private final KeyMode mode;

    public MemoOptions(MemoizorBuilder builder) {
        this.name = builder.getName();
        this.uid = builder.getUid();
        this.ttlNanos = builder.getTtlNanos();
        this.maxRecords = builder.getMaxRecords();
        this.lruPercentPadding = builder.getLruPercentPadding();
        this.lruHistoryFactor = builder.getLruHistoryFactor();
        this.maxArgs = builder.getMaxArgs();
        List<Integer> ignored = new ArrayList<>();
        for (int index : builder.getIgnoreArgs()) {
            ignored.add(index);
        }
        this.ignoreArgs = Collections.unmodifiableList(ignored);
        this.ignoredIndices = Collections.unmodifiableSet(new LinkedHashSet<>(ignored));
        this.coercer = builder.getCoercer();
        this.coercers = builder.getCoercers();
        this.keyGenerator = builder.getKeyGenerator();
        this.binding = builder.getBinding();
        this.callbackIndex = builder.getCallbackIndex();
        this.mode = builder.getMode();
    }

    public MemoizorBuilder toBuilder() {
        return MemoizorBuilder.from(this);
    }

    public String getName() {
        return name;
    }

    public String getUid() {
        return uid;
    }

    public boolean hasTtl() {
        return ttlNanos > 0;
    }

    /**
     * Returns the time-to-live in nanoseconds, or -1 when unset.
     */
    public long getTtlNanos() {
        return ttlNanos;
    }

    public boolean hasMaxRecords() {
        return maxRecords >= 0;
    }

    /**
     * Returns the record limit, or -1 when unset.
     */
    public long getMaxRecords() {
        return maxRecords;
    }

    public int getLruPercentPadding() {
        return lruPercentPadding;
    }

    public int getLruHistoryFactor() {
        return lruHistoryFactor;
    }

    public boolean hasMaxArgs() {
        return maxArgs > 0;
    }

    /**
     * Returns the argument count limit, or -1 when unset.
     */
    public int getMaxArgs() {
        return maxArgs;
    }

    public List<Integer> getIgnoreArgs() {
        return ignoreArgs;
    }

    public boolean isIgnored(int index) {
        return ignoredIndices.contains(index);
    }

    /**
     * Returns the coercer applied to every argument, or {@code null}.
     */
    public ArgumentCoercer getCoercer() {
        return coercer;
    }

    /**
     * Returns the per-position coercers (entries may be null), or {@code null}.
     */
    public List<ArgumentCoercer> getCoercers() {
        return coercers;
    }

    public KeyGenerator getKeyGenerator() {
        return keyGenerator;
    }

    public Object getBinding() {
        return binding;
    }

    public boolean hasCallbackIndex() {
        return callbackIndex >= 0;
    }

    /**
     * Returns the configured callback position, or -1 when unset.
     */
    public int getCallbackIndex() {
        return callbackIndex;
    }

    public KeyMode getMode() {
        return mode;
    }

    /**
     * Returns {@code true} if keys derived under {@code other} may differ from keys derived under
     * these options for the same arguments.
     */
    public boolean derivesKeysDifferentlyFrom(MemoOptions other) {
        return !uid.equals(other.uid)
                || keyGenerator != other.keyGenerator
                || coercer != other.coercer
                || !Objects.equals(coercers, other.coercers)
                || mode != other.mode;
    }

    @Override
    public String toString() {
        return "MemoOptions{"
                + "name=" + name
                + ", uid=" + uid
                + ", ttlNanos=" + ttlNanos
                + ", maxRecords=" + maxRecords
                + ", lruPercentPadding=" + lruPercentPadding
                + ", lruHistoryFactor=" + lruHistoryFactor
                + ", maxArgs=" + maxArgs
                + ", ignoreArgs=" + ignoreArgs
                + ", mode=" + mode
                + '}';
    }
}
