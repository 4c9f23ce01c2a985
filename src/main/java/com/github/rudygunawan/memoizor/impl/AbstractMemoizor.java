package com.github.rudygunawan.memoizor.impl;

import com.github.rudygunawan.memoizor.api.MemoizedControl;
import com.github.rudygunawan.memoizor.listener.MemoizorListener;
import com.github.rudygunawan.memoizor.metrics.MemoizorMetrics;
import com.github.rudygunawan.memoizor.model.MemoOptions;
import com.github.rudygunawan.memoizor.model.MemoStats;
import com.github.rudygunawan.memoizor.storage.StorageController;

import java.util.Map;
import java.util.Objects;

/**
 * The management operations every adapter shares, delegated to its {@link MemoizorEngine}.
 */
abstract class AbstractMemoizor implements MemoizedControl {
    protected final MemoizorEngine engine;

    protected AbstractMemoizor(MemoizorEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
    }

    @Override
    public Object key(Object... args) {
        return engine.keyFor(args);
    }

    @Override
    public boolean isEnabled() {
        return engine.isEnabled();
    }

    @Override
    public boolean enable() {
        return engine.enable();
    }

    @Override
    public Map<Object, Object> storeContents() {
        return engine.contents();
    }

    @Override
    public MemoOptions options() {
        return engine.options();
    }

    @Override
    public MemoStats stats() {
        return engine.stats();
    }

    @Override
    public MemoizorMetrics metrics() {
        return engine;
    }

    @Override
    public void addListener(MemoizorListener listener) {
        engine.addListener(listener);
    }

    @Override
    public void removeListener(MemoizorListener listener) {
        engine.removeListener(listener);
    }

    @Override
    public StorageController storageController() {
        return engine.storageController();
    }

    @Override
    public void setStorageController(StorageController controller) {
        engine.setStorageController(controller);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + engine.name() + ", enabled=" + engine.isEnabled() + '}';
    }
}
