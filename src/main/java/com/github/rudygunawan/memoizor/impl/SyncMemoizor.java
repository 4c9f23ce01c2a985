package com.github.rudygunawan.memoizor.impl;

import com.github.rudygunawan.memoizor.api.Invocation;
import com.github.rudygunawan.memoizor.api.MemoizedFunction;
import com.github.rudygunawan.memoizor.api.SyncTarget;
import com.github.rudygunawan.memoizor.model.MemoOptions;

import java.util.List;
import java.util.Objects;

import static com.github.rudygunawan.memoizor.storage.StorageController.NOT_CACHED;

/**
 * Memoizes a {@link SyncTarget}. Calls block until the storage controller and, on a miss, the target
 * have finished.
 *
 * @param <R> the result type
 */
public class SyncMemoizor<R> extends AbstractMemoizor implements MemoizedFunction<R> {
    private final SyncTarget<R> target;

    public SyncMemoizor(SyncTarget<R> target, MemoizorEngine engine) {
        super(engine);
        this.target = Objects.requireNonNull(target, "Cannot memoize a null target");
    }

    @Override
    @SuppressWarnings("unchecked")
    public R call(Object... args) throws Exception {
        Invocation invocation = new Invocation(engine.options().getBinding(), args);
        if (!engine.isEnabled()) {
            return target.call(invocation);
        }

        List<Object> resolved = engine.resolveArguments(args);
        Object key = engine.key(resolved);
        Object cached = engine.retrieve(key, resolved);
        if (cached != NOT_CACHED) {
            return (R) cached;
        }

        R result = target.call(invocation);
        engine.save(key, result, resolved);
        return result;
    }

    @Override
    public Object get(Object... args) {
        List<Object> resolved = engine.resolveArguments(args);
        return engine.retrieve(engine.key(resolved), resolved);
    }

    @Override
    public R save(R value, Object... args) {
        List<Object> resolved = engine.resolveArguments(args);
        engine.save(engine.key(resolved), value, resolved);
        return value;
    }

    @Override
    public Object delete(Object... args) {
        List<Object> resolved = engine.resolveArguments(args);
        return engine.delete(engine.key(resolved), resolved);
    }

    @Override
    public void empty() {
        engine.empty();
    }

    @Override
    public boolean disable(boolean emptyFirst) {
        return engine.disable(emptyFirst);
    }

    @Override
    public void setOptions(MemoOptions options, boolean clearStore) {
        engine.setOptions(options, clearStore);
    }
}
