package com.github.rudygunawan.memoizor.impl;

import com.github.rudygunawan.memoizor.api.AsyncMemoizedFunction;
import com.github.rudygunawan.memoizor.api.AsyncTarget;
import com.github.rudygunawan.memoizor.api.Invocation;
import com.github.rudygunawan.memoizor.model.MemoOptions;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static com.github.rudygunawan.memoizor.storage.StorageController.NOT_CACHED;

/**
 * Memoizes an {@link AsyncTarget}. Nothing here blocks: storage and target are composed as futures,
 * and every returned future fails with the original exception rather than a wrapper.
 *
 * @param <R> the result type
 */
public class AsyncMemoizor<R> extends AbstractMemoizor implements AsyncMemoizedFunction<R> {
    private final AsyncTarget<R> target;

    public AsyncMemoizor(AsyncTarget<R> target, MemoizorEngine engine) {
        super(engine);
        this.target = Objects.requireNonNull(target, "Cannot memoize a null target");
    }

    @Override
    @SuppressWarnings("unchecked")
    public CompletableFuture<R> call(Object... args) {
        Invocation invocation = new Invocation(engine.options().getBinding(), args);
        if (!engine.isEnabled()) {
            return invoke(invocation);
        }

        List<Object> resolved;
        Object key;
        try {
            resolved = engine.resolveArguments(args);
            key = engine.key(resolved);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }

        return Futures.unwrapped(engine.retrieveAsync(key, resolved).thenCompose(cached -> {
            if (cached != NOT_CACHED) {
                return CompletableFuture.completedFuture((R) cached);
            }
            return invoke(invocation).thenCompose(result ->
                    engine.saveAsync(key, result, resolved).thenApply(saved -> result));
        }));
    }

    @Override
    public CompletableFuture<Object> get(Object... args) {
        return Futures.unwrapped(Futures.compose(() -> {
            List<Object> resolved = engine.resolveArguments(args);
            return engine.retrieveAsync(engine.key(resolved), resolved);
        }));
    }

    @Override
    public CompletableFuture<R> save(R value, Object... args) {
        return Futures.unwrapped(Futures.compose(() -> {
            List<Object> resolved = engine.resolveArguments(args);
            return engine.saveAsync(engine.key(resolved), value, resolved).thenApply(saved -> value);
        }));
    }

    @Override
    public CompletableFuture<Object> delete(Object... args) {
        return Futures.unwrapped(Futures.compose(() -> {
            List<Object> resolved = engine.resolveArguments(args);
            return engine.deleteAsync(engine.key(resolved), resolved);
        }));
    }

    @Override
    public CompletableFuture<Void> empty() {
        return Futures.unwrapped(engine.emptyAsync());
    }

    @Override
    public CompletableFuture<Boolean> disable(boolean emptyFirst) {
        return Futures.unwrapped(engine.disableAsync(emptyFirst));
    }

    @Override
    public CompletableFuture<Void> setOptions(MemoOptions options, boolean clearStore) {
        return Futures.unwrapped(engine.setOptionsAsync(options, clearStore));
    }

    private CompletableFuture<R> invoke(Invocation invocation) {
        try {
            CompletionStage<R> stage = target.call(invocation);
            if (stage == null) {
                return CompletableFuture.failedFuture(new NullPointerException("AsyncTarget returned a null future"));
            }
            return stage.toCompletableFuture();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
