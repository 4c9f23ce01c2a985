package com.github.rudygunawan.memoizor.impl;

import com.github.rudygunawan.memoizor.api.Callback;
import com.github.rudygunawan.memoizor.api.CallbackMemoizedFunction;
import com.github.rudygunawan.memoizor.api.CallbackTarget;
import com.github.rudygunawan.memoizor.api.Invocation;
import com.github.rudygunawan.memoizor.model.MemoOptions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

import static com.github.rudygunawan.memoizor.storage.StorageController.NOT_CACHED;

/**
 * Memoizes a {@link CallbackTarget}.
 *
 * <p>The caller's callback is located at {@code callbackIndex} (clamped to the argument count) or,
 * when that is unset, at the last position. It is excluded from the cache key. On a miss the target
 * receives a wrapping callback at the same position; the first successful completion is stored as
 * {@code [null, results...]} and then forwarded, while errors are forwarded without being stored.
 * On a hit the stored list is replayed directly.
 *
 * <p>The caller's callback completes exactly once per call, whether the failure comes from key
 * derivation, the storage controller or the target. Later completions are dropped and logged.
 */
public class CallbackMemoizor extends AbstractMemoizor implements CallbackMemoizedFunction {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.memoizor.Memoizor");

    private static final Callback NO_OP = (error, results) -> { };

    private final CallbackTarget target;

    public CallbackMemoizor(CallbackTarget target, MemoizorEngine engine) {
        super(engine);
        this.target = Objects.requireNonNull(target, "Cannot memoize a null target");
    }

    @Override
    public void call(Object... args) {
        Object[] rawArgs = args == null ? new Object[0] : args;
        MemoOptions options = engine.options();
        List<Object> params = new ArrayList<>(Arrays.asList(rawArgs));

        int index = options.hasCallbackIndex()
                ? Math.min(options.getCallbackIndex(), rawArgs.length)
                : rawArgs.length - 1;
        Callback callback;
        if (index >= 0 && index < rawArgs.length && rawArgs[index] instanceof Callback) {
            callback = (Callback) params.remove(index);
        } else {
            LOGGER.warning(engine.name() + ": no Callback at argument " + index
                    + "; the result of this call cannot be delivered");
            callback = NO_OP;
            index = params.size();
        }
        OnceCallback done = new OnceCallback(engine.name(), callback);

        if (!engine.isEnabled()) {
            params.add(index, done);
            invoke(options, params, done);
            return;
        }

        try {
            List<Object> resolved = engine.resolveArguments(params.toArray());
            Object key = engine.key(resolved);
            int position = index;
            engine.retrieveAsync(key, resolved).whenComplete((cached, error) -> {
                if (error != null) {
                    done.complete(Futures.unwrap(error));
                } else if (cached != NOT_CACHED) {
                    replay(done, cached);
                } else {
                    params.add(position, saving(key, resolved, done));
                    invoke(options, params, done);
                }
            });
        } catch (RuntimeException e) {
            done.complete(e);
        }
    }

    @Override
    public void get(List<?> args, Callback done) {
        Objects.requireNonNull(done, "done cannot be null");
        deliver(Futures.compose(() -> {
            List<Object> resolved = engine.resolveArguments(args.toArray());
            return engine.retrieveAsync(engine.key(resolved), resolved);
        }), done);
    }

    @Override
    public void save(Object value, List<?> args, Callback done) {
        Objects.requireNonNull(done, "done cannot be null");
        List<Object> stored = value instanceof List
                ? new ArrayList<Object>((List<?>) value)
                : new ArrayList<Object>(Arrays.asList(null, value));
        deliver(Futures.compose(() -> {
            List<Object> resolved = engine.resolveArguments(args.toArray());
            return engine.saveAsync(engine.key(resolved), stored, resolved);
        }), done);
    }

    @Override
    public void delete(List<?> args, Callback done) {
        Objects.requireNonNull(done, "done cannot be null");
        deliver(Futures.compose(() -> {
            List<Object> resolved = engine.resolveArguments(args.toArray());
            return engine.deleteAsync(engine.key(resolved), resolved);
        }), done);
    }

    @Override
    public void empty(Callback done) {
        Objects.requireNonNull(done, "done cannot be null");
        engine.emptyAsync().whenComplete((ignored, error) -> {
            if (error != null) {
                done.complete(Futures.unwrap(error));
            } else {
                done.complete(null);
            }
        });
    }

    @Override
    public void disable(boolean emptyFirst, Callback done) {
        Objects.requireNonNull(done, "done cannot be null");
        engine.disableAsync(emptyFirst).whenComplete((changed, error) -> {
            if (error != null) {
                done.complete(Futures.unwrap(error));
            } else {
                done.complete(null, changed);
            }
        });
    }

    @Override
    public void setOptions(MemoOptions options, boolean clearStore, Callback done) {
        Objects.requireNonNull(done, "done cannot be null");
        engine.setOptionsAsync(options, clearStore).whenComplete((ignored, error) -> {
            if (error != null) {
                done.complete(Futures.unwrap(error));
            } else {
                done.complete(null);
            }
        });
    }

    private void invoke(MemoOptions options, List<Object> params, Callback done) {
        try {
            target.call(new Invocation(options.getBinding(), params.toArray()));
        } catch (Exception e) {
            done.complete(e);
        }
    }

    /**
     * Returns the callback handed to the target on a miss: stores the first successful completion,
     * then forwards it.
     */
    private Callback saving(Object key, List<Object> resolved, Callback done) {
        AtomicBoolean first = new AtomicBoolean();
        return (error, results) -> {
            if (!first.compareAndSet(false, true) || error != null) {
                done.complete(error, results);
                return;
            }
            Object[] values = results == null ? new Object[0] : results.clone();
            List<Object> stored = new ArrayList<>(values.length + 1);
            stored.add(null);
            stored.addAll(Arrays.asList(values));
            Futures.compose(() -> engine.saveAsync(key, stored, resolved)).whenComplete((saved, saveError) -> {
                if (saveError != null) {
                    done.complete(Futures.unwrap(saveError));
                } else {
                    done.complete(null, values);
                }
            });
        };
    }

    private static void deliver(CompletableFuture<Object> future, Callback done) {
        future.whenComplete((value, error) -> {
            if (error != null) {
                done.complete(Futures.unwrap(error));
            } else {
                replay(done, value);
            }
        });
    }

    /**
     * Spreads a stored {@code [error, results...]} list into {@code done}.
     */
    private static void replay(Callback done, Object stored) {
        if (stored == NOT_CACHED || !(stored instanceof List)) {
            done.complete(null, stored);
            return;
        }
        List<?> values = (List<?>) stored;
        if (values.isEmpty()) {
            done.complete(null);
            return;
        }
        Object head = values.get(0);
        Throwable error = head instanceof Throwable ? (Throwable) head : null;
        done.complete(error, values.subList(1, values.size()).toArray());
    }

    /**
     * Forwards the first completion only; a throwing caller callback is logged.
     */
    static final class OnceCallback implements Callback {
        private final String name;
        private final Callback delegate;
        private final AtomicBoolean completed = new AtomicBoolean();

        OnceCallback(String name, Callback delegate) {
            this.name = name;
            this.delegate = delegate;
        }

        @Override
        public void complete(Throwable error, Object... results) {
            if (!completed.compareAndSet(false, true)) {
                if (LOGGER.isLoggable(Level.FINE)) {
                    LOGGER.log(Level.FINE, name + ": callback already completed, dropping later completion", error);
                }
                return;
            }
            try {
                delegate.complete(error, results);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, name + ": callback threw exception", e);
            }
        }

        @Override
        public String toString() {
            return "OnceCallback{" + name + ", completed=" + completed.get() + '}';
        }
    }
}
