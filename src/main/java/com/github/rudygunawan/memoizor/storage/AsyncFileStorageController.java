package com.github.rudygunawan.memoizor.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.rudygunawan.memoizor.impl.Futures;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * File-backed storage whose disk I/O runs off the caller's thread.
 *
 * <p>Uses the same {@code key|json} format and value typing as {@link FileStorageController}.
 * Every file operation is queued on one daemon thread, so writes reach the disk in submission order.
 * The returned futures complete after the disk write and the in-memory update. Lookups are served
 * from memory.
 *
 * <p>The controller must be initialized before use, either via {@link #open(Path)} or by awaiting
 * {@link #init()}; earlier calls fail with {@link IllegalStateException}.
 */
public class AsyncFileStorageController extends AbstractStorageController implements AutoCloseable {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.memoizor.Storage");

    private final StoreFile file;
    private final Map<Object, Object> store = Collections.synchronizedMap(new LinkedHashMap<>());
    private final ExecutorService ioExecutor;
    private volatile boolean initialized;

    public AsyncFileStorageController(Path path) {
        this(path, Object.class);
    }

    public AsyncFileStorageController(Path path, Class<?> valueType) {
        this(path, new ObjectMapper(), valueType);
    }

    public AsyncFileStorageController(Path path, TypeReference<?> valueType) {
        this(path, new ObjectMapper(), valueType);
    }

    public AsyncFileStorageController(Path path, ObjectMapper mapper) {
        this(path, mapper, Object.class);
    }

    public AsyncFileStorageController(Path path, ObjectMapper mapper, Class<?> valueType) {
        this(path, mapper, mapper.constructType(Objects.requireNonNull(valueType, "valueType")));
    }

    public AsyncFileStorageController(Path path, ObjectMapper mapper, TypeReference<?> valueType) {
        this(path, mapper, mapper.constructType(Objects.requireNonNull(valueType, "valueType")));
    }

    /**
     * @param valueType the type reloaded values are read as
     */
    public AsyncFileStorageController(Path path, ObjectMapper mapper, JavaType valueType) {
        this.file = new StoreFile(Objects.requireNonNull(path, "path"), Objects.requireNonNull(mapper, "mapper"),
                Objects.requireNonNull(valueType, "valueType"));
        this.ioExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "memoizor-file-io");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Creates a controller for {@code path}; the future completes once existing records are loaded.
     */
    public static CompletableFuture<AsyncFileStorageController> open(Path path) {
        return new AsyncFileStorageController(path).init();
    }

    /**
     * Like {@link #open(Path)}, reading records back as {@code valueType}.
     */
    public static CompletableFuture<AsyncFileStorageController> open(Path path, Class<?> valueType) {
        return new AsyncFileStorageController(path, valueType).init();
    }

    /**
     * Loads the records already in the file. A missing file is treated as empty.
     */
    public CompletableFuture<AsyncFileStorageController> init() {
        return submit(() -> {
            Map<Object, Object> records = file.load();
            store.putAll(records);
            initialized = true;
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Loaded " + records.size() + " records from " + file.path());
            }
            return this;
        });
    }

    public boolean isInitialized() {
        return initialized;
    }

    public Path getPath() {
        return file.path();
    }

    @Override
    public CompletableFuture<Object> saveAsync(Object key, Object value, List<Object> args) {
        checkInitialized();
        String line = file.format(key, value);
        return submit(() -> {
            file.append(line);
            store.put(key, value);
            return value;
        });
    }

    @Override
    public CompletableFuture<Object> retrieveAsync(Object key, List<Object> args) {
        return Futures.supply(() -> retrieve(key, args));
    }

    @Override
    public CompletableFuture<Object> deleteAsync(Object key, List<Object> args) {
        checkInitialized();
        return submit(() -> {
            file.remove(key);
            synchronized (store) {
                return store.containsKey(key) ? store.remove(key) : NOT_CACHED;
            }
        });
    }

    @Override
    public CompletableFuture<Void> emptyAsync() {
        checkInitialized();
        return submit(() -> {
            file.truncate();
            store.clear();
            return null;
        });
    }

    @Override
    public Object save(Object key, Object value, List<Object> args) {
        return Futures.await(saveAsync(key, value, args));
    }

    @Override
    public Object retrieve(Object key, List<Object> args) {
        checkInitialized();
        synchronized (store) {
            return store.containsKey(key) ? store.get(key) : NOT_CACHED;
        }
    }

    @Override
    public Object delete(Object key, List<Object> args) {
        return Futures.await(deleteAsync(key, args));
    }

    @Override
    public void empty() {
        Futures.await(emptyAsync());
    }

    @Override
    public Map<Object, Object> contents() {
        checkInitialized();
        synchronized (store) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(store));
        }
    }

    /**
     * Stops the I/O thread after queued writes finish.
     */
    @Override
    public void close() {
        ioExecutor.shutdown();
    }

    /**
     * Queues {@code task} on the I/O thread. Dependent stages run on the common pool instead, so a
     * caller's continuation can never hold up writes queued behind it.
     */
    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        return CompletableFuture.supplyAsync(task, ioExecutor).thenApplyAsync(Function.identity());
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("AsyncFileStorageController for " + file.path()
                    + " used before init() completed");
        }
    }
}
