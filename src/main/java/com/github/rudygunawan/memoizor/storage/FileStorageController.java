package com.github.rudygunawan.memoizor.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory storage mirrored to an append-only text file, one {@code key|json} record per line.
 *
 * <p>All file I/O blocks the calling thread. Writes go to disk before memory, so a failed write
 * leaves memory untouched and surfaces as an {@link java.io.UncheckedIOException}.
 *
 * <p>Keys are written with {@code toString()} and come back as strings after a reload. Values are
 * written by Jackson and read back as the controller's value type. Without one they come back as
 * Jackson's natural types ({@code Map}, {@code List}, {@code String}, {@code Integer}, ...), so a
 * function returning {@code Long} or a bean needs its type here. Callback-mode functions store
 * {@code List}s.
 *
 * <pre>{@code
 * FileStorageController store = FileStorageController.open(Path.of("fib.cache"), Long.class);
 * MemoizedFunction<Long> fib = Memoizor.newBuilder()
 *     .storageController(store)
 *     .build(inv -> slowFib(inv.<Integer>arg(0)));
 * }</pre>
 */
public class FileStorageController extends LocalStorageController {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.memoizor.Storage");

    private final StoreFile file;

    public FileStorageController(Path path) {
        this(path, Object.class);
    }

    public FileStorageController(Path path, Class<?> valueType) {
        this(path, new ObjectMapper(), valueType);
    }

    public FileStorageController(Path path, TypeReference<?> valueType) {
        this(path, new ObjectMapper(), valueType);
    }

    public FileStorageController(Path path, ObjectMapper mapper) {
        this(path, mapper, Object.class);
    }

    public FileStorageController(Path path, ObjectMapper mapper, Class<?> valueType) {
        this(path, mapper, mapper.constructType(Objects.requireNonNull(valueType, "valueType")));
    }

    public FileStorageController(Path path, ObjectMapper mapper, TypeReference<?> valueType) {
        this(path, mapper, mapper.constructType(Objects.requireNonNull(valueType, "valueType")));
    }

    /**
     * @param valueType the type reloaded values are read as
     */
    public FileStorageController(Path path, ObjectMapper mapper, JavaType valueType) {
        this.file = new StoreFile(Objects.requireNonNull(path, "path"), Objects.requireNonNull(mapper, "mapper"),
                Objects.requireNonNull(valueType, "valueType"));
    }

    /**
     * Creates a controller for {@code path} and loads its existing records.
     */
    public static FileStorageController open(Path path) {
        return new FileStorageController(path).init();
    }

    /**
     * Creates a controller for {@code path} whose records are read back as {@code valueType}, and
     * loads them.
     */
    public static FileStorageController open(Path path, Class<?> valueType) {
        return new FileStorageController(path, valueType).init();
    }

    public static FileStorageController open(Path path, TypeReference<?> valueType) {
        return new FileStorageController(path, valueType).init();
    }

    /**
     * Loads the records already in the file into memory. A missing file is treated as empty.
     *
     * @return this controller
     */
    public synchronized FileStorageController init() {
        Map<Object, Object> records = file.load();
        records.forEach((key, value) -> super.save(key, value, null));
        if (LOGGER.isLoggable(Level.FINE)) {
            LOGGER.fine("Loaded " + records.size() + " records from " + file.path());
        }
        return this;
    }

    public Path getPath() {
        return file.path();
    }

    @Override
    public synchronized Object save(Object key, Object value, List<Object> args) {
        file.append(file.format(key, value));
        return super.save(key, value, args);
    }

    @Override
    public synchronized Object delete(Object key, List<Object> args) {
        file.remove(key);
        return super.delete(key, args);
    }

    @Override
    public synchronized void empty() {
        file.truncate();
        super.empty();
    }
}
