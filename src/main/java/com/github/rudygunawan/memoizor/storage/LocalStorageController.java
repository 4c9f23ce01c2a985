package com.github.rudygunawan.memoizor.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Process-local, in-memory storage. This is the default controller.
 *
 * <p>Backed by a synchronized map, so {@code null} results are stored like any other value.
 */
public class LocalStorageController extends AbstractStorageController {
    private final Map<Object, Object> store;

    public LocalStorageController() {
        this(new LinkedHashMap<>());
    }

    /**
     * @param backing the map to store into; it is wrapped for synchronization and must not be
     *                touched elsewhere
     */
    protected LocalStorageController(Map<Object, Object> backing) {
        this.store = Collections.synchronizedMap(backing);
    }

    @Override
    public Object save(Object key, Object value, List<Object> args) {
        store.put(key, value);
        return value;
    }

    @Override
    public Object retrieve(Object key, List<Object> args) {
        synchronized (store) {
            return store.containsKey(key) ? store.get(key) : NOT_CACHED;
        }
    }

    @Override
    public Object delete(Object key, List<Object> args) {
        synchronized (store) {
            return store.containsKey(key) ? store.remove(key) : NOT_CACHED;
        }
    }

    @Override
    public void empty() {
        store.clear();
    }

    @Override
    public Map<Object, Object> contents() {
        synchronized (store) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(store));
        }
    }
}
