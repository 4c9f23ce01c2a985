package com.github.rudygunawan.memoizor.storage;

import java.util.List;
import java.util.Map;

/**
 * Base class for storage controllers. Every operation fails fast with
 * {@link UnsupportedOperationException} until a subclass overrides it.
 *
 * <p>The failure message tells apart an anonymous, empty use of this base ({@code new
 * AbstractStorageController() {}}) from a named subclass that left an operation out.
 */
public abstract class AbstractStorageController implements StorageController {

    @Override
    public Object save(Object key, Object value, List<Object> args) {
        throw missingImplementation("save");
    }

    @Override
    public Object retrieve(Object key, List<Object> args) {
        throw missingImplementation("retrieve");
    }

    @Override
    public Object delete(Object key, List<Object> args) {
        throw missingImplementation("delete");
    }

    @Override
    public void empty() {
        throw missingImplementation("empty");
    }

    @Override
    public Map<Object, Object> contents() {
        throw missingImplementation("contents");
    }

    private UnsupportedOperationException missingImplementation(String method) {
        if (getClass().isAnonymousClass() && getClass().getSuperclass() == AbstractStorageController.class) {
            return new UnsupportedOperationException("AbstractStorageController is an abstract type and must be "
                    + "subclassed; it cannot be used directly (called #" + method + ")");
        }
        return new UnsupportedOperationException(getClass().getName() + "#" + method
                + ": method not implemented. Subclasses of AbstractStorageController must implement this method");
    }
}
