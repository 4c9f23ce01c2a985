package com.github.rudygunawan.memoizor.storage;

import java.util.WeakHashMap;

/**
 * In-memory storage whose entries may be collected once their key object is otherwise unreachable.
 *
 * <p>Only meaningful when keys are live object references, which requires a custom
 * {@link com.github.rudygunawan.memoizor.api.KeyGenerator} returning such an object (for example
 * the first argument). Hashed and primitive keys are fresh strings nobody else holds, so with them
 * entries can vanish at any garbage collection.
 */
public class WeakStorageController extends LocalStorageController {

    public WeakStorageController() {
        super(new WeakHashMap<>());
    }
}
