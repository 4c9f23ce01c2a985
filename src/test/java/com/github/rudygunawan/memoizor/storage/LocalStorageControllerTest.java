package com.github.rudygunawan.memoizor.storage;

import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.github.rudygunawan.memoizor.storage.StorageController.NOT_CACHED;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the in-memory controllers and the abstract base.
 */
class LocalStorageControllerTest {

    private static final List<Object> ARGS = Collections.emptyList();

    @Test
    void testSaveAndRetrieve() {
        LocalStorageController store = new LocalStorageController();
        assertEquals("v", store.save("k", "v", ARGS));
        assertEquals("v", store.retrieve("k", ARGS));
        assertSame(NOT_CACHED, store.retrieve("missing", ARGS));
    }

    @Test
    void testNullIsAStoredValue() {
        LocalStorageController store = new LocalStorageController();
        store.save("k", null, ARGS);
        assertNull(store.retrieve("k", ARGS));
        assertNull(store.delete("k", ARGS));
        assertSame(NOT_CACHED, store.retrieve("k", ARGS));
    }

    @Test
    void testDeleteReturnsPreviousValue() {
        LocalStorageController store = new LocalStorageController();
        store.save("k", 42, ARGS);
        assertEquals(42, store.delete("k", ARGS));
        assertSame(NOT_CACHED, store.delete("k", ARGS));
    }

    @Test
    void testEmptyIsIdempotent() {
        LocalStorageController store = new LocalStorageController();
        store.save("a", 1, ARGS);
        store.save("b", 2, ARGS);
        store.empty();
        assertTrue(store.contents().isEmpty());
        store.empty();
        assertTrue(store.contents().isEmpty());
    }

    @Test
    void testContentsIsAReadOnlySnapshot() {
        LocalStorageController store = new LocalStorageController();
        store.save("a", 1, ARGS);
        Map<Object, Object> contents = store.contents();
        store.save("b", 2, ARGS);

        assertEquals(Collections.singletonMap("a", 1), contents);
        assertThrows(UnsupportedOperationException.class, () -> contents.put("c", 3));
    }

    @Test
    void testDefaultAsyncOperationsWrapSyncOnes() {
        LocalStorageController store = new LocalStorageController();
        assertEquals("v", store.saveAsync("k", "v", ARGS).join());
        assertEquals("v", store.retrieveAsync("k", ARGS).join());
        assertEquals("v", store.deleteAsync("k", ARGS).join());
        assertSame(NOT_CACHED, store.retrieveAsync("k", ARGS).join());
        store.save("x", 1, ARGS);
        store.emptyAsync().join();
        assertTrue(store.contents().isEmpty());
    }

    @Test
    void testWeakControllerBehavesLikeMapWhileKeysAreReachable() {
        WeakStorageController store = new WeakStorageController();
        Object key = new Object();
        store.save(key, "v", ARGS);
        assertEquals("v", store.retrieve(key, ARGS));
        assertEquals("v", store.delete(key, ARGS));
        assertSame(NOT_CACHED, store.retrieve(key, ARGS));
    }

    @Test
    void testAnonymousAbstractControllerCannotBeUsedDirectly() {
        StorageController store = new AbstractStorageController() { };
        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
                () -> store.save("k", "v", ARGS));
        assertTrue(e.getMessage().contains("cannot be used directly"), e.getMessage());
    }

    static class HalfDoneController extends AbstractStorageController {
        @Override
        public Object retrieve(Object key, List<Object> args) {
            return NOT_CACHED;
        }
    }

    @Test
    void testSubclassMissingMethodNamesIt() {
        StorageController store = new HalfDoneController();
        assertSame(NOT_CACHED, store.retrieve("k", ARGS));

        UnsupportedOperationException e = assertThrows(UnsupportedOperationException.class,
                () -> store.delete("k", ARGS));
        assertTrue(e.getMessage().contains("HalfDoneController#delete: method not implemented"), e.getMessage());
        assertThrows(UnsupportedOperationException.class, store::empty);
        assertThrows(UnsupportedOperationException.class, store::contents);
    }

    @Test
    void testAsyncDefaultReportsFailureAsFailedFuture() {
        StorageController store = new HalfDoneController();
        assertTrue(store.saveAsync("k", "v", ARGS).isCompletedExceptionally());
    }
}
