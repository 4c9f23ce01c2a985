package com.github.rudygunawan.memoizor.impl;

import com.github.rudygunawan.memoizor.Memoizor;
import com.github.rudygunawan.memoizor.api.AsyncMemoizedFunction;
import com.github.rudygunawan.memoizor.storage.AsyncFileStorageController;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.rudygunawan.memoizor.storage.StorageController.NOT_CACHED;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for memoizing future-returning functions.
 */
class AsyncMemoizorTest {

    private final AtomicInteger calls = new AtomicInteger();

    @TempDir
    Path dir;

    private AsyncMemoizedFunction<Integer> doubler() {
        return Memoizor.async(inv -> {
            calls.incrementAndGet();
            return CompletableFuture.supplyAsync(() -> inv.<Integer>arg(0) * 2);
        });
    }

    @Test
    void testRepeatedCallIsServedFromCache() {
        AsyncMemoizedFunction<Integer> doubled = doubler();
        assertEquals(8, doubled.call(4).join());
        assertEquals(8, doubled.call(4).join());
        assertEquals(1, calls.get());
    }

    @Test
    void testFailureIsPropagatedUnwrappedAndNotCached() {
        AsyncMemoizedFunction<Integer> failing = Memoizor.async(inv -> {
            calls.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalStateException("boom"));
        });

        ExecutionException e = assertThrows(ExecutionException.class, () -> failing.call(1).get());
        assertTrue(e.getCause() instanceof IllegalStateException);
        assertEquals("boom", e.getCause().getMessage());

        CompletionException joined = assertThrows(CompletionException.class, () -> failing.call(1).join());
        assertTrue(joined.getCause() instanceof IllegalStateException);

        assertEquals(2, calls.get());
        assertTrue(failing.storeContents().isEmpty());
    }

    @Test
    void testThrowingTargetFailsTheFuture() {
        AsyncMemoizedFunction<Integer> throwing = Memoizor.async(inv -> {
            throw new IllegalArgumentException("bad input");
        });
        CompletableFuture<Integer> result = throwing.call(1);
        assertTrue(result.isCompletedExceptionally());
        ExecutionException e = assertThrows(ExecutionException.class, result::get);
        assertTrue(e.getCause() instanceof IllegalArgumentException);
    }

    @Test
    void testDisabledFunctionBypassesCache() {
        AsyncMemoizedFunction<Integer> doubled = doubler();
        assertTrue(doubled.disable().join());
        assertFalse(doubled.disable().join());
        doubled.call(4).join();
        doubled.call(4).join();
        assertEquals(2, calls.get());
        assertTrue(doubled.storeContents().isEmpty());
    }

    @Test
    void testManualOperations() {
        AsyncMemoizedFunction<Integer> doubled = doubler();
        assertSame(NOT_CACHED, doubled.get(4).join());
        assertEquals(100, doubled.save(100, 4).join());
        assertEquals(100, doubled.get(4).join());
        assertEquals(100, doubled.call(4).join());
        assertEquals(100, doubled.delete(4).join());
        doubled.call(5).join();
        doubled.clear().join();
        assertTrue(doubled.storeContents().isEmpty());
        assertEquals(1, calls.get());
    }

    @Test
    void testSetOptionsClearsOnRequest() {
        AsyncMemoizedFunction<Integer> doubled = doubler();
        doubled.call(1).join();
        doubled.setOptions(doubled.options(), true).join();
        assertTrue(doubled.storeContents().isEmpty());
    }

    @Test
    void testWorksOverAsyncFileStorage() {
        try (AsyncFileStorageController store = AsyncFileStorageController.open(dir.resolve("doubled.txt")).join()) {
            AsyncMemoizedFunction<Integer> doubled = Memoizor.newBuilder()
                    .storageController(store)
                    .maxRecords(2)
                    .buildAsync(inv -> {
                        calls.incrementAndGet();
                        return CompletableFuture.completedFuture(inv.<Integer>arg(0) * 2);
                    });

            assertEquals(2, doubled.call(1).join());
            assertEquals(4, doubled.call(2).join());
            assertEquals(2, doubled.call(1).join());
            assertEquals(6, doubled.call(3).join());

            assertEquals(3, calls.get());
            assertEquals(2, store.contents().size());
        }
    }

    @Test
    void testInFlightMissesBothRunAndLastSaveWins() {
        List<CompletableFuture<String>> pending = new CopyOnWriteArrayList<>();
        AsyncMemoizedFunction<String> lookup = Memoizor.async(inv -> {
            calls.incrementAndGet();
            CompletableFuture<String> result = new CompletableFuture<>();
            pending.add(result);
            return result;
        });

        CompletableFuture<String> first = lookup.call("k");
        CompletableFuture<String> second = lookup.call("k");
        assertEquals(2, calls.get());
        assertEquals(2, pending.size());

        pending.get(0).complete("first");
        assertEquals("first", first.join());
        pending.get(1).complete("second");
        assertEquals("second", second.join());

        assertEquals("second", lookup.get("k").join());
        assertEquals(1, lookup.storeContents().size());
    }

    @Test
    void testConcurrentCallsFromManyThreads() throws Exception {
        AsyncMemoizedFunction<Integer> doubled = Memoizor.newBuilder()
                .maxRecords(10)
                .buildAsync(inv -> CompletableFuture.supplyAsync(() -> inv.<Integer>arg(0) * 2));

        List<CompletableFuture<Integer>> results = new CopyOnWriteArrayList<>();
        Thread[] threads = new Thread[8];
        for (int t = 0; t < threads.length; t++) {
            int offset = t * 100;
            threads[t] = new Thread(() -> {
                for (int i = 0; i < 100; i++) {
                    results.add(doubled.call(offset + i));
                }
            });
            threads[t].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        for (CompletableFuture<Integer> result : results) {
            assertEquals(0, result.join() % 2);
        }
        assertEquals(800, results.size());
        assertEquals(800, doubled.stats().saveCount());
        assertEquals(doubled.metrics().recordCount(), doubled.storeContents().size());
    }
}
