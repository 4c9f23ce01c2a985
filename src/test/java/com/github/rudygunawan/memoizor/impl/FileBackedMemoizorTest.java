package com.github.rudygunawan.memoizor.impl;

import com.github.rudygunawan.memoizor.Memoizor;
import com.github.rudygunawan.memoizor.api.MemoizedFunction;
import com.github.rudygunawan.memoizor.model.KeyMode;
import com.github.rudygunawan.memoizor.storage.FileStorageController;
import com.github.rudygunawan.memoizor.time.FakeTicker;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.github.rudygunawan.memoizor.storage.StorageController.NOT_CACHED;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for memoized functions whose results outlive the process in a file store.
 */
class FileBackedMemoizorTest {

    private final AtomicInteger calls = new AtomicInteger();

    @TempDir
    Path dir;

    private MemoizedFunction<Long> fib(FileStorageController store) {
        return Memoizor.newBuilder()
                .name("fib")
                .storageController(store)
                .build(inv -> {
                    calls.incrementAndGet();
                    int n = inv.<Integer>arg(0);
                    long a = 0;
                    long b = 1;
                    for (int i = 0; i < n; i++) {
                        long next = a + b;
                        a = b;
                        b = next;
                    }
                    return a;
                });
    }

    @Test
    void testReopenedStoreServesTypedResults() throws Exception {
        Path file = dir.resolve("fib.cache");
        assertEquals(55L, fib(FileStorageController.open(file, Long.class)).call(10));

        MemoizedFunction<Long> reopened = fib(FileStorageController.open(file, Long.class));
        Object stored = reopened.get(10);
        assertEquals(Long.class, stored.getClass());
        Long result = reopened.call(10);
        assertEquals(55L, result);
        assertEquals(1, calls.get());
    }

    @Test
    void testReopenedStoreStaysWithinRecordLimit() throws Exception {
        Path file = dir.resolve("identity.cache");
        MemoizedFunction<Integer> first = Memoizor.newBuilder()
                .storageController(FileStorageController.open(file, Integer.class))
                .maxRecords(5)
                .build(inv -> inv.<Integer>arg(0));
        for (int i = 0; i < 5; i++) {
            first.call(i);
        }

        FileStorageController reopenedStore = FileStorageController.open(file, Integer.class);
        MemoizedFunction<Integer> second = Memoizor.newBuilder()
                .storageController(reopenedStore)
                .maxRecords(5)
                .build(inv -> inv.<Integer>arg(0));
        assertEquals(5, second.metrics().recordCount());
        for (int i = 100; i < 120; i++) {
            second.call(i);
        }

        assertEquals(5, second.storeContents().size());
        assertEquals(5, FileStorageController.open(file).contents().size());
    }

    @Test
    void testReopenedRecordsExpire() throws Exception {
        Path file = dir.resolve("ttl.cache");
        Memoizor.newBuilder()
                .storageController(FileStorageController.open(file, Integer.class))
                .build(inv -> inv.<Integer>arg(0))
                .call(1);

        FakeTicker ticker = new FakeTicker();
        MemoizedFunction<Integer> reopened = Memoizor.newBuilder()
                .storageController(FileStorageController.open(file, Integer.class))
                .ticker(ticker)
                .ttl(1, TimeUnit.SECONDS)
                .build(inv -> {
                    calls.incrementAndGet();
                    return inv.<Integer>arg(0);
                });

        assertEquals(1, reopened.call(1));
        assertEquals(0, calls.get());
        ticker.advance(1, TimeUnit.SECONDS);
        assertEquals(1, reopened.call(1));
        assertEquals(1, calls.get());
    }

    @Test
    void testPrimitiveKeysWithDelimiterReopen() throws Exception {
        Path file = dir.resolve("primitive.cache");
        MemoizedFunction<String> upper = Memoizor.newBuilder()
                .mode(KeyMode.PRIMITIVE)
                .storageController(FileStorageController.open(file, String.class))
                .build(inv -> {
                    calls.incrementAndGet();
                    return inv.<String>arg(0).toUpperCase();
                });
        assertEquals("A|B", upper.call("a|b"));
        assertEquals("X\nY", upper.call("x\ny"));

        MemoizedFunction<String> reopened = Memoizor.newBuilder()
                .mode(KeyMode.PRIMITIVE)
                .storageController(FileStorageController.open(file, String.class))
                .build(inv -> {
                    calls.incrementAndGet();
                    return inv.<String>arg(0).toUpperCase();
                });
        assertEquals("A|B", reopened.call("a|b"));
        assertEquals("X\nY", reopened.call("x\ny"));
        assertEquals(2, calls.get());

        reopened.delete("a|b");
        assertSame(NOT_CACHED, reopened.get("a|b"));
        assertEquals("X\nY", FileStorageController.open(file, String.class).contents().get("x\ny"));
    }
}
