package com.github.rudygunawan.memoizor.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static com.github.rudygunawan.memoizor.storage.StorageController.NOT_CACHED;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the blocking file-backed controller.
 */
class FileStorageControllerTest {

    private static final List<Object> ARGS = Collections.emptyList();
    private static final String EOL = System.lineSeparator();

    @TempDir
    Path dir;

    @Test
    void testMissingFileStartsEmpty() {
        FileStorageController store = FileStorageController.open(dir.resolve("store.txt"));
        assertTrue(store.contents().isEmpty());
        assertFalse(Files.exists(store.getPath()));
    }

    @Test
    void testSaveAppendsLine() throws IOException {
        Path file = dir.resolve("store.txt");
        FileStorageController store = FileStorageController.open(file);
        store.save("k1", Arrays.asList(null, 8), ARGS);
        store.save("k2", "text", ARGS);

        assertEquals("k1|[null,8]" + EOL + "k2|\"text\"" + EOL, Files.readString(file, StandardCharsets.UTF_8));
        assertEquals(Arrays.asList(null, 8), store.retrieve("k1", ARGS));
    }

    @Test
    void testReloadRestoresRecords() {
        Path file = dir.resolve("store.txt");
        FileStorageController first = FileStorageController.open(file);
        first.save("a", 1, ARGS);
        first.save("b", Collections.singletonMap("x", "y"), ARGS);
        first.save("a", 2, ARGS);

        FileStorageController second = FileStorageController.open(file);
        assertEquals(2, second.retrieve("a", ARGS));
        assertEquals(Collections.singletonMap("x", "y"), second.retrieve("b", ARGS));
    }

    @Test
    void testInitSkipsLinesWithoutDelimiterAndTerminatesLastLine() throws IOException {
        Path file = dir.resolve("store.txt");
        Files.writeString(file, "garbage" + EOL + "k|42", StandardCharsets.UTF_8);

        FileStorageController store = FileStorageController.open(file);
        assertEquals(Collections.singletonMap("k", 42), store.contents());
        assertEquals("garbage" + EOL + "k|42" + EOL, Files.readString(file, StandardCharsets.UTF_8));

        store.save("j", true, ARGS);
        Map<Object, Object> reloaded = FileStorageController.open(file).contents();
        assertEquals(42, reloaded.get("k"));
        assertEquals(true, reloaded.get("j"));
    }

    @Test
    void testDeleteRewritesFileWithoutKey() throws IOException {
        Path file = dir.resolve("store.txt");
        FileStorageController store = FileStorageController.open(file);
        store.save("keep", 1, ARGS);
        store.save("drop", 2, ARGS);
        store.save("drop", 3, ARGS);

        assertEquals(3, store.delete("drop", ARGS));
        assertEquals("keep|1" + EOL, Files.readString(file, StandardCharsets.UTF_8));
        assertSame(NOT_CACHED, store.delete("drop", ARGS));
    }

    @Test
    void testEmptyTruncatesFile() throws IOException {
        Path file = dir.resolve("store.txt");
        FileStorageController store = FileStorageController.open(file);
        store.save("a", 1, ARGS);
        store.empty();

        assertEquals("", Files.readString(file, StandardCharsets.UTF_8));
        assertTrue(store.contents().isEmpty());
        assertTrue(FileStorageController.open(file).contents().isEmpty());
    }

    @Test
    void testUnserializableValueLeavesStoreUntouched() throws IOException {
        Path file = dir.resolve("store.txt");
        FileStorageController store = FileStorageController.open(file);
        assertThrows(UncheckedIOException.class, () -> store.save("k", new Object(), ARGS));
        assertSame(NOT_CACHED, store.retrieve("k", ARGS));
        assertFalse(Files.exists(file));
    }

    @Test
    void testReloadReadsValuesAsConfiguredType() {
        Path file = dir.resolve("store.txt");
        FileStorageController.open(file, Long.class).save("fib", 55L, ARGS);

        Object reloaded = FileStorageController.open(file, Long.class).retrieve("fib", ARGS);
        assertEquals(Long.class, reloaded.getClass());
        assertEquals(55L, reloaded);
        assertEquals(Integer.class, FileStorageController.open(file).retrieve("fib", ARGS).getClass());
    }

    @Test
    void testReloadReadsBeans() {
        Path file = dir.resolve("store.txt");
        FileStorageController.open(file, Quote.class).save("q", new Quote("ACME", 1250L), ARGS);

        Object reloaded = FileStorageController.open(file, Quote.class).retrieve("q", ARGS);
        assertTrue(reloaded instanceof Quote);
        assertEquals("ACME", ((Quote) reloaded).symbol);
        assertEquals(1250L, ((Quote) reloaded).price);
    }

    @Test
    void testReloadReadsGenericType() {
        Path file = dir.resolve("store.txt");
        FileStorageController.open(file).save("ids", Arrays.asList(1L, 2L), ARGS);

        FileStorageController typed = FileStorageController.open(file, new TypeReference<List<Long>>() { });
        assertEquals(Arrays.asList(1L, 2L), typed.retrieve("ids", ARGS));
    }

    @Test
    void testKeysWithDelimiterOrLineBreaksSurviveReload() throws IOException {
        Path file = dir.resolve("store.txt");
        FileStorageController store = FileStorageController.open(file);
        store.save("a", 1, ARGS);
        store.save("a|b", 2, ARGS);
        store.save("line\nbreak", 3, ARGS);
        store.save("100%", 4, ARGS);
        store.save("sep\u2028", 5, ARGS);

        assertTrue(Files.readString(file, StandardCharsets.UTF_8).startsWith("a|1" + EOL + "a%7Cb|2" + EOL));
        assertEquals(5, Files.readAllLines(file, StandardCharsets.UTF_8).size());

        Map<Object, Object> reloaded = FileStorageController.open(file).contents();
        assertEquals(1, reloaded.get("a"));
        assertEquals(2, reloaded.get("a|b"));
        assertEquals(3, reloaded.get("line\nbreak"));
        assertEquals(4, reloaded.get("100%"));
        assertEquals(5, reloaded.get("sep\u2028"));
    }

    @Test
    void testDeleteMatchesWholeKey() {
        Path file = dir.resolve("store.txt");
        FileStorageController store = FileStorageController.open(file);
        store.save("a", 1, ARGS);
        store.save("a|b", 2, ARGS);
        store.save("ab", 3, ARGS);

        store.delete("a", ARGS);
        Map<Object, Object> reloaded = FileStorageController.open(file).contents();
        assertFalse(reloaded.containsKey("a"));
        assertEquals(2, reloaded.get("a|b"));
        assertEquals(3, reloaded.get("ab"));
    }

    @Test
    void testKeyEncodingRoundTrips() {
        assertEquals("plain", StoreFile.encodeKey("plain"));
        assertEquals("a%7Cb%0Dc%0Ad%25", StoreFile.encodeKey("a|b\rc\nd%"));
        assertEquals("x%u2029", StoreFile.encodeKey("x\u2029"));
        assertEquals("a|b\rc\nd%", StoreFile.decodeKey("a%7Cb%0Dc%0Ad%25"));
        assertEquals("x\u2029", StoreFile.decodeKey("x%u2029"));
        assertEquals("50%off", StoreFile.decodeKey("50%off"));
    }

    static class Quote {
        public String symbol;
        public long price;

        Quote() {
        }

        Quote(String symbol, long price) {
            this.symbol = symbol;
            this.price = price;
        }
    }
}
