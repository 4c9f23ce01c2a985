package com.github.rudygunawan.memoizor.builder;

import com.github.rudygunawan.memoizor.api.ArgumentCoercer;
import com.github.rudygunawan.memoizor.model.KeyMode;
import com.github.rudygunawan.memoizor.model.MemoOptions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for option defaults, clamping and validation.
 */
class MemoizorBuilderTest {

    @Test
    void testDefaults() {
        MemoOptions options = MemoizorBuilder.newBuilder().buildOptions();
        assertEquals("anonymous", options.getName());
        assertEquals("MEMOIZOR:anonymous", options.getUid());
        assertFalse(options.hasTtl());
        assertFalse(options.hasMaxRecords());
        assertFalse(options.hasMaxArgs());
        assertFalse(options.hasCallbackIndex());
        assertEquals(10, options.getLruPercentPadding());
        assertEquals(2, options.getLruHistoryFactor());
        assertTrue(options.getIgnoreArgs().isEmpty());
        assertEquals(KeyMode.DEFAULT, options.getMode());
    }

    @Test
    void testUidFollowsNameUnlessSet() {
        assertEquals("MEMOIZOR:fib", MemoizorBuilder.newBuilder().name("fib").buildOptions().getUid());
        assertEquals("custom", MemoizorBuilder.newBuilder().name("fib").uid("custom").buildOptions().getUid());
    }

    @Test
    void testNumericOptionsAreClamped() {
        MemoOptions options = MemoizorBuilder.newBuilder()
                .ttl(1, TimeUnit.MILLISECONDS)
                .maxRecords(-5)
                .maxArgs(0)
                .lruPercentPadding(0)
                .lruHistoryFactor(-1)
                .buildOptions();

        assertEquals(TimeUnit.MILLISECONDS.toNanos(60), options.getTtlNanos());
        assertEquals(0, options.getMaxRecords());
        assertTrue(options.hasMaxRecords());
        assertEquals(1, options.getMaxArgs());
        assertEquals(1, options.getLruPercentPadding());
        assertEquals(1, options.getLruHistoryFactor());
    }

    @Test
    void testTtlFromDuration() {
        MemoOptions options = MemoizorBuilder.newBuilder().ttl(Duration.ofSeconds(2)).buildOptions();
        assertEquals(TimeUnit.SECONDS.toNanos(2), options.getTtlNanos());
        assertFalse(options.toBuilder().noTtl().buildOptions().hasTtl());
    }

    @Test
    void testInvalidValuesAreRejected() {
        MemoizorBuilder builder = MemoizorBuilder.newBuilder();
        assertThrows(IllegalArgumentException.class, () -> builder.ignoreArgs(1, -1));
        assertThrows(IllegalArgumentException.class, () -> builder.callbackIndex(-1));
        assertThrows(NullPointerException.class, () -> builder.uid(null));
        assertThrows(NullPointerException.class, () -> builder.name(null));
        assertThrows(NullPointerException.class, () -> builder.keyGenerator(null));
        assertThrows(NullPointerException.class, () -> builder.storageController(null));
        assertThrows(NullPointerException.class, () -> builder.coerceArgs((ArgumentCoercer) null));
        assertThrows(NullPointerException.class, () -> builder.mode(null));
        assertThrows(NullPointerException.class, () -> builder.build(null));
        assertThrows(NullPointerException.class, () -> builder.buildAsync(null));
        assertThrows(NullPointerException.class, () -> builder.buildCallback(null));
    }

    @Test
    void testToBuilderCopiesEverything() {
        ArgumentCoercer coercer = (arg, index) -> arg;
        MemoOptions original = MemoizorBuilder.newBuilder()
                .name("n")
                .uid("u")
                .ttl(5, TimeUnit.SECONDS)
                .maxRecords(50)
                .lruPercentPadding(20)
                .lruHistoryFactor(3)
                .maxArgs(4)
                .ignoreArgs(1, 2)
                .coerceArgs(null, coercer)
                .callbackIndex(1)
                .mode(KeyMode.PRIMITIVE)
                .buildOptions();

        MemoOptions copy = original.toBuilder().buildOptions();
        assertEquals("n", copy.getName());
        assertEquals("u", copy.getUid());
        assertEquals(original.getTtlNanos(), copy.getTtlNanos());
        assertEquals(50, copy.getMaxRecords());
        assertEquals(20, copy.getLruPercentPadding());
        assertEquals(3, copy.getLruHistoryFactor());
        assertEquals(4, copy.getMaxArgs());
        assertEquals(Arrays.asList(1, 2), copy.getIgnoreArgs());
        assertEquals(Arrays.asList(null, coercer), copy.getCoercers());
        assertEquals(1, copy.getCallbackIndex());
        assertEquals(KeyMode.PRIMITIVE, copy.getMode());
        assertFalse(copy.derivesKeysDifferentlyFrom(original));
    }

    @Test
    void testKeyAffectingChangesAreDetected() {
        MemoOptions base = MemoizorBuilder.newBuilder().buildOptions();
        assertTrue(base.toBuilder().uid("other").buildOptions().derivesKeysDifferentlyFrom(base));
        assertTrue(base.toBuilder().mode(KeyMode.PRIMITIVE).buildOptions().derivesKeysDifferentlyFrom(base));
        assertTrue(base.toBuilder().keyGenerator((uid, args) -> uid).buildOptions().derivesKeysDifferentlyFrom(base));
        assertFalse(base.toBuilder().maxRecords(1).ttl(1, TimeUnit.MINUTES).buildOptions()
                .derivesKeysDifferentlyFrom(base));
    }
}
