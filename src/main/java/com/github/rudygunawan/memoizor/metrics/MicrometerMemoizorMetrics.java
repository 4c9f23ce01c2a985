package com.github.rudygunawan.memoizor.metrics;

import com.github.rudygunawan.memoizor.api.MemoizedControl;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;

/**
 * Micrometer integration for memoized functions.
 *
 * <p>Exposes the following metrics, tagged with {@code memoizor=<name>}:
 * <ul>
 *   <li>memoizor.records - Records counted toward maxRecords
 *   <li>memoizor.hits - Total number of cache hits
 *   <li>memoizor.misses - Total number of cache misses
 *   <li>memoizor.saves - Total number of saved results
 *   <li>memoizor.evictions - Total number of overflow evictions
 *   <li>memoizor.expirations - Total number of TTL expirations
 *   <li>memoizor.hit.ratio - Hit ratio (0.0 to 1.0)
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * MemoizedFunction<User> loadUser = Memoizor.newBuilder()
 *     .name("loadUser")
 *     .maxRecords(1000)
 *     .build(inv -> repository.find(inv.<Long>arg(0)));
 *
 * MicrometerMemoizorMetrics.monitor(registry, loadUser);
 * }</pre>
 */
public class MicrometerMemoizorMetrics implements MeterBinder {

    private final MemoizorMetrics metrics;
    private final String name;
    private final Iterable<Tag> tags;

    /**
     * @param metrics the counters to expose
     * @param name the value of the {@code memoizor} tag
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerMemoizorMetrics(MemoizorMetrics metrics, String name, Iterable<Tag> tags) {
        this.metrics = metrics;
        this.name = name;
        this.tags = tags;
    }

    /**
     * Binds the metrics of {@code function} to {@code registry}, tagged with its configured name.
     *
     * @return the function (for chaining)
     */
    public static <F extends MemoizedControl> F monitor(MeterRegistry registry, F function) {
        return monitor(registry, function, Collections.emptyList());
    }

    /**
     * Binds the metrics of {@code function} to {@code registry} with additional tags.
     *
     * @return the function (for chaining)
     */
    public static <F extends MemoizedControl> F monitor(MeterRegistry registry, F function, Iterable<Tag> tags) {
        MemoizorMetrics metrics = function.metrics();
        new MicrometerMemoizorMetrics(metrics, metrics.name(), tags).bindTo(registry);
        return function;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("memoizor", name).and(tags);

        Gauge.builder("memoizor.records", metrics, MemoizorMetrics::recordCount)
                .tags(allTags)
                .description("Records counted toward the record limit")
                .register(registry);

        FunctionCounter.builder("memoizor.hits", metrics, MemoizorMetrics::hitCount)
                .tags(allTags)
                .description("Total number of cache hits")
                .register(registry);

        FunctionCounter.builder("memoizor.misses", metrics, MemoizorMetrics::missCount)
                .tags(allTags)
                .description("Total number of cache misses")
                .register(registry);

        FunctionCounter.builder("memoizor.saves", metrics, MemoizorMetrics::saveCount)
                .tags(allTags)
                .description("Total number of saved results")
                .register(registry);

        FunctionCounter.builder("memoizor.evictions", metrics, MemoizorMetrics::evictionCount)
                .tags(allTags)
                .description("Total number of records removed by overflow eviction")
                .register(registry);

        FunctionCounter.builder("memoizor.expirations", metrics, MemoizorMetrics::expirationCount)
                .tags(allTags)
                .description("Total number of records removed after their TTL elapsed")
                .register(registry);

        Gauge.builder("memoizor.hit.ratio", metrics, MemoizorMetrics::hitRatio)
                .tags(allTags)
                .description("Cache hit ratio (0.0 to 1.0)")
                .register(registry);
    }
}
