package com.github.rudygunawan.cachetable.metrics;

import com.github.rudygunawan.cachetable.api.CacheTable;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.util.Collections;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer integration for cache table metrics.
 * Binds table statistics to a MeterRegistry for monitoring and observability.
 *
 * <p>Exposes the following metrics, all tagged with {@code cache=<name>}:
 * <ul>
 *   <li>cache.size - Current number of entries
 *   <li>cache.hits - Lookups that found an entry
 *   <li>cache.misses - Lookups that found no entry
 *   <li>cache.loads - Data loader calls, tagged result=all|success|failure
 *   <li>cache.load.duration - Time spent in the data loader
 *   <li>cache.expirations - Entries removed by the expiration scan
 *   <li>cache.deletions - Entries removed through delete, expirations included
 *   <li>cache.hit.ratio - Hit rate (0.0 to 1.0), 0.0 before the first lookup like {@code CacheStats.hitRate()}
 *   <li>cache.expiration.interval - Delay the next expiration scan is armed with, in seconds
 * </ul>
 *
 * <p>Usage example:
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * ConcurrentCacheTable<String, User> table = ...;
 *
 * MicrometerCacheTableMetrics.monitor(registry, table);
 * }</pre>
 */
public class MicrometerCacheTableMetrics implements MeterBinder {

    private final CacheTableMetrics table;
    private final String tableName;
    private final Iterable<Tag> tags;

    /**
     * Creates a new MicrometerCacheTableMetrics instance.
     *
     * @param table the table to monitor
     * @param tableName the name used for the {@code cache} tag
     * @param tags additional tags to apply to all metrics
     */
    public MicrometerCacheTableMetrics(CacheTableMetrics table, String tableName, Iterable<Tag> tags) {
        this.table = table;
        this.tableName = tableName;
        this.tags = tags;
    }

    /**
     * Monitors a table under its own name.
     *
     * @param registry the meter registry
     * @param table the table to monitor
     * @param <C> the table type
     * @return the table (for chaining)
     */
    public static <C extends CacheTable<?, ?> & CacheTableMetrics> C monitor(MeterRegistry registry, C table) {
        return monitor(registry, table, Collections.emptyList());
    }

    /**
     * Monitors a table under its own name with additional tags.
     *
     * @param registry the meter registry
     * @param table the table to monitor
     * @param tags additional tags
     * @param <C> the table type
     * @return the table (for chaining)
     */
    public static <C extends CacheTable<?, ?> & CacheTableMetrics> C monitor(
            MeterRegistry registry, C table, Iterable<Tag> tags) {
        new MicrometerCacheTableMetrics(table, table.getName(), tags).bindTo(registry);
        return table;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        Tags allTags = Tags.of("cache", tableName).and(tags);

        Gauge.builder("cache.size", table, CacheTableMetrics::size)
                .tags(allTags)
                .description("Current number of entries in the table")
                .register(registry);

        FunctionCounter.builder("cache.hits", table, CacheTableMetrics::hitCount)
                .tags(allTags)
                .description("Number of lookups that found an entry")
                .register(registry);

        FunctionCounter.builder("cache.misses", table, CacheTableMetrics::missCount)
                .tags(allTags)
                .description("Number of lookups that found no entry")
                .register(registry);

        FunctionCounter.builder("cache.loads", table, t -> t.loadSuccessCount() + t.loadFailureCount())
                .tags(allTags.and("result", "all"))
                .description("Total number of data loader calls")
                .register(registry);

        FunctionCounter.builder("cache.loads", table, CacheTableMetrics::loadSuccessCount)
                .tags(allTags.and("result", "success"))
                .description("Number of data loader calls that produced a value")
                .register(registry);

        FunctionCounter.builder("cache.loads", table, CacheTableMetrics::loadFailureCount)
                .tags(allTags.and("result", "failure"))
                .description("Number of data loader calls that produced no value")
                .register(registry);

        FunctionTimer.builder("cache.load.duration", table,
                        t -> t.loadSuccessCount() + t.loadFailureCount(),
                        CacheTableMetrics::totalLoadTimeNanos,
                        TimeUnit.NANOSECONDS)
                .tags(allTags)
                .description("Time spent in the data loader")
                .register(registry);

        FunctionCounter.builder("cache.expirations", table, CacheTableMetrics::expirationCount)
                .tags(allTags)
                .description("Number of entries removed by the expiration scan")
                .register(registry);

        FunctionCounter.builder("cache.deletions", table, CacheTableMetrics::deleteCount)
                .tags(allTags)
                .description("Number of entries removed through delete, expirations included")
                .register(registry);

        // Hit ratio (derived metric); 0.0 before the first lookup
        Gauge.builder("cache.hit.ratio", table, t -> {
                    long hits = t.hitCount();
                    long misses = t.missCount();
                    long total = hits + misses;
                    return total == 0 ? 0.0 : (double) hits / total;
                })
                .tags(allTags)
                .description("Table hit ratio (0.0 to 1.0)")
                .register(registry);

        Gauge.builder("cache.expiration.interval", table,
                        t -> t.cleanupIntervalNanos() / (double) TimeUnit.SECONDS.toNanos(1))
                .tags(allTags)
                .baseUnit("seconds")
                .description("Delay the next expiration scan is armed with, 0 when idle")
                .register(registry);
    }
}
