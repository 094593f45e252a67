package com.github.rudygunawan.cachetable.metrics;

import com.github.rudygunawan.cachetable.api.LoadedValue;
import com.github.rudygunawan.cachetable.builder.CacheTableBuilder;
import com.github.rudygunawan.cachetable.exception.KeyNotFoundException;
import com.github.rudygunawan.cachetable.exception.KeyNotFoundOrLoadableException;
import com.github.rudygunawan.cachetable.impl.ConcurrentCacheTable;
import com.github.rudygunawan.cachetable.time.FakeTicker;

import io.micrometer.core.instrument.*;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for Micrometer metrics integration.
 */
class MicrometerMetricsTest {

    private final FakeTicker ticker = new FakeTicker();

    private ConcurrentCacheTable<String, String> newTable(String name) {
        return new ConcurrentCacheTable<>(name, CacheTableBuilder.newBuilder().ticker(ticker));
    }

    @Test
    void testBasicMetricsExposed() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MicrometerCacheTableMetrics.monitor(registry, newTable("testTable"));

        assertNotNull(registry.find("cache.size").tag("cache", "testTable").gauge());
        assertNotNull(registry.find("cache.hits").functionCounter());
        assertNotNull(registry.find("cache.misses").functionCounter());
        assertNotNull(registry.find("cache.loads").tag("result", "success").functionCounter());
        assertNotNull(registry.find("cache.loads").tag("result", "failure").functionCounter());
        assertNotNull(registry.find("cache.load.duration").functionTimer());
        assertNotNull(registry.find("cache.expirations").functionCounter());
        assertNotNull(registry.find("cache.deletions").functionCounter());
        assertNotNull(registry.find("cache.hit.ratio").gauge());
        assertNotNull(registry.find("cache.expiration.interval").gauge());
    }

    @Test
    void testSizeAndHitMetrics() throws Exception {
        MeterRegistry registry = new SimpleMeterRegistry();
        ConcurrentCacheTable<String, String> table =
                MicrometerCacheTableMetrics.monitor(registry, newTable("hits"));

        Gauge size = registry.find("cache.size").gauge();
        assertEquals(0.0, size.value(), 0.01);

        table.add("key1", "value1");
        table.add("key2", "value2");
        assertEquals(2.0, size.value(), 0.01);

        table.value("key1");
        table.value("key1");
        table.value("key2");
        assertThrows(KeyNotFoundException.class, () -> table.value("missing"));

        assertEquals(3.0, registry.find("cache.hits").functionCounter().count(), 0.01);
        assertEquals(1.0, registry.find("cache.misses").functionCounter().count(), 0.01);
        assertEquals(0.75, registry.find("cache.hit.ratio").gauge().value(), 0.01);
    }

    @Test
    void testHitRatioMatchesStatsBeforeAnyLookup() {
        MeterRegistry registry = new SimpleMeterRegistry();
        ConcurrentCacheTable<String, String> table =
                MicrometerCacheTableMetrics.monitor(registry, newTable("unread"));

        double gauge = registry.find("cache.hit.ratio").gauge().value();
        assertEquals(0.0, gauge, 0.0001);
        assertEquals(table.stats().hitRate(), gauge, 0.0001);
    }

    @Test
    void testLoadMetrics() throws Exception {
        MeterRegistry registry = new SimpleMeterRegistry();
        ConcurrentCacheTable<String, String> table =
                MicrometerCacheTableMetrics.monitor(registry, newTable("loads"));
        table.setDataLoader((key, args) -> key.startsWith("ok") ? LoadedValue.immortal("v") : null);

        table.value("ok1");
        table.value("ok2");
        assertThrows(KeyNotFoundOrLoadableException.class, () -> table.value("bad"));

        assertEquals(3.0, registry.find("cache.loads").tag("result", "all").functionCounter().count(), 0.01);
        assertEquals(2.0, registry.find("cache.loads").tag("result", "success").functionCounter().count(), 0.01);
        assertEquals(1.0, registry.find("cache.loads").tag("result", "failure").functionCounter().count(), 0.01);
        assertEquals(3.0, registry.find("cache.load.duration").functionTimer().count(), 0.01);
    }

    @Test
    void testExpirationAndDeletionMetrics() throws Exception {
        MeterRegistry registry = new SimpleMeterRegistry();
        ConcurrentCacheTable<String, String> table =
                MicrometerCacheTableMetrics.monitor(registry, newTable("expiry"));

        table.add("short", 1, TimeUnit.MINUTES, "v");
        table.add("long", 3, TimeUnit.MINUTES, "v");
        table.add("manual", "v");
        assertEquals(60.0, registry.find("cache.expiration.interval").gauge().value(), 0.01);

        table.delete("manual");
        ticker.advance(1, TimeUnit.MINUTES);
        table.cleanUp();

        assertEquals(1.0, registry.find("cache.expirations").functionCounter().count(), 0.01);
        assertEquals(2.0, registry.find("cache.deletions").functionCounter().count(), 0.01);
        assertEquals(120.0, registry.find("cache.expiration.interval").gauge().value(), 0.01);

        table.flush();
        assertEquals(0.0, registry.find("cache.expiration.interval").gauge().value(), 0.01);
    }

    @Test
    void testCustomTags() {
        MeterRegistry registry = new SimpleMeterRegistry();
        MicrometerCacheTableMetrics.monitor(registry, newTable("tagged"), Tags.of("env", "test"));

        Gauge size = registry.find("cache.size").tags("cache", "tagged", "env", "test").gauge();
        assertNotNull(size);
    }

    @Test
    void testMultipleTablesAreTaggedSeparately() {
        MeterRegistry registry = new SimpleMeterRegistry();
        ConcurrentCacheTable<String, String> first = MicrometerCacheTableMetrics.monitor(registry, newTable("first"));
        MicrometerCacheTableMetrics.monitor(registry, newTable("second"));

        first.add("key", "value");

        assertEquals(1.0, registry.find("cache.size").tag("cache", "first").gauge().value(), 0.01);
        assertEquals(0.0, registry.find("cache.size").tag("cache", "second").gauge().value(), 0.01);
    }
}
