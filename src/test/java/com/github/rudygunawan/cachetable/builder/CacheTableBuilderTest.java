package com.github.rudygunawan.cachetable.builder;

import com.github.rudygunawan.cachetable.api.CacheTable;
import com.github.rudygunawan.cachetable.api.LoadedValue;
import com.github.rudygunawan.cachetable.time.FakeTicker;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class CacheTableBuilderTest {

    @Test
    void testDefaults() {
        CacheTableBuilder<Object, Object> builder = CacheTableBuilder.newBuilder();

        assertEquals(16, builder.getInitialCapacity());
        assertNull(builder.getScheduler());
        assertNull(builder.getExecutor());
        assertNull(builder.getLogger());
        assertNull(builder.getDataLoader());
        assertSame(ForkJoinPool.commonPool(), builder.buildExpirationTimer().getExecutor());
    }

    @Test
    void testInvalidSettings() {
        CacheTableBuilder<Object, Object> builder = CacheTableBuilder.newBuilder();

        assertThrows(IllegalArgumentException.class, () -> builder.initialCapacity(-1));
        assertThrows(NullPointerException.class, () -> builder.ticker(null));
        assertThrows(NullPointerException.class, () -> builder.scheduler(null));
        assertThrows(NullPointerException.class, () -> builder.executor(null));
        assertThrows(NullPointerException.class, () -> builder.logger(null));
        assertThrows(NullPointerException.class, () -> builder.dataLoader(null));
        assertThrows(NullPointerException.class, () -> builder.addedListener(null));
        assertThrows(NullPointerException.class, () -> builder.aboutToDeleteListener(null));
        assertThrows(NullPointerException.class, () -> builder.build(null));
    }

    @Test
    void testConfiguredCallbacksReachTable() throws Exception {
        List<String> events = new CopyOnWriteArrayList<>();
        CacheTable<String, String> table = CacheTableBuilder.newBuilder()
                .ticker(new FakeTicker())
                .<String, String>dataLoader((key, args) -> LoadedValue.immortal(key.toUpperCase()))
                .addedListener(entry -> events.add("added:" + entry.getKey()))
                .aboutToDeleteListener(entry -> events.add("deleting:" + entry.getKey()))
                .build("configured");

        assertEquals("ABC", table.value("abc").getValue());
        table.delete("abc");

        assertEquals(List.of("added:abc", "deleting:abc"), events);
    }

    @Test
    void testLoggerReceivesDiagnostics() throws Exception {
        List<String> lines = new CopyOnWriteArrayList<>();
        Logger logger = Logger.getAnonymousLogger();
        logger.setUseParentHandlers(false);
        logger.addHandler(new Handler() {
            @Override
            public void publish(LogRecord record) {
                assertEquals(Level.INFO, record.getLevel());
                lines.add(record.getMessage());
            }

            @Override
            public void flush() {
            }

            @Override
            public void close() {
            }
        });

        CacheTable<String, String> table = CacheTableBuilder.newBuilder()
                .ticker(new FakeTicker())
                .logger(logger)
                .build("logged");
        table.add("key", 0, TimeUnit.SECONDS, "value");
        table.delete("key");
        table.flush();

        assertEquals(3, lines.size());
        assertTrue(lines.get(0).startsWith("Adding item with key key"));
        assertTrue(lines.get(0).endsWith("to table logged"));
        assertTrue(lines.get(1).startsWith("Deleting item with key key"));
        assertTrue(lines.get(2).startsWith("Flushing table"));

        table.setLogger(null);
        table.add("quiet", "value");
        assertEquals(3, lines.size());
    }
}
