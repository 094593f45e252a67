package com.github.rudygunawan.cachetable.model;

import com.github.rudygunawan.cachetable.time.FakeTicker;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class CacheEntryTest {

    @Test
    void testNewEntryMetadata() {
        FakeTicker ticker = new FakeTicker().advance(5, TimeUnit.SECONDS);

        CacheEntry<String, String> entry =
                new CacheEntry<>("key", TimeUnit.SECONDS.toNanos(30), "value", ticker);

        assertEquals("key", entry.getKey());
        assertEquals("value", entry.getValue());
        assertEquals(30, entry.getLifespan(TimeUnit.SECONDS));
        assertEquals(TimeUnit.SECONDS.toNanos(5), entry.getCreatedOn());
        assertEquals(entry.getCreatedOn(), entry.getAccessedOn());
        assertEquals(0, entry.getAccessCount());
    }

    @Test
    void testKeepAliveUpdatesAccessTimeAndCount() {
        FakeTicker ticker = new FakeTicker();
        CacheEntry<String, String> entry = new CacheEntry<>("key", 0, "value", ticker);

        ticker.advance(2, TimeUnit.SECONDS);
        entry.keepAlive();
        ticker.advance(3, TimeUnit.SECONDS);
        entry.keepAlive();

        assertEquals(2, entry.getAccessCount());
        assertEquals(TimeUnit.SECONDS.toNanos(5), entry.getAccessedOn());
        assertEquals(0, entry.getCreatedOn());
        assertTrue(entry.getAccessedOn() >= entry.getCreatedOn());
    }

    @Test
    void testExpiredAtUsesIdleTime() {
        FakeTicker ticker = new FakeTicker();
        CacheEntry<String, String> entry =
                new CacheEntry<>("key", TimeUnit.SECONDS.toNanos(10), "value", ticker);

        ticker.advance(8, TimeUnit.SECONDS);
        assertFalse(entry.isExpiredAt(ticker.read()));

        entry.keepAlive();
        ticker.advance(8, TimeUnit.SECONDS);
        assertFalse(entry.isExpiredAt(ticker.read()), "keep-alive resets the idle clock");

        ticker.advance(2, TimeUnit.SECONDS);
        assertTrue(entry.isExpiredAt(ticker.read()));
    }

    @Test
    void testImmortalEntryNeverExpires() {
        FakeTicker ticker = new FakeTicker();
        CacheEntry<String, String> entry = new CacheEntry<>("key", 0, "value", ticker);

        ticker.advance(365, TimeUnit.DAYS);

        assertFalse(entry.isExpiredAt(ticker.read()));
    }

    @Test
    void testExpiryCallbackReplacedAndCleared() {
        CacheEntry<String, String> entry = new CacheEntry<>("key", 0, "value", new FakeTicker());
        List<String> calls = new ArrayList<>();

        entry.fireExpiryCallback();
        assertTrue(calls.isEmpty());

        entry.setExpiryCallback(k -> calls.add("first:" + k));
        entry.setExpiryCallback(k -> calls.add("second:" + k));
        entry.fireExpiryCallback();
        assertEquals(List.of("second:key"), calls);

        entry.setExpiryCallback(null);
        entry.fireExpiryCallback();
        assertEquals(1, calls.size());
    }

    @Test
    void testInvalidArguments() {
        FakeTicker ticker = new FakeTicker();
        assertThrows(IllegalArgumentException.class, () -> new CacheEntry<>("key", -1, "value", ticker));
        assertThrows(NullPointerException.class, () -> new CacheEntry<String, String>(null, 0, "value", ticker));
        assertThrows(NullPointerException.class, () -> new CacheEntry<String, String>("key", 0, null, ticker));
    }

    @Test
    void testConcurrentKeepAliveCountsEveryAccess() throws Exception {
        CacheEntry<String, String> entry = new CacheEntry<>("key", 0, "value", new FakeTicker());
        Thread[] threads = new Thread[8];
        for (int i = 0; i < threads.length; i++) {
            threads[i] = new Thread(() -> {
                for (int j = 0; j < 1000; j++) {
                    entry.keepAlive();
                }
            });
            threads[i].start();
        }
        for (Thread thread : threads) {
            thread.join();
        }

        assertEquals(8000, entry.getAccessCount());
    }
}
