package com.github.rudygunawan.cachetable.impl;

import com.github.rudygunawan.cachetable.api.CacheTable;
import com.github.rudygunawan.cachetable.builder.CacheTableBuilder;
import com.github.rudygunawan.cachetable.model.CacheEntry;
import com.github.rudygunawan.cachetable.time.FakeTicker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class MostAccessedTest {

    private ConcurrentCacheTable<String, String> table;

    @BeforeEach
    void setUp() throws Exception {
        table = new ConcurrentCacheTable<>("ranking", CacheTableBuilder.newBuilder().ticker(new FakeTicker()));
        table.add("once", "1");
        table.add("thrice", "3");
        table.add("never", "0");
        table.add("twice", "2");

        table.value("once");
        for (int i = 0; i < 3; i++) {
            table.value("thrice");
        }
        table.value("twice");
        table.value("twice");
    }

    @Test
    void testOrderedByAccessCount() {
        List<String> keys = keys(table.mostAccessed(3));

        assertEquals(List.of("thrice", "twice", "once"), keys);
    }

    @Test
    void testCountAboveSizeReturnsEverything() {
        List<CacheEntry<String, String>> entries = table.mostAccessed(100);

        assertEquals(4, entries.size());
        assertEquals(List.of("thrice", "twice", "once", "never"), keys(entries));
    }

    @Test
    void testNonPositiveCountReturnsEmpty() {
        assertTrue(table.mostAccessed(0).isEmpty());
        assertTrue(table.mostAccessed(-1).isEmpty());
    }

    @Test
    void testEmptyTable() {
        CacheTable<String, String> empty = CacheTableBuilder.newBuilder().build("empty");

        assertTrue(empty.mostAccessed(5).isEmpty());
    }

    @Test
    void testExistsDoesNotAffectRanking() {
        for (int i = 0; i < 10; i++) {
            table.exists("never");
        }

        assertEquals(List.of("thrice"), keys(table.mostAccessed(1)));
    }

    @Test
    void testKeyDeletedAfterRankingUsesUpItsSlot() throws Exception {
        List<String> ranked = keys(table.mostAccessed(4));
        table.delete("twice");

        List<CacheEntry<String, String>> entries = table.lookUpRanked(ranked, 2);

        assertEquals(List.of("thrice"), keys(entries));
        assertEquals(List.of("thrice", "once"), keys(table.lookUpRanked(ranked, 3)));
    }

    private static List<String> keys(List<CacheEntry<String, String>> entries) {
        return entries.stream().map(CacheEntry::getKey).collect(Collectors.toList());
    }
}
