package com.imperium.lexi.service.impl;

import com.imperium.lexi.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class CacheServiceImplTest {

    private MutableClock clock;
    private CacheServiceImpl cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        cache = new CacheServiceImpl(clock, 100);
    }

    @Test
    void returnsValueBeforeExpiryAndNothingAfter() {
        cache.set("k", "v", 60);
        clock.advance(Duration.ofSeconds(30));
        assertEquals("v", cache.get("k").orElse(null));

        clock.advance(Duration.ofSeconds(31));
        assertTrue(cache.get("k").isEmpty());
        assertEquals(0, cache.size());
    }

    @Test
    void overwriteResetsValueAndTtl() {
        cache.set("k", "v1", 10);
        clock.advance(Duration.ofSeconds(8));
        cache.set("k", "v2", 10);
        clock.advance(Duration.ofSeconds(8));
        assertEquals("v2", cache.get("k").orElse(null));
    }

    @Test
    void rejectsNonPositiveTtlAndNullValues() {
        cache.set("zero", "v", 0);
        cache.set("negative", "v", -5);
        cache.set("null", null, 60);
        cache.set(null, "v", 60);
        assertEquals(0, cache.size());
    }

    @Test
    void typedGetReturnsEmptyOnMismatch() {
        cache.set("k", 42, 60);
        assertTrue(cache.get("k", String.class).isEmpty());
        assertEquals(42, cache.get("k", Integer.class).orElse(null));
    }

    @Test
    void invalidateRemovesOnlyMatchingPrefix() {
        cache.set("ai_response:1", "a", 60);
        cache.set("ai_response:2", "b", 60);
        cache.set("ai_provider:c1", "google", 60);

        assertEquals(2, cache.invalidate("ai_response:*"));
        assertTrue(cache.get("ai_response:1").isEmpty());
        assertEquals("google", cache.get("ai_provider:c1").orElse(null));
    }

    @Test
    void invalidatePatternIsAnchoredToWholeKey() {
        cache.set("ai_response:1", "a", 60);
        assertEquals(0, cache.invalidate("response*"));
        assertEquals(1, cache.invalidate("*response*"));
    }

    @Test
    void invalidateTreatsRegexCharactersLiterally() {
        cache.set("a.b", "x", 60);
        cache.set("axb", "y", 60);
        assertEquals(1, cache.invalidate("a.*"));
        assertEquals("y", cache.get("axb").orElse(null));
    }

    @Test
    void starClearsEverything() {
        cache.set("a", 1, 60);
        cache.set("b", 2, 60);
        assertEquals(2, cache.invalidate("*"));
        assertEquals(0, cache.size());
    }

    @Test
    void deleteRemovesSingleKey() {
        cache.set("a", 1, 60);
        assertTrue(cache.delete("a"));
        assertFalse(cache.delete("a"));
    }

    @Test
    void sweepRemovesOnlyExpiredEntries() {
        cache.set("short", 1, 10);
        cache.set("long", 2, 100);
        clock.advance(Duration.ofSeconds(11));

        assertEquals(1, cache.sweepExpired());
        assertEquals(1, cache.size());
        assertTrue(cache.get("long").isPresent());
    }

    @Test
    void staysWithinCapacity() {
        CacheServiceImpl bounded = new CacheServiceImpl(clock, 3);
        bounded.set("a", 1, 60);
        bounded.set("b", 2, 60);
        bounded.set("c", 3, 60);
        bounded.get("a");

        bounded.set("d", 4, 60);

        assertEquals(3, bounded.size());
    }

    @Test
    void writesAtCapacityStayCheap() {
        CacheServiceImpl bounded = new CacheServiceImpl(clock, 10_000);
        for (int i = 0; i < 10_000; i++) {
            bounded.set("warm-" + i, i, 600);
        }

        assertTimeout(Duration.ofSeconds(2), () -> {
            for (int i = 0; i < 2_000; i++) {
                bounded.set("extra-" + i, i, 600);
            }
        });
        assertEquals(10_000, bounded.size());
    }

    @Test
    void purgesExpiredEntriesBeforeEvictingLiveOnes() {
        CacheServiceImpl bounded = new CacheServiceImpl(clock, 2);
        bounded.set("x", 1, 10);
        bounded.set("y", 2, 100);
        clock.advance(Duration.ofSeconds(20));

        bounded.set("z", 3, 100);

        assertEquals(2, bounded.size());
        assertTrue(bounded.get("y").isPresent());
        assertTrue(bounded.get("z").isPresent());
    }

    @Test
    void concurrentWritersLeaveConsistentStore() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                int offset = t;
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 50; i++) {
                        cache.set("key-" + (i % 20), offset, 60);
                        cache.get("key-" + i);
                    }
                }));
            }
            for (Future<?> f : futures) {
                f.get();
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(20, cache.size());
    }
}
