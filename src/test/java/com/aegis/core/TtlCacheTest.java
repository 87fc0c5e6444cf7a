package com.aegis.core;

import com.aegis.testing.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TtlCacheTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-19T00:00:00Z"), ZoneOffset.UTC);

    @Test
    void getOrRefreshShouldServeCachedValueWithinTtl() {
        TtlCache<String> cache = new TtlCache<>(Duration.ofSeconds(60), clock);
        AtomicInteger loads = new AtomicInteger();

        assertEquals("v1", cache.getOrRefresh(() -> "v" + loads.incrementAndGet(), false));
        clock.advance(Duration.ofSeconds(59));
        assertEquals("v1", cache.getOrRefresh(() -> "v" + loads.incrementAndGet(), false));
        clock.advance(Duration.ofSeconds(1));
        assertEquals("v2", cache.getOrRefresh(() -> "v" + loads.incrementAndGet(), false));
        assertEquals(2, loads.get());
    }

    @Test
    void forceShouldBypassFreshEntry() {
        TtlCache<Integer> cache = new TtlCache<>(Duration.ofMinutes(10), clock);
        cache.getOrRefresh(() -> 1, false);

        assertEquals(2, cache.getOrRefresh(() -> 2, true));
        assertEquals(2, cache.getOrRefresh(() -> 3, false));
    }

    @Test
    void nullOrThrowingLoaderShouldLeavePreviousStateUntouched() {
        TtlCache<String> cache = new TtlCache<>(Duration.ofSeconds(10), clock);
        cache.getOrRefresh(() -> "ok", false);

        assertNull(cache.getOrRefresh(() -> null, true));
        assertThrows(IllegalStateException.class, () -> cache.getOrRefresh(() -> {
            throw new IllegalStateException("boom");
        }, true));

        assertEquals("ok", cache.getOrRefresh(() -> "other", false));
    }

    @Test
    void entryShouldReloadAfterExpiryOrClear() {
        TtlCache<String> cache = new TtlCache<>(Duration.ofSeconds(5), clock);
        cache.getOrRefresh(() -> "x", false);
        clock.advance(Duration.ofSeconds(5));
        assertEquals("y", cache.getOrRefresh(() -> "y", false));

        cache.clear();
        assertEquals("z", cache.getOrRefresh(() -> "z", false));
    }

    @Test
    void concurrentCallersShouldShareOneLoad() throws Exception {
        TtlCache<String> cache = new TtlCache<>(Duration.ofMinutes(1), clock);
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            Future<?>[] futures = new Future<?>[8];
            for (int i = 0; i < futures.length; i++) {
                futures[i] = pool.submit(() -> {
                    start.await();
                    return cache.getOrRefresh(() -> {
                        loads.incrementAndGet();
                        sleepQuietly();
                        return "shared";
                    }, false);
                });
            }
            start.countDown();
            for (Future<?> f : futures) {
                assertEquals("shared", f.get(5, TimeUnit.SECONDS));
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, loads.get());
    }

    @Test
    void cacheMapShouldRefreshKeysIndependently() {
        TtlCacheMap<String, String> map = new TtlCacheMap<>(Duration.ofSeconds(60), clock);
        AtomicInteger loads = new AtomicInteger();

        map.getOrRefresh("NQ", () -> "nq" + loads.incrementAndGet(), false);
        map.getOrRefresh("ES", () -> "es" + loads.incrementAndGet(), false);
        assertEquals("nq1", map.getOrRefresh("NQ", () -> "nq" + loads.incrementAndGet(), false));
        assertEquals(2, map.size());
        assertEquals(2, loads.get());

        map.clear();
        assertEquals(0, map.size());
    }

    private static void sleepQuietly() {
        try {
            Thread.sleep(50);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
