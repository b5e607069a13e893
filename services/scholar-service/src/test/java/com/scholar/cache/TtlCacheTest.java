package com.scholar.cache;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TtlCacheTest {

    @Test
    void hitWithinTtlAndReloadAfterExpiry() {
        MutableClock clock = new MutableClock(1_000L);
        TtlCache<String> cache = new TtlCache<>(10, clock);
        AtomicInteger loads = new AtomicInteger();

        assertEquals(TtlCache.Source.LOADED, cache.getOrLoad("k", 100, () -> "v" + loads.incrementAndGet()).source());
        clock.advance(99);
        TtlCache.Lookup<String> hit = cache.getOrLoad("k", 100, () -> "v" + loads.incrementAndGet());
        assertEquals(TtlCache.Source.HIT, hit.source());
        assertEquals("v1", hit.value());

        clock.advance(1);
        TtlCache.Lookup<String> expired = cache.getOrLoad("k", 100, () -> "v" + loads.incrementAndGet());
        assertEquals(TtlCache.Source.LOADED, expired.source());
        assertEquals("v2", expired.value());
    }

    @Test
    void evictsLeastRecentlyUsed() {
        TtlCache<String> cache = new TtlCache<>(2, new MutableClock(0L));
        cache.getOrLoad("a", 1_000, () -> "A");
        cache.getOrLoad("b", 1_000, () -> "B");
        cache.getOrLoad("a", 1_000, () -> "A2");
        cache.getOrLoad("c", 1_000, () -> "C");

        assertEquals(2, cache.size());
        assertEquals(TtlCache.Source.HIT, cache.getOrLoad("a", 1_000, () -> "x").source());
        assertEquals(TtlCache.Source.LOADED, cache.getOrLoad("b", 1_000, () -> "x").source());
    }

    @Test
    void zeroTtlNeverStores() {
        TtlCache<String> cache = new TtlCache<>(4, new MutableClock(0L));
        cache.getOrLoad("k", 0, () -> "v");

        assertEquals(0, cache.size());
    }

    @Test
    void failedLoadIsNotCached() {
        TtlCache<String> cache = new TtlCache<>(4, new MutableClock(0L));

        assertThrows(IllegalStateException.class, () -> cache.getOrLoad("k", 1_000, () -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals(0, cache.inFlightCount());
        assertEquals("ok", cache.getOrLoad("k", 1_000, () -> "ok").value());
    }

    @Test
    void concurrentMissesShareOneLoad() throws Exception {
        TtlCache<String> cache = new TtlCache<>(4);
        int callers = 8;
        AtomicInteger loads = new AtomicInteger();
        CountDownLatch loaderEntered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        try {
            Future<TtlCache.Lookup<String>> leader = pool.submit(() -> cache.getOrLoad("k", 60_000, () -> {
                loads.incrementAndGet();
                loaderEntered.countDown();
                await(release);
                return "shared";
            }));
            assertTrue(loaderEntered.await(5, TimeUnit.SECONDS));

            List<Future<TtlCache.Lookup<String>>> followers = new ArrayList<>();
            for (int i = 1; i < callers; i++) {
                followers.add(pool.submit(() -> cache.getOrLoad("k", 60_000, () -> {
                    loads.incrementAndGet();
                    return "duplicate";
                })));
            }
            waitForFollowersToQueue();
            release.countDown();

            assertEquals(TtlCache.Source.LOADED, leader.get(5, TimeUnit.SECONDS).source());
            for (Future<TtlCache.Lookup<String>> follower : followers) {
                TtlCache.Lookup<String> lookup = follower.get(5, TimeUnit.SECONDS);
                assertEquals("shared", lookup.value());
                assertTrue(lookup.fromCache());
            }
            assertEquals(1, loads.get());
            assertEquals(0, cache.inFlightCount());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void waitersSeeTheLeadersFailure() throws Exception {
        TtlCache<String> cache = new TtlCache<>(4);
        IllegalStateException failure = new IllegalStateException("index unavailable");
        CountDownLatch loaderEntered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger followerLoads = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<?> leader = pool.submit(() -> cache.getOrLoad("k", 60_000, () -> {
                loaderEntered.countDown();
                await(release);
                throw failure;
            }));
            assertTrue(loaderEntered.await(5, TimeUnit.SECONDS));
            Future<Throwable> follower = pool.submit(() -> {
                try {
                    cache.getOrLoad("k", 60_000, () -> {
                        followerLoads.incrementAndGet();
                        throw new IllegalArgumentException("follower ran its own loader");
                    });
                    return null;
                } catch (RuntimeException e) {
                    return e;
                }
            });
            waitForFollowersToQueue();
            release.countDown();

            assertThrows(Exception.class, () -> leader.get(5, TimeUnit.SECONDS));
            Throwable seen = follower.get(5, TimeUnit.SECONDS);
            assertSame(failure, seen);
            assertEquals(0, followerLoads.get());
            assertEquals(0, cache.size());
        } finally {
            pool.shutdownNow();
        }
    }

    private static void waitForFollowersToQueue() throws InterruptedException {
        Thread.sleep(100);
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }
}
