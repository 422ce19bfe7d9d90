package ac.core.cache;

import ac.core.clock.ManualClock;
import ac.core.clock.SystemClock;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Functional tests for LruCache.
 *
 * Focus:
 * - Hit/miss and lazy TTL expiry
 * - Strict LRU eviction order
 * - Negative entries and positive/negative transitions
 * - getOrLoad, stats, eviction callback
 */
class LruCacheTest {

    // ========== HIT / MISS / TTL ==========

    @Test
    void testHit_whenSetThenGet() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(10, 1_000));

        cache.set("a", 1);
        CacheLookup<Integer> lookup = cache.get("a");

        assertTrue(lookup.hit());
        assertFalse(lookup.negative());
        assertEquals(1, lookup.value());
    }

    @Test
    void testMiss_whenAbsent() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(10, 1_000));

        CacheLookup<Integer> lookup = cache.get("nope");

        assertFalse(lookup.hit());
        assertNull(lookup.value());
    }

    @Test
    void testTtlExpiry_missAfterTtl() {
        ManualClock clock = new ManualClock(0L);
        LruCache<String, Integer> cache = new LruCache<>(clock, CacheConfig.of(10, 5));

        cache.set("a", 1);
        clock.advanceMillis(6);

        assertFalse(cache.get("a").hit());
    }

    @Test
    void testTtlExpiry_exactBoundaryIsStillLive() {
        ManualClock clock = new ManualClock(0L);
        LruCache<String, Integer> cache = new LruCache<>(clock, CacheConfig.of(10, 5));

        cache.set("a", 1);
        clock.advanceNanos(5_000_000L);
        assertTrue(cache.get("a").hit(), "Live at the expiry instant");

        clock.advanceNanos(1L);
        assertFalse(cache.get("a").hit(), "Expired 1ns past the expiry instant");
    }

    @Test
    void testTtl_longestAcceptedLifetimeStillHits() {
        ManualClock clock = new ManualClock(0L);
        LruCache<String, Integer> cache =
            new LruCache<>(clock, CacheConfig.of(4, CacheConfig.MAX_TTL_MILLIS));

        cache.set("a", 1);
        clock.advanceMillis(365L * 24 * 3600 * 1000);

        assertTrue(cache.get("a").hit());
    }

    @Test
    void testTtl_tooLongRejected() {
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.of(4, Long.MAX_VALUE / 1000));
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.of(4, CacheConfig.MAX_TTL_MILLIS + 1));
        assertThrows(IllegalArgumentException.class,
            () -> CacheConfig.withNegative(4, 1_000, CacheConfig.MAX_TTL_MILLIS + 1));
    }

    @Test
    void testTtl_survivesClockWraparound() {
        // nanoTime may sit anywhere in the long range, including near its end
        ManualClock clock = new ManualClock(Long.MAX_VALUE - 1_000L);
        LruCache<String, Integer> cache = new LruCache<>(clock, CacheConfig.of(4, 10));

        cache.set("a", 1);
        clock.advanceMillis(9);
        assertTrue(cache.get("a").hit());

        clock.advanceMillis(2);
        assertFalse(cache.get("a").hit());
    }

    @Test
    void testTtlExpiry_withRealClock() throws InterruptedException {
        LruCache<String, Integer> cache = new LruCache<>(SystemClock.instance(), CacheConfig.of(10, 5));

        cache.set("a", 1);
        Thread.sleep(20);

        assertFalse(cache.get("a").hit());
    }

    @Test
    void testGet_doesNotExtendExpiry() {
        ManualClock clock = new ManualClock(0L);
        LruCache<String, Integer> cache = new LruCache<>(clock, CacheConfig.of(10, 100));

        cache.set("a", 1);
        clock.advanceMillis(60);
        assertTrue(cache.get("a").hit());

        clock.advanceMillis(60);
        assertFalse(cache.get("a").hit(), "Reads refresh recency, not lifetime");
    }

    @Test
    void testSet_overwriteRenewsTtl() {
        ManualClock clock = new ManualClock(0L);
        LruCache<String, Integer> cache = new LruCache<>(clock, CacheConfig.of(10, 100));

        cache.set("a", 1);
        clock.advanceMillis(80);
        cache.set("a", 2);
        clock.advanceMillis(80);

        CacheLookup<Integer> lookup = cache.get("a");
        assertTrue(lookup.hit());
        assertEquals(2, lookup.value());
    }

    @Test
    void testExpiredEntry_droppedLazilyOnGet() {
        ManualClock clock = new ManualClock(0L);
        LruCache<String, Integer> cache = new LruCache<>(clock, CacheConfig.of(10, 5));

        cache.set("a", 1);
        clock.advanceMillis(10);
        assertEquals(1, cache.size(), "No background sweep");

        cache.get("a");

        assertEquals(0, cache.size());
        assertEquals(1, cache.stats().expirations());
    }

    // ========== LRU EVICTION ==========

    @Test
    void testLRUEviction_touchedEntrySurvives() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(2, 1_000));

        assertEquals(0, cache.set("a", 1));
        assertEquals(0, cache.set("b", 2));
        cache.get("a");
        assertEquals(1, cache.set("c", 3));

        assertFalse(cache.get("b").hit());
        assertTrue(cache.get("a").hit());
        assertTrue(cache.get("c").hit());
        assertEquals(2, cache.size());
    }

    @Test
    void testSet_overwriteAtCapacityEvictsNothing() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(2, 1_000));

        cache.set("a", 1);
        cache.set("b", 2);

        assertEquals(0, cache.set("a", 10));
        assertEquals(2, cache.size());
        assertTrue(cache.get("b").hit());
    }

    @Test
    void testSet_overwriteRefreshesRecency() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(2, 1_000));

        cache.set("a", 1);
        cache.set("b", 2);
        cache.set("a", 3);
        cache.set("c", 4);

        assertFalse(cache.get("b").hit());
        assertEquals(3, cache.get("a").value());
    }

    @Test
    void testLRUEviction_picksByRecencyNotExpiry() {
        ManualClock clock = new ManualClock(0L);
        LruCache<String, Integer> cache = new LruCache<>(clock, CacheConfig.of(2, 10));

        cache.set("a", 1);
        clock.advanceMillis(5);
        cache.set("b", 2);
        cache.get("a");
        clock.advanceMillis(6); // "a" expired but most recently used

        assertEquals(1, cache.set("c", 3));

        assertFalse(cache.get("b").hit(), "Least recently used goes, even if still fresh");
        assertFalse(cache.get("a").hit(), "Expired");
        assertTrue(cache.get("c").hit());
    }

    @Test
    void testLRUEviction_maxSizeOne() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(1, 1_000));

        cache.set("a", 1);
        assertEquals(1, cache.set("b", 2));

        assertFalse(cache.get("a").hit());
        assertEquals(2, cache.get("b").value());
    }

    @Test
    void testLRUEviction_slotReuseAcrossManyInserts() {
        LruCache<Integer, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(3, 1_000));

        int evicted = 0;
        for (int i = 0; i < 1_000; i++) {
            evicted += cache.set(i, i * 10);
        }

        assertEquals(997, evicted);
        assertEquals(3, cache.size());
        for (int i = 997; i < 1_000; i++) {
            assertEquals(i * 10, cache.get(i).value());
        }
        assertFalse(cache.get(996).hit());
    }

    @Test
    void testEvictionCallback_receivesEvictedEntry() {
        List<String> evictedKeys = new ArrayList<>();
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(2, 1_000),
            (key, value) -> evictedKeys.add(key + "=" + value));

        cache.set("a", 1);
        cache.set("b", 2);
        cache.delete("b");  // explicit removal is not an eviction
        cache.set("c", 3);
        cache.set("d", 4);

        assertEquals(List.of("a=1"), evictedKeys);
    }

    // ========== NEGATIVE ENTRIES ==========

    @Test
    void testNegative_hitWhenEnabled() {
        LruCache<String, Integer> cache =
            new LruCache<>(new ManualClock(0L), CacheConfig.withNegative(10, 1_000, 500));

        cache.setNegative("missing");
        CacheLookup<Integer> lookup = cache.get("missing");

        assertTrue(lookup.hit());
        assertTrue(lookup.negative());
        assertNull(lookup.value());
    }

    @Test
    void testNegative_noOpWhenDisabled() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(10, 1_000));

        cache.setNegative("missing");

        assertFalse(cache.get("missing").hit());
        assertEquals(0, cache.size());
    }

    @Test
    void testNegative_usesOwnTtl() {
        ManualClock clock = new ManualClock(0L);
        LruCache<String, Integer> cache = new LruCache<>(clock, CacheConfig.withNegative(10, 1_000, 50));

        cache.setNegative("missing");
        clock.advanceMillis(51);

        assertFalse(cache.get("missing").hit());
    }

    @Test
    void testNegative_transitionsBothWays() {
        ManualClock clock = new ManualClock(0L);
        LruCache<String, Integer> cache = new LruCache<>(clock, CacheConfig.withNegative(10, 1_000, 50));

        cache.setNegative("k");
        cache.set("k", 7);
        CacheLookup<Integer> positive = cache.get("k");
        assertTrue(positive.isPositiveHit());
        assertEquals(7, positive.value());

        // positive TTL applies now, not the shorter negative one
        clock.advanceMillis(100);
        assertTrue(cache.get("k").isPositiveHit());

        cache.setNegative("k");
        CacheLookup<Integer> negative = cache.get("k");
        assertTrue(negative.negative());
        assertNull(negative.value());

        clock.advanceMillis(51);
        assertFalse(cache.get("k").hit(), "Negative TTL applies after flipping back");
    }

    @Test
    void testNegative_countsTowardsMaxSize() {
        LruCache<String, Integer> cache =
            new LruCache<>(new ManualClock(0L), CacheConfig.withNegative(2, 1_000, 1_000));

        cache.set("a", 1);
        cache.setNegative("b");
        cache.set("c", 3);

        assertFalse(cache.get("a").hit());
        assertTrue(cache.get("b").negative());
        assertEquals(2, cache.size());
    }

    // ========== DELETE / CLEAR ==========

    @Test
    void testDelete_removesAndIgnoresAbsent() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(10, 1_000));

        cache.set("a", 1);
        cache.delete("a");
        cache.delete("never-there");

        assertFalse(cache.get("a").hit());
        assertEquals(0, cache.size());
    }

    @Test
    void testClear_resetsEntriesAndStats() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(2, 1_000));

        cache.set("a", 1);
        cache.get("a");
        cache.clear();

        assertEquals(0, cache.size());
        assertEquals(0, cache.stats().requests());

        cache.set("x", 1);
        cache.set("y", 2);
        assertEquals(1, cache.set("z", 3));
        assertEquals(2, cache.size());
    }

    // ========== getOrLoad / stats ==========

    @Test
    void testGetOrLoad_loadsOnceThenHits() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(10, 1_000));
        AtomicInteger loads = new AtomicInteger();

        Optional<Integer> first = cache.getOrLoad("a", key -> {
            loads.incrementAndGet();
            return Optional.of(42);
        });
        Optional<Integer> second = cache.getOrLoad("a", key -> {
            loads.incrementAndGet();
            return Optional.of(99);
        });

        assertEquals(Optional.of(42), first);
        assertEquals(Optional.of(42), second);
        assertEquals(1, loads.get());
    }

    @Test
    void testGetOrLoad_emptyResultCachedAsNegative() {
        LruCache<String, Integer> cache =
            new LruCache<>(new ManualClock(0L), CacheConfig.withNegative(10, 1_000, 1_000));
        AtomicInteger loads = new AtomicInteger();

        cache.getOrLoad("missing", key -> {
            loads.incrementAndGet();
            return Optional.empty();
        });
        Optional<Integer> again = cache.getOrLoad("missing", key -> {
            loads.incrementAndGet();
            return Optional.of(1);
        });

        assertTrue(again.isEmpty());
        assertEquals(1, loads.get());
        assertEquals(1, cache.stats().negativeHits());
    }

    @Test
    void testGetOrLoad_loaderFailureNotCached() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(10, 1_000));

        IllegalStateException thrown = assertThrows(IllegalStateException.class,
            () -> cache.getOrLoad("a", key -> {
                throw new IllegalStateException("db down");
            }));

        assertEquals("db down", thrown.getMessage());
        assertEquals(0, cache.size());
    }

    @Test
    void testStats_countsHitsMissesEvictions() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(1, 1_000));

        cache.set("a", 1);
        cache.get("a");
        cache.get("b");
        cache.set("b", 2);

        CacheStats stats = cache.stats();
        assertEquals(1, stats.hits());
        assertEquals(1, stats.misses());
        assertEquals(1, stats.evictions());
        assertEquals(1, stats.size());
        assertEquals(0.5, stats.hitRate(), 1e-9);
    }

    // ========== VALIDATION ==========

    @Test
    void testInvalidConfig_throwsException() {
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.of(0, 1_000));
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.of(10, 0));
        assertThrows(IllegalArgumentException.class, () -> CacheConfig.withNegative(10, 1_000, 0));
        assertThrows(IllegalArgumentException.class, () -> new LruCache<String, Integer>(null, CacheConfig.of(1, 1)));
    }

    @Test
    void testSet_nullValueRejected() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(10, 1_000));

        assertThrows(IllegalArgumentException.class, () -> cache.set("a", null));
        assertThrows(IllegalArgumentException.class, () -> cache.set(null, 1));
    }

    // ========== BULK INVALIDATION ==========

    @Test
    void testDeleteIf_removesMatchingKeysOnly() {
        List<String> evicted = new ArrayList<>();
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(10, 1_000),
            (key, value) -> evicted.add(key));
        cache.set("role:e1:a", 1);
        cache.set("role:e1:b", 2);
        cache.set("role:e2:a", 3);

        int removed = cache.deleteIf(key -> key.startsWith("role:e1:"));

        assertEquals(2, removed);
        assertEquals(1, cache.size());
        assertFalse(cache.get("role:e1:a").hit());
        assertTrue(cache.get("role:e2:a").hit());
        assertTrue(evicted.isEmpty(), "Explicit removal is not eviction");
    }

    @Test
    void testDeleteIf_freedSlotsReused() {
        LruCache<Integer, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(4, 1_000));
        for (int i = 0; i < 4; i++) {
            cache.set(i, i);
        }

        cache.deleteIf(key -> key % 2 == 0);

        assertEquals(0, cache.set(10, 10));
        assertEquals(0, cache.set(11, 11));
        assertEquals(1, cache.set(12, 12), "Full again, LRU goes");
        assertFalse(cache.get(1).hit());
        assertEquals(4, cache.size());
    }

    @Test
    void testGetOrLoad_loadOverlappingInvalidationNotStored() {
        LruCache<String, Integer> cache = new LruCache<>(new ManualClock(0L), CacheConfig.of(10, 1_000));

        // the source changes and is invalidated while the load is in flight
        Optional<Integer> loaded = cache.getOrLoad("k", key -> {
            cache.delete(key);
            return Optional.of(1);
        });

        assertEquals(Optional.of(1), loaded);
        assertFalse(cache.get("k").hit(), "A load older than the invalidation must not be memoized");

        assertEquals(Optional.of(2), cache.getOrLoad("k", key -> Optional.of(2)));
        assertTrue(cache.get("k").hit());
    }
}
