package ac.core.cache;

import ac.core.clock.Clock;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.BiConsumer;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Bounded LRU cache with TTL expiry and negative-result entries.
 *
 * This implementation provides:
 * - O(1) get/set/delete
 * - Strict least-recently-used eviction, exactly one entry per overflowing insert
 * - Lazy TTL expiry checked on read (no background sweep)
 * - Negative entries ("known absent") with their own TTL
 * - Thread-safe operations via synchronized methods
 * - Eviction callback (value is null for negative entries)
 * - Bulk invalidation by key predicate ({@link #deleteIf})
 *
 * Design:
 * - Entries live in an arena of parallel slot arrays sized maxSize
 * - Recency order is a doubly linked list over slot indices (head = MRU, tail = LRU)
 * - Freed slots are chained through {@code next} into a free list
 * - A HashMap maps keys to slot indices
 *
 * A read refreshes recency but never extends expiry. Each set/setNegative fully
 * replaces the previous entry for that key, so a key may flip between positive
 * and negative any number of times.
 *
 * @param <K> Key type
 * @param <V> Value type
 */
public final class LruCache<K, V> {

    private static final int NIL = -1;

    private final Clock clock;
    private final int maxSize;
    private final long ttlNanos;
    private final boolean enableNegative;
    private final long negativeTtlNanos;
    private final BiConsumer<K, V> evictionCallback;

    private final Map<K, Integer> index;
    private final Object[] keys;
    private final Object[] values;
    private final boolean[] negative;
    private final long[] expiresAt;
    private final int[] prev;
    private final int[] next;

    private int head = NIL;
    private int tail = NIL;
    private int freeHead;

    private long hits;
    private long negativeHits;
    private long misses;
    private long evictions;
    private long expirations;

    // Bumped by every delete/deleteIf/clear; getOrLoad discards loads that straddle one
    private long invalidations;

    /**
     * Creates a cache with the given configuration and eviction callback.
     *
     * @param clock Time source for expiry
     * @param config Size and TTL settings
     * @param evictionCallback Invoked when an entry is evicted for capacity (can be null)
     * @throws IllegalArgumentException if clock or config is null
     */
    public LruCache(Clock clock, CacheConfig config, BiConsumer<K, V> evictionCallback) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.clock = clock;
        this.maxSize = config.maxSize();
        this.ttlNanos = TimeUnit.MILLISECONDS.toNanos(config.ttlMillis());
        this.enableNegative = config.enableNegative();
        this.negativeTtlNanos = TimeUnit.MILLISECONDS.toNanos(config.negativeTtlMillis());
        this.evictionCallback = evictionCallback;

        this.index = new HashMap<>(Math.max(16, (int) (maxSize / 0.75f) + 1));
        this.keys = new Object[maxSize];
        this.values = new Object[maxSize];
        this.negative = new boolean[maxSize];
        this.expiresAt = new long[maxSize];
        this.prev = new int[maxSize];
        this.next = new int[maxSize];

        // Every slot starts on the free list
        for (int i = 0; i < maxSize; i++) {
            next[i] = i + 1 < maxSize ? i + 1 : NIL;
        }
        this.freeHead = 0;
    }

    /**
     * Creates a cache without eviction callback.
     *
     * @param clock Time source for expiry
     * @param config Size and TTL settings
     */
    public LruCache(Clock clock, CacheConfig config) {
        this(clock, config, null);
    }

    /**
     * Looks up a key.
     * A hit marks the entry as most recently used; an expired entry is dropped.
     *
     * @param key The key to look up
     * @return Lookup outcome, never null
     */
    public synchronized CacheLookup<V> get(K key) {
        Integer slot = index.get(key);
        if (slot == null) {
            misses++;
            return CacheLookup.miss();
        }

        int s = slot;
        if (isExpired(s, clock.nowNanos())) {
            unlinkAndFree(s);
            expirations++;
            misses++;
            return CacheLookup.miss();
        }

        moveToHead(s);
        if (negative[s]) {
            negativeHits++;
            return CacheLookup.negativeHit();
        }
        hits++;
        return CacheLookup.hit(valueAt(s));
    }

    /**
     * Stores a positive entry with a fresh TTL, replacing whatever the key held.
     *
     * @param key The key
     * @param value The value (must not be null, use {@link #setNegative} for absence)
     * @return 1 if a least-recently-used entry was evicted to make room, else 0
     */
    public synchronized int set(K key, V value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return store(key, value, false, ttlNanos);
    }

    /**
     * Stores a negative entry for the key, replacing whatever it held.
     * No-op when negative caching is disabled.
     *
     * @param key The key known to resolve to nothing
     */
    public synchronized void setNegative(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (!enableNegative) {
            return;
        }
        store(key, null, true, negativeTtlNanos);
    }

    /**
     * Removes an entry. Does NOT invoke the eviction callback.
     *
     * @param key The key to remove
     */
    public synchronized void delete(K key) {
        invalidations++;
        Integer slot = index.get(key);
        if (slot != null) {
            unlinkAndFree(slot);
        }
    }

    /**
     * Removes every entry whose key matches. Does NOT invoke the eviction callback.
     *
     * @param filter Selects the keys to drop
     * @return Number of entries removed
     */
    public synchronized int deleteIf(Predicate<? super K> filter) {
        if (filter == null) {
            throw new IllegalArgumentException("filter cannot be null");
        }
        invalidations++;

        List<Integer> doomed = new ArrayList<>();
        for (Map.Entry<K, Integer> entry : index.entrySet()) {
            if (filter.test(entry.getKey())) {
                doomed.add(entry.getValue());
            }
        }
        for (int slot : doomed) {
            unlinkAndFree(slot);
        }
        return doomed.size();
    }

    /**
     * Returns the cached value or loads it.
     *
     * The loader runs outside the cache's monitor, so two callers missing the same
     * key may both load; the later store wins. A load that overlaps a
     * {@link #delete}, {@link #deleteIf} or {@link #clear} is returned but not
     * stored, since it may predate the change that caused the invalidation.
     * An empty load result is cached as a negative entry when negative caching
     * is enabled.
     *
     * @param key The key
     * @param loader Fetches the value on a miss; exceptions propagate and nothing is cached
     * @return The value, or empty for a negative hit or an empty load
     */
    public Optional<V> getOrLoad(K key, Function<? super K, Optional<V>> loader) {
        if (loader == null) {
            throw new IllegalArgumentException("loader cannot be null");
        }

        CacheLookup<V> cached;
        long observedInvalidations;
        synchronized (this) {
            cached = get(key);
            observedInvalidations = invalidations;
        }
        if (cached.hit()) {
            return Optional.ofNullable(cached.value());
        }

        Optional<V> loaded = loader.apply(key);
        if (loaded == null) {
            throw new IllegalStateException("loader returned null for key: " + key);
        }
        storeLoaded(key, loaded, observedInvalidations);
        return loaded;
    }

    private synchronized void storeLoaded(K key, Optional<V> loaded, long observedInvalidations) {
        if (invalidations != observedInvalidations) {
            return;
        }
        if (loaded.isPresent()) {
            set(key, loaded.get());
        } else {
            setNegative(key);
        }
    }

    /**
     * Returns the number of stored entries, including expired ones not yet dropped.
     *
     * @return Number of entries
     */
    public synchronized int size() {
        return index.size();
    }

    /**
     * Clears all entries and counters.
     * Note: Does NOT invoke eviction callbacks.
     */
    public synchronized void clear() {
        invalidations++;
        index.clear();
        for (int i = 0; i < maxSize; i++) {
            keys[i] = null;
            values[i] = null;
            negative[i] = false;
            prev[i] = NIL;
            next[i] = i + 1 < maxSize ? i + 1 : NIL;
        }
        head = NIL;
        tail = NIL;
        freeHead = 0;
        hits = 0;
        negativeHits = 0;
        misses = 0;
        evictions = 0;
        expirations = 0;
    }

    public synchronized CacheStats stats() {
        return new CacheStats(hits, negativeHits, misses, evictions, expirations, index.size());
    }

    public int maxSize() {
        return maxSize;
    }

    public boolean negativeCachingEnabled() {
        return enableNegative;
    }

    // ========== arena internals (caller holds the monitor) ==========

    private int store(K key, V value, boolean isNegative, long lifetimeNanos) {
        long expiry = clock.nowNanos() + lifetimeNanos;

        Integer existing = index.get(key);
        if (existing != null) {
            int s = existing;
            values[s] = value;
            negative[s] = isNegative;
            expiresAt[s] = expiry;
            moveToHead(s);
            return 0;
        }

        int evicted = 0;
        if (index.size() >= maxSize) {
            evictTail();
            evicted = 1;
        }

        int s = freeHead;
        freeHead = next[s];

        keys[s] = key;
        values[s] = value;
        negative[s] = isNegative;
        expiresAt[s] = expiry;
        linkAtHead(s);
        index.put(key, s);
        return evicted;
    }

    private void evictTail() {
        int s = tail;
        K key = keyAt(s);
        V value = valueAt(s);
        unlinkAndFree(s);
        evictions++;
        if (evictionCallback != null) {
            evictionCallback.accept(key, value);
        }
    }

    private boolean isExpired(int s, long now) {
        // Overflow-safe comparison for nanoTime-based clocks; live at the expiry instant
        return now - expiresAt[s] > 0;
    }

    private void moveToHead(int s) {
        if (s == head) return;
        unlink(s);
        linkAtHead(s);
    }

    private void linkAtHead(int s) {
        prev[s] = NIL;
        next[s] = head;
        if (head != NIL) {
            prev[head] = s;
        }
        head = s;
        if (tail == NIL) {
            tail = s;
        }
    }

    private void unlink(int s) {
        int p = prev[s];
        int n = next[s];
        if (p != NIL) next[p] = n; else head = n;
        if (n != NIL) prev[n] = p; else tail = p;
        prev[s] = NIL;
        next[s] = NIL;
    }

    private void unlinkAndFree(int s) {
        unlink(s);
        index.remove(keyAt(s));
        keys[s] = null;
        values[s] = null;
        negative[s] = false;
        next[s] = freeHead;
        freeHead = s;
    }

    @SuppressWarnings("unchecked")
    private K keyAt(int s) {
        return (K) keys[s];
    }

    @SuppressWarnings("unchecked")
    private V valueAt(int s) {
        return (V) values[s];
    }
}
