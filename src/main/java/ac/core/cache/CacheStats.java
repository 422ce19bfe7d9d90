package ac.core.cache;

/**
 * Counters collected by an {@link LruCache} since construction or the last {@link LruCache#clear()}.
 *
 * @param hits Positive hits
 * @param negativeHits Hits on negative entries
 * @param misses Lookups that found nothing usable (absent or expired)
 * @param evictions Entries dropped to stay within maxSize
 * @param expirations Entries dropped lazily because their TTL lapsed
 * @param size Entries currently stored
 */
public record CacheStats(
    long hits,
    long negativeHits,
    long misses,
    long evictions,
    long expirations,
    int size
) {
    public long requests() {
        return hits + negativeHits + misses;
    }

    /**
     * Fraction of lookups answered from the cache, negative hits included.
     *
     * @return value in [0, 1], 0 when nothing was looked up yet
     */
    public double hitRate() {
        long total = requests();
        return total == 0 ? 0.0 : (double) (hits + negativeHits) / total;
    }
}
