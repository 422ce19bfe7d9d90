package ac.core.cache;

/**
 * Configuration for an {@link LruCache}.
 *
 * @param maxSize Maximum number of entries, positive and negative combined
 * @param ttlMillis Lifetime of a positive entry
 * @param enableNegative Whether {@link LruCache#setNegative} stores anything
 * @param negativeTtlMillis Lifetime of a negative entry (ignored when negative caching is off)
 */
public record CacheConfig(
    int maxSize,
    long ttlMillis,
    boolean enableNegative,
    long negativeTtlMillis
) {
    /**
     * Longest accepted lifetime. Expiry is compared as a nanosecond difference,
     * which stays exact only for spans below half the {@code long} range.
     */
    public static final long MAX_TTL_MILLIS = Long.MAX_VALUE / 2 / 1_000_000L;

    public CacheConfig {
        if (maxSize <= 0) throw new IllegalArgumentException("maxSize must be > 0");
        if (ttlMillis <= 0) throw new IllegalArgumentException("ttlMillis must be > 0");
        if (ttlMillis > MAX_TTL_MILLIS) {
            throw new IllegalArgumentException("ttlMillis must be <= " + MAX_TTL_MILLIS);
        }
        if (enableNegative && negativeTtlMillis <= 0) {
            throw new IllegalArgumentException("negativeTtlMillis must be > 0 when negative caching is enabled");
        }
        if (negativeTtlMillis > MAX_TTL_MILLIS) {
            throw new IllegalArgumentException("negativeTtlMillis must be <= " + MAX_TTL_MILLIS);
        }
    }

    /**
     * Positive entries only.
     *
     * @param maxSize Maximum entries
     * @param ttlMillis Entry lifetime
     * @return Configuration with negative caching disabled
     */
    public static CacheConfig of(int maxSize, long ttlMillis) {
        return new CacheConfig(maxSize, ttlMillis, false, 0L);
    }

    /**
     * Positive and negative entries.
     *
     * @param maxSize Maximum entries
     * @param ttlMillis Positive entry lifetime
     * @param negativeTtlMillis Negative entry lifetime
     * @return Configuration with negative caching enabled
     */
    public static CacheConfig withNegative(int maxSize, long ttlMillis, long negativeTtlMillis) {
        return new CacheConfig(maxSize, ttlMillis, true, negativeTtlMillis);
    }
}
