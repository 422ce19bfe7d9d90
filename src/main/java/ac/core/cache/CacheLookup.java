package ac.core.cache;

/**
 * Outcome of {@link LruCache#get}.
 *
 * A negative hit means the key is cached as known-absent: {@code hit} and
 * {@code negative} are both true and {@code value} is null.
 */
public record CacheLookup<V>(boolean hit, V value, boolean negative) {

    private static final CacheLookup<?> MISS = new CacheLookup<>(false, null, false);
    private static final CacheLookup<?> NEGATIVE = new CacheLookup<>(true, null, true);

    @SuppressWarnings("unchecked")
    public static <V> CacheLookup<V> miss() {
        return (CacheLookup<V>) MISS;
    }

    @SuppressWarnings("unchecked")
    public static <V> CacheLookup<V> negativeHit() {
        return (CacheLookup<V>) NEGATIVE;
    }

    public static <V> CacheLookup<V> hit(V value) {
        return new CacheLookup<>(true, value, false);
    }

    public boolean isPositiveHit() {
        return hit && !negative;
    }
}
