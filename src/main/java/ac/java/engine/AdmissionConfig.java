package ac.java.engine;

import ac.core.cache.CacheConfig;
import ac.core.lock.LockOptions;

/**
 * Settings for an {@link AdmissionEngine} and the components it is built from.
 *
 * @param lockTimeoutMillis How long an admission waits for its role's lock
 * @param occupancyCacheSize Maximum memoized occupancies
 * @param occupancyTtlMillis Lifetime of a memoized occupancy
 * @param preLockCheck Whether to reject obviously full roles before taking the lock
 */
public record AdmissionConfig(
    long lockTimeoutMillis,
    int occupancyCacheSize,
    long occupancyTtlMillis,
    boolean preLockCheck
) {
    public static final long DEFAULT_LOCK_TIMEOUT_MILLIS = LockOptions.DEFAULT_TIMEOUT_MILLIS;
    public static final int DEFAULT_OCCUPANCY_CACHE_SIZE = 2_000;
    public static final long DEFAULT_OCCUPANCY_TTL_MILLIS = 60_000L;

    public AdmissionConfig {
        if (lockTimeoutMillis <= 0) throw new IllegalArgumentException("lockTimeoutMillis must be > 0");
        if (occupancyCacheSize <= 0) throw new IllegalArgumentException("occupancyCacheSize must be > 0");
        if (occupancyTtlMillis <= 0) throw new IllegalArgumentException("occupancyTtlMillis must be > 0");
    }

    /**
     * 5 s lock timeout, 2000 memoized roles for 60 s, pre-lock check on.
     *
     * @return Default configuration
     */
    public static AdmissionConfig defaults() {
        return new AdmissionConfig(
            DEFAULT_LOCK_TIMEOUT_MILLIS,
            DEFAULT_OCCUPANCY_CACHE_SIZE,
            DEFAULT_OCCUPANCY_TTL_MILLIS,
            true
        );
    }

    public AdmissionConfig withLockTimeoutMillis(long millis) {
        return new AdmissionConfig(millis, occupancyCacheSize, occupancyTtlMillis, preLockCheck);
    }

    public AdmissionConfig withOccupancyCache(int size, long ttlMillis) {
        return new AdmissionConfig(lockTimeoutMillis, size, ttlMillis, preLockCheck);
    }

    public AdmissionConfig withPreLockCheck(boolean enabled) {
        return new AdmissionConfig(lockTimeoutMillis, occupancyCacheSize, occupancyTtlMillis, enabled);
    }

    public LockOptions lockOptions() {
        return LockOptions.timeoutMillis(lockTimeoutMillis);
    }

    public CacheConfig occupancyCacheConfig() {
        return CacheConfig.of(occupancyCacheSize, occupancyTtlMillis);
    }
}
