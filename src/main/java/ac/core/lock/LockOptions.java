package ac.core.lock;

/**
 * Per-call acquisition options.
 *
 * @param timeoutMillis Maximum time to wait for the key before failing
 */
public record LockOptions(long timeoutMillis) {

    public static final long DEFAULT_TIMEOUT_MILLIS = 5_000L;

    private static final LockOptions DEFAULTS = new LockOptions(DEFAULT_TIMEOUT_MILLIS);

    public LockOptions {
        if (timeoutMillis <= 0) throw new IllegalArgumentException("timeoutMillis must be > 0");
    }

    public static LockOptions defaults() {
        return DEFAULTS;
    }

    public static LockOptions timeoutMillis(long timeoutMillis) {
        return new LockOptions(timeoutMillis);
    }
}
