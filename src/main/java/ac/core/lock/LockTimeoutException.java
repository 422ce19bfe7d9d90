package ac.core.lock;

/**
 * Thrown when a key could not be granted within the acquisition timeout.
 *
 * Signals contention, not exhaustion: callers usually map it to a retryable
 * "try again" response. The guarded operation was never invoked.
 */
public class LockTimeoutException extends RuntimeException {

    private final String key;
    private final long timeoutMillis;

    public LockTimeoutException(String key, long timeoutMillis) {
        super("Lock timeout: could not acquire '" + key + "' within " + timeoutMillis + " ms");
        this.key = key;
        this.timeoutMillis = timeoutMillis;
    }

    public String getKey() {
        return key;
    }

    public long getTimeoutMillis() {
        return timeoutMillis;
    }
}
