package ac.core.lock;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Proof of exclusive ownership of one key, released on {@link #close()}.
 *
 * Intended for try-with-resources:
 * <pre>
 * try (LockGuard guard = locks.tryAcquire("role:e1:r1", 2_000)) {
 *     Occupancy occupancy = capacityGuard.getRoleOccupancy(guard);
 *     ...
 * }
 * </pre>
 * Closing more than once is harmless.
 */
public final class LockGuard implements AutoCloseable {

    private final LockManager manager;
    private final String key;
    private final long token;
    private final long grantedAtNanos;
    private final AtomicBoolean released = new AtomicBoolean(false);

    LockGuard(LockManager manager, String key, long token, long grantedAtNanos) {
        this.manager = manager;
        this.key = key;
        this.token = token;
        this.grantedAtNanos = grantedAtNanos;
    }

    public String key() {
        return key;
    }

    public long grantedAtNanos() {
        return grantedAtNanos;
    }

    long token() {
        return token;
    }

    /**
     * @return true while this guard still owns its key
     */
    public boolean isHeld() {
        return !released.get() && manager.isHeldBy(key, token);
    }

    /**
     * @param lockManager Manager to check against
     * @return true if this guard was issued by the given manager
     */
    public boolean issuedBy(LockManager lockManager) {
        return manager == lockManager;
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            manager.release(this);
        }
    }

    @Override
    public String toString() {
        return "LockGuard{key=" + key + ", token=" + token + ", released=" + released.get() + "}";
    }
}
