package ac.core.lock;

import ac.core.clock.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-key mutual exclusion with FIFO fairness and bounded waiting.
 *
 * Features:
 * - One holder per key; waiters for the same key are granted strictly in arrival order
 * - No ordering across distinct keys
 * - Acquisition timeout: a waiter that times out leaves the queue and never runs its operation
 * - Registry holds only keys that are currently held, so one-off keys do not accumulate
 *
 * Not reentrant: a holder that asks for its own key again queues behind itself
 * and times out. Callers must not nest acquisitions of the same key.
 *
 * Thread-safety:
 * - The registry and every {@link LockEntry} are guarded by a single ReentrantLock
 * - Each waiter parks on its own Condition, so a release wakes exactly the next waiter
 *
 * Usage example:
 * <pre>
 * LockManager locks = new LockManager(SystemClock.instance());
 * Registration saved = locks.withLock("role:e1:r1", () -> store.save(registration));
 * </pre>
 */
public final class LockManager {

    private static final Logger log = LoggerFactory.getLogger(LockManager.class);

    private final Clock clock;
    private final LockOptions defaultOptions;
    private final ReentrantLock registryLock = new ReentrantLock();
    private final Map<String, LockEntry> registry = new HashMap<>();
    private final AtomicLong tokens = new AtomicLong();

    /**
     * Creates a lock manager.
     *
     * @param clock Clock used to stamp grant times
     * @param defaultOptions Options used when a call passes none
     * @throws IllegalArgumentException if any parameter is null
     */
    public LockManager(Clock clock, LockOptions defaultOptions) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (defaultOptions == null) {
            throw new IllegalArgumentException("defaultOptions cannot be null");
        }
        this.clock = clock;
        this.defaultOptions = defaultOptions;
    }

    public LockManager(Clock clock) {
        this(clock, LockOptions.defaults());
    }

    /**
     * Runs an operation while holding the key, with the default timeout.
     *
     * @see #withLock(String, LockedOperation, LockOptions)
     */
    public <T, E extends Exception> T withLock(String key, LockedOperation<T, E> operation)
        throws E, InterruptedException {
        return withLock(key, operation, defaultOptions);
    }

    /**
     * Runs an operation while holding the key.
     *
     * The key is released on every exit path before the result or failure
     * reaches the caller. Failures thrown by the operation propagate unchanged.
     *
     * @param key Contended resource
     * @param operation Work to run exclusively
     * @param options Acquisition options
     * @return Whatever the operation returns
     * @throws LockTimeoutException if the key is not granted in time (operation not invoked)
     * @throws InterruptedException if interrupted while waiting (operation not invoked)
     * @throws E if the operation fails
     */
    public <T, E extends Exception> T withLock(String key, LockedOperation<T, E> operation, LockOptions options)
        throws E, InterruptedException {
        if (operation == null) {
            throw new IllegalArgumentException("operation cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        try (LockGuard guard = tryAcquire(key, options.timeoutMillis())) {
            return operation.run();
        }
    }

    /**
     * Acquires the key with the default timeout.
     *
     * @param key Contended resource
     * @return Guard that releases the key on close
     * @throws LockTimeoutException if the key is not granted in time
     * @throws InterruptedException if interrupted while waiting
     */
    public LockGuard acquire(String key) throws InterruptedException {
        return tryAcquire(key, defaultOptions.timeoutMillis());
    }

    /**
     * Acquires the key, waiting at most {@code timeoutMillis}.
     *
     * If the key is free it is granted immediately. Otherwise the caller joins the
     * tail of the key's queue and parks until a release hands the key to it or
     * the timeout elapses. An interrupt that races with a grant keeps the grant
     * and re-asserts the interrupt flag.
     *
     * @param key Contended resource
     * @param timeoutMillis Maximum wait (must be > 0)
     * @return Guard that releases the key on close
     * @throws LockTimeoutException if the key is not granted in time
     * @throws InterruptedException if interrupted before being granted
     */
    public LockGuard tryAcquire(String key, long timeoutMillis) throws InterruptedException {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (timeoutMillis <= 0) {
            throw new IllegalArgumentException("timeoutMillis must be > 0");
        }

        long token = tokens.incrementAndGet();

        registryLock.lock();
        try {
            LockEntry entry = registry.computeIfAbsent(key, LockEntry::new);

            // Fast path: nobody holds the key
            if (!entry.isHeld()) {
                entry.grant(token, clock.nowNanos());
                log.debug("Granted lock key={} token={}", key, token);
                return new LockGuard(this, key, token, entry.grantedAtNanos());
            }

            // Slow path: queue behind the holder and earlier waiters
            LockEntry.Waiter waiter = entry.enqueue(token, registryLock.newCondition());
            log.debug("Queued for lock key={} token={} position={}", key, token, entry.queueLength());

            long remainingNanos = TimeUnit.MILLISECONDS.toNanos(timeoutMillis);
            while (!waiter.granted) {
                if (remainingNanos <= 0L) {
                    entry.dequeue(waiter);
                    log.warn("Lock timeout key={} token={} after {} ms", entry.key(), token, timeoutMillis);
                    throw new LockTimeoutException(key, timeoutMillis);
                }
                try {
                    remainingNanos = waiter.condition.awaitNanos(remainingNanos);
                } catch (InterruptedException e) {
                    if (!waiter.granted) {
                        entry.dequeue(waiter);
                        throw e;
                    }
                    Thread.currentThread().interrupt();
                }
            }

            log.debug("Granted lock key={} token={} after waiting", key, token);
            return new LockGuard(this, key, token, entry.grantedAtNanos());
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Releases a guard's key: hands it to the oldest waiter, or drops the
     * registry entry when nobody waits.
     */
    void release(LockGuard guard) {
        registryLock.lock();
        try {
            LockEntry entry = registry.get(guard.key());
            if (entry == null || entry.holderToken() != guard.token()) {
                throw new IllegalStateException("Release of a lock not held: " + guard);
            }

            LockEntry.Waiter nextHolder = entry.handOff(clock.nowNanos());
            if (nextHolder == null) {
                registry.remove(guard.key());
                log.debug("Released lock key={} token={}, entry removed", guard.key(), guard.token());
            } else {
                log.debug("Released lock key={} token={}, handed to token={}",
                    guard.key(), guard.token(), nextHolder.token);
            }
        } finally {
            registryLock.unlock();
        }
    }

    boolean isHeldBy(String key, long token) {
        registryLock.lock();
        try {
            LockEntry entry = registry.get(key);
            return entry != null && entry.holderToken() == token;
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * @param key The key
     * @return true if some caller currently holds the key
     */
    public boolean isLocked(String key) {
        registryLock.lock();
        try {
            LockEntry entry = registry.get(key);
            return entry != null && entry.isHeld();
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * @param key The key
     * @return Number of callers waiting behind the holder, 0 if the key is absent
     */
    public int queueLength(String key) {
        registryLock.lock();
        try {
            LockEntry entry = registry.get(key);
            return entry == null ? 0 : entry.queueLength();
        } finally {
            registryLock.unlock();
        }
    }

    /**
     * Returns the number of keys currently tracked (held keys only).
     *
     * @return Registry size
     */
    public int registrySize() {
        registryLock.lock();
        try {
            return registry.size();
        } finally {
            registryLock.unlock();
        }
    }

    public LockOptions defaultOptions() {
        return defaultOptions;
    }
}
