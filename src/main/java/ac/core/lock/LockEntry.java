package ac.core.lock;

import java.util.ArrayDeque;
import java.util.concurrent.locks.Condition;

/**
 * Registry record for one contended key: current holder plus FIFO waiter queue.
 *
 * Created on the first acquisition attempt for a key and dropped by
 * {@link LockManager} as soon as a release finds the queue empty.
 *
 * Thread-safety:
 * - Not synchronized itself; every access happens under the manager's registry lock
 */
final class LockEntry {

    static final long NO_HOLDER = 0L;

    private final String key;
    private final ArrayDeque<Waiter> waiters = new ArrayDeque<>();
    private long holderToken = NO_HOLDER;
    private long grantedAtNanos;

    LockEntry(String key) {
        this.key = key;
    }

    String key() {
        return key;
    }

    boolean isHeld() {
        return holderToken != NO_HOLDER;
    }

    long holderToken() {
        return holderToken;
    }

    long grantedAtNanos() {
        return grantedAtNanos;
    }

    void grant(long token, long nowNanos) {
        this.holderToken = token;
        this.grantedAtNanos = nowNanos;
    }

    Waiter enqueue(long token, Condition condition) {
        Waiter waiter = new Waiter(token, condition);
        waiters.addLast(waiter);
        return waiter;
    }

    void dequeue(Waiter waiter) {
        waiters.remove(waiter);
    }

    /**
     * Hands the key to the oldest waiter, or clears the holder if nobody waits.
     *
     * @return The waiter now holding the key, or null if the queue was empty
     */
    Waiter handOff(long nowNanos) {
        Waiter nextWaiter = waiters.pollFirst();
        if (nextWaiter == null) {
            holderToken = NO_HOLDER;
            return null;
        }
        grant(nextWaiter.token, nowNanos);
        nextWaiter.granted = true;
        nextWaiter.condition.signal();
        return nextWaiter;
    }

    int queueLength() {
        return waiters.size();
    }

    /**
     * A thread parked until the key is handed to it.
     */
    static final class Waiter {
        final long token;
        final Condition condition;
        boolean granted;

        Waiter(long token, Condition condition) {
            this.token = token;
            this.condition = condition;
        }
    }
}
