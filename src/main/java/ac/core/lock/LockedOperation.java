package ac.core.lock;

/**
 * Unit of work run while holding a key in {@link LockManager#withLock}.
 *
 * @param <T> Result type
 * @param <E> Checked exception the operation may throw, propagated unchanged
 */
@FunctionalInterface
public interface LockedOperation<T, E extends Exception> {
    T run() throws E;
}
