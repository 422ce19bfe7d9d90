package ac.core.clock;

/**
 * Monotonic time source in nanoseconds.
 *
 * Injected into every component that tracks expiry or grant time so tests can
 * drive time deterministically with {@link ManualClock}.
 */
public interface Clock {

    long nowNanos();

    default long nowMillis() {
        return nowNanos() / 1_000_000L;
    }
}
