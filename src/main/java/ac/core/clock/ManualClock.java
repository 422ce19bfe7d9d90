package ac.core.clock;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Hand-driven clock for deterministic tests. Safe to read from several threads.
 */
public final class ManualClock implements Clock {
    private final AtomicLong now;

    public ManualClock(long startNanos) {
        this.now = new AtomicLong(startNanos);
    }

    @Override
    public long nowNanos() {
        return now.get();
    }

    public void advanceNanos(long delta) {
        if (delta < 0) throw new IllegalArgumentException("delta < 0");
        now.addAndGet(delta);
    }

    public void advanceMillis(long deltaMillis) {
        advanceNanos(deltaMillis * 1_000_000L);
    }

    public void setNanos(long value) {
        now.set(value);
    }
}
