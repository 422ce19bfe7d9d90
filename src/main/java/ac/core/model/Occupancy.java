package ac.core.model;

/**
 * Point-in-time view of how many slots of a capacity-limited resource are taken.
 *
 * Produced fresh by every occupancy read and never mutated. A {@code limit} of
 * {@link #UNBOUNDED} means the resource has no configured capacity.
 *
 * @param current Active holders (members + guests). Should never be negative.
 * @param limit Configured capacity, or {@link #UNBOUNDED}
 */
public record Occupancy(long current, long limit) {

    public static final long UNBOUNDED = -1L;

    public Occupancy {
        if (limit < 0 && limit != UNBOUNDED) {
            throw new IllegalArgumentException("limit must be >= 0 or UNBOUNDED, got: " + limit);
        }
    }

    public static Occupancy bounded(long current, long limit) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        return new Occupancy(current, limit);
    }

    public static Occupancy unbounded(long current) {
        return new Occupancy(current, UNBOUNDED);
    }

    public boolean isBounded() {
        return limit != UNBOUNDED;
    }

    /**
     * Free slots left, clamped at zero. {@link Long#MAX_VALUE} when unbounded.
     */
    public long remaining() {
        if (!isBounded()) return Long.MAX_VALUE;
        return Math.max(0L, limit - Math.max(0L, current));
    }

    /**
     * Snapshot with {@code current} moved by {@code delta}, same limit.
     */
    public Occupancy plus(long delta) {
        return new Occupancy(current + delta, limit);
    }
}
