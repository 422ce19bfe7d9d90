package ac.java.engine;

import ac.core.cache.LruCache;
import ac.core.capacity.CapacityGuard;
import ac.core.capacity.CapacityProvider;
import ac.core.capacity.OccupancySource;
import ac.core.clock.Clock;
import ac.core.lock.LockGuard;
import ac.core.lock.LockManager;
import ac.core.lock.LockTimeoutException;
import ac.core.lock.LockedOperation;
import ac.core.model.Occupancy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe admission control for capacity-limited roles.
 *
 * Features:
 * - Check-then-admit runs inside the role's lock, so the last seat is handed out once
 * - Optional pre-lock check short-circuits roles that are already full
 * - Occupancy memo invalidated by every admitting, withdrawing or reconfiguring write,
 *   by capacity changes reported by the provider, and per event
 * - Moves between roles lock both keys in a fixed order (no deadlock)
 *
 * Architecture:
 * - LockManager serializes all writers of one role
 * - CapacityGuard reads occupancy from the two counting sources
 * - LruCache memoizes occupancy between writes
 *
 * Usage example:
 * <pre>
 * AdmissionEngine engine = AdmissionEngine.create(SystemClock.instance(),
 *     store.members(), store.guests(), store, AdmissionConfig.defaults());
 *
 * String key = RoleKey.of("event-1", "usher").asString();
 * AdmissionResult&lt;Void&gt; result = engine.admit(key, observed -&gt; {
 *     store.register(key, "user-7", RegistrantKind.MEMBER);
 *     return null;
 * });
 * switch (result.decision()) {
 *     case ADMITTED -&gt; ...
 *     case FULL -&gt; ...   // reject, role is full
 *     case BUSY -&gt; ...   // ask the client to retry
 * }
 * </pre>
 */
public final class AdmissionEngine {

    private static final Logger log = LoggerFactory.getLogger(AdmissionEngine.class);

    private final LockManager locks;
    private final CapacityGuard capacityGuard;
    private final AdmissionConfig config;

    /**
     * Creates an engine over existing components.
     *
     * @param locks Lock manager shared by every writer of the same roles
     * @param capacityGuard Occupancy reader
     * @param config Engine settings
     * @throws IllegalArgumentException if any parameter is null
     */
    public AdmissionEngine(LockManager locks, CapacityGuard capacityGuard, AdmissionConfig config) {
        if (locks == null) {
            throw new IllegalArgumentException("locks cannot be null");
        }
        if (capacityGuard == null) {
            throw new IllegalArgumentException("capacityGuard cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.locks = locks;
        this.capacityGuard = capacityGuard;
        this.config = config;
    }

    /**
     * Wires a lock manager, an occupancy cache and a capacity guard from the
     * persistence-side collaborators.
     *
     * @param clock Clock for lock grants and cache expiry
     * @param members Active member count per role
     * @param guests Active guest count per role
     * @param capacities Configured capacity per role
     * @param config Engine settings
     * @return A ready engine
     */
    public static AdmissionEngine create(
        Clock clock,
        OccupancySource members,
        OccupancySource guests,
        CapacityProvider capacities,
        AdmissionConfig config
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        LockManager locks = new LockManager(clock, config.lockOptions());
        LruCache<String, Occupancy> cache = new LruCache<>(clock, config.occupancyCacheConfig(),
            (key, occupancy) -> log.debug("Evicted occupancy for key={}", key));
        CapacityGuard guard = new CapacityGuard(members, guests, capacities, cache);
        capacities.addChangeListener(guard::invalidate);
        return new AdmissionEngine(locks, guard, config);
    }

    /**
     * Admits one registration to a role if a slot is free.
     *
     * The occupancy read, the fullness check and the write all run while holding
     * the role's lock. The write's failure propagates unchanged once the lock is
     * released; the role's memoized occupancy is dropped either way.
     *
     * @param resourceKey Role key (see {@link RoleKey#asString()})
     * @param write Persists the registration; receives the occupancy it was admitted against
     * @return ADMITTED with the write's result, FULL, or BUSY on lock timeout
     * @throws E if the write fails
     * @throws InterruptedException if interrupted while waiting for the lock
     */
    public <T, E extends Exception> AdmissionResult<T> admit(String resourceKey, AdmissionWrite<T, E> write)
        throws E, InterruptedException {
        if (resourceKey == null) {
            throw new IllegalArgumentException("resourceKey cannot be null");
        }
        if (write == null) {
            throw new IllegalArgumentException("write cannot be null");
        }

        // Saves a lock round trip for roles that are obviously full. Reads the sources,
        // not the memo: a stale memo must never turn away a registrant.
        if (config.preLockCheck()) {
            Occupancy advisory = capacityGuard.queryRoleOccupancy(resourceKey);
            if (CapacityGuard.isRoleFull(advisory)) {
                log.info("Role full before lock key={} current={} limit={}",
                    resourceKey, advisory.current(), advisory.limit());
                return AdmissionResult.full(advisory);
            }
        }

        LockGuard lock = acquireOrNull(resourceKey);
        if (lock == null) {
            return AdmissionResult.busy();
        }

        try (LockGuard held = lock) {
            Occupancy occupancy = capacityGuard.getRoleOccupancy(held);
            if (CapacityGuard.isRoleFull(occupancy)) {
                log.info("Role full key={} current={} limit={}",
                    resourceKey, occupancy.current(), occupancy.limit());
                return AdmissionResult.full(occupancy);
            }

            T value;
            try {
                value = write.apply(occupancy);
            } finally {
                capacityGuard.invalidate(resourceKey);
            }

            Occupancy after = occupancy.plus(1);
            log.info("Admitted key={} occupancy={}/{}", resourceKey, after.current(),
                after.isBounded() ? after.limit() : "unbounded");
            return AdmissionResult.admitted(value, after);
        }
    }

    /**
     * Runs a slot-releasing write (cancellation, removal) under the role's lock
     * and drops the role's memoized occupancy.
     *
     * @param resourceKey Role key
     * @param write Removes the registration
     * @return The write's result
     * @throws LockTimeoutException if the lock is not granted in time
     * @throws E if the write fails
     * @throws InterruptedException if interrupted while waiting for the lock
     */
    public <T, E extends Exception> T withdraw(String resourceKey, LockedOperation<T, E> write)
        throws E, InterruptedException {
        return runInvalidating(resourceKey, write);
    }

    /**
     * Runs a capacity change under the role's lock and drops the role's memoized
     * occupancy, so the change cannot interleave with a check-then-admit.
     *
     * @param resourceKey Role key
     * @param write Updates the role's capacity
     * @return The write's result
     * @throws LockTimeoutException if the lock is not granted in time
     * @throws E if the write fails
     * @throws InterruptedException if interrupted while waiting for the lock
     */
    public <T, E extends Exception> T reconfigure(String resourceKey, LockedOperation<T, E> write)
        throws E, InterruptedException {
        T value = runInvalidating(resourceKey, write);
        log.info("Reconfigured key={}", resourceKey);
        return value;
    }

    /**
     * Drops the memoized occupancy of every role of an event, for event-wide
     * edits made outside this engine.
     *
     * @param eventId Event whose roles changed
     * @return Number of memo entries removed
     */
    public int invalidateEvent(String eventId) {
        String prefix = RoleKey.eventPrefix(eventId);
        int removed = capacityGuard.invalidateMatching(key -> key.startsWith(prefix));
        log.info("Invalidated {} cached roles for event={}", removed, eventId);
        return removed;
    }

    private <T, E extends Exception> T runInvalidating(String resourceKey, LockedOperation<T, E> write)
        throws E, InterruptedException {
        if (write == null) {
            throw new IllegalArgumentException("write cannot be null");
        }

        return locks.withLock(resourceKey, () -> {
            try {
                return write.run();
            } finally {
                capacityGuard.invalidate(resourceKey);
            }
        }, config.lockOptions());
    }

    /**
     * Moves one registration from a role to another if the target has a free slot.
     *
     * Both keys are locked in lexicographic order. Only the target's capacity is
     * checked; the source just loses a holder.
     *
     * @param fromKey Role the registration leaves
     * @param toKey Role the registration joins
     * @param write Performs the move; receives the target occupancy
     * @return ADMITTED with the target's occupancy after the move, FULL, or BUSY
     * @throws E if the write fails
     * @throws InterruptedException if interrupted while waiting for a lock
     */
    public <T, E extends Exception> AdmissionResult<T> move(String fromKey, String toKey, AdmissionWrite<T, E> write)
        throws E, InterruptedException {
        if (fromKey == null || toKey == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        if (fromKey.equals(toKey)) {
            throw new IllegalArgumentException("cannot move within the same role: " + fromKey);
        }
        if (write == null) {
            throw new IllegalArgumentException("write cannot be null");
        }

        boolean targetFirst = toKey.compareTo(fromKey) < 0;
        String firstKey = targetFirst ? toKey : fromKey;
        String secondKey = targetFirst ? fromKey : toKey;

        LockGuard firstLock = acquireOrNull(firstKey);
        if (firstLock == null) {
            return AdmissionResult.busy();
        }
        try (LockGuard first = firstLock) {
            LockGuard secondLock = acquireOrNull(secondKey);
            if (secondLock == null) {
                return AdmissionResult.busy();
            }
            try (LockGuard second = secondLock) {
                LockGuard target = targetFirst ? first : second;
                Occupancy occupancy = capacityGuard.getRoleOccupancy(target);
                if (CapacityGuard.isRoleFull(occupancy)) {
                    log.info("Move rejected, target full from={} to={}", fromKey, toKey);
                    return AdmissionResult.full(occupancy);
                }

                T value;
                try {
                    value = write.apply(occupancy);
                } finally {
                    capacityGuard.invalidate(fromKey);
                    capacityGuard.invalidate(toKey);
                }

                log.info("Moved registration from={} to={}", fromKey, toKey);
                return AdmissionResult.admitted(value, occupancy.plus(1));
            }
        }
    }

    /**
     * Advisory occupancy read, outside any lock.
     *
     * @param resourceKey Role key
     * @return Possibly memoized snapshot
     */
    public Occupancy occupancy(String resourceKey) {
        return capacityGuard.getRoleOccupancy(resourceKey);
    }

    public LockManager locks() {
        return locks;
    }

    public CapacityGuard capacityGuard() {
        return capacityGuard;
    }

    public AdmissionConfig config() {
        return config;
    }

    private LockGuard acquireOrNull(String key) throws InterruptedException {
        try {
            return locks.tryAcquire(key, config.lockTimeoutMillis());
        } catch (LockTimeoutException e) {
            log.warn("Admission busy key={}: {}", key, e.getMessage());
            return null;
        }
    }
}
