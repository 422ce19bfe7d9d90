package ac.core.capacity;

import ac.core.cache.LruCache;
import ac.core.lock.LockGuard;
import ac.core.model.Occupancy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.OptionalLong;
import java.util.function.Predicate;

/**
 * Answers "how full is this resource" and "is it full".
 *
 * Occupancy is the sum of two independent sources (confirmed members and
 * confirmed guests) against the configured capacity. Reads may be memoized in
 * an {@link LruCache}; every write that changes occupancy must call
 * {@link #invalidate(String)} for the affected key.
 *
 * The check is only authoritative when it runs inside a
 * {@link ac.core.lock.LockManager} critical section keyed by the same resource,
 * together with the admitting write. Outside a lock it is advisory.
 * {@link #getRoleOccupancy(LockGuard)} enforces that by demanding a live guard.
 */
public final class CapacityGuard {

    private static final Logger log = LoggerFactory.getLogger(CapacityGuard.class);

    private final OccupancySource members;
    private final OccupancySource guests;
    private final CapacityProvider capacities;
    private final LruCache<String, Occupancy> cache;

    /**
     * Creates a guard.
     *
     * @param members Active member registrations per resource
     * @param guests Active guest registrations per resource
     * @param capacities Configured limit per resource
     * @param cache Occupancy memo (can be null to always query)
     * @throws IllegalArgumentException if a source or the provider is null
     */
    public CapacityGuard(
        OccupancySource members,
        OccupancySource guests,
        CapacityProvider capacities,
        LruCache<String, Occupancy> cache
    ) {
        if (members == null) {
            throw new IllegalArgumentException("members cannot be null");
        }
        if (guests == null) {
            throw new IllegalArgumentException("guests cannot be null");
        }
        if (capacities == null) {
            throw new IllegalArgumentException("capacities cannot be null");
        }
        this.members = members;
        this.guests = guests;
        this.capacities = capacities;
        this.cache = cache;
    }

    public CapacityGuard(OccupancySource members, OccupancySource guests, CapacityProvider capacities) {
        this(members, guests, capacities, null);
    }

    /**
     * Current occupancy of a resource, served from the memo when fresh.
     *
     * @param resourceKey Resource to count
     * @return Fresh snapshot
     */
    public Occupancy getRoleOccupancy(String resourceKey) {
        if (resourceKey == null) {
            throw new IllegalArgumentException("resourceKey cannot be null");
        }
        if (cache == null) {
            return query(resourceKey);
        }
        Optional<Occupancy> occupancy = cache.getOrLoad(resourceKey, key -> Optional.of(query(key)));
        return occupancy.orElseGet(() -> query(resourceKey));
    }

    /**
     * Current occupancy straight from the sources, without reading or filling the memo.
     *
     * @param resourceKey Resource to count
     * @return Fresh snapshot
     */
    public Occupancy queryRoleOccupancy(String resourceKey) {
        if (resourceKey == null) {
            throw new IllegalArgumentException("resourceKey cannot be null");
        }
        return query(resourceKey);
    }

    /**
     * Authoritative occupancy of the resource a live guard holds.
     *
     * Bypasses the memo and refreshes it with the result.
     *
     * @param guard Guard currently holding the resource key
     * @return Fresh snapshot for {@code guard.key()}
     * @throws IllegalStateException if the guard no longer holds its key
     */
    public Occupancy getRoleOccupancy(LockGuard guard) {
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        if (!guard.isHeld()) {
            throw new IllegalStateException("Occupancy requested with a released lock: " + guard.key());
        }
        Occupancy occupancy = query(guard.key());
        if (cache != null) {
            cache.set(guard.key(), occupancy);
        }
        return occupancy;
    }

    /**
     * @param occupancy Snapshot to judge
     * @return true iff the resource is bounded and no slot is left
     */
    public static boolean isRoleFull(Occupancy occupancy) {
        if (occupancy == null) {
            throw new IllegalArgumentException("occupancy cannot be null");
        }
        if (!occupancy.isBounded()) {
            return false;
        }
        return Math.max(0L, occupancy.current()) >= occupancy.limit();
    }

    /**
     * Drops the memoized occupancy for a resource.
     *
     * @param resourceKey Resource whose occupancy changed
     */
    public void invalidate(String resourceKey) {
        if (cache != null) {
            cache.delete(resourceKey);
        }
    }

    /**
     * Drops the memoized occupancy of every matching resource.
     *
     * @param resourceKeys Selects the keys to drop
     * @return Number of memo entries removed
     */
    public int invalidateMatching(Predicate<String> resourceKeys) {
        if (resourceKeys == null) {
            throw new IllegalArgumentException("resourceKeys cannot be null");
        }
        if (cache == null) {
            return 0;
        }
        int removed = cache.deleteIf(resourceKeys);
        log.debug("Invalidated {} memoized occupancies", removed);
        return removed;
    }

    private Occupancy query(String resourceKey) {
        long current = members.countActive(resourceKey) + guests.countActive(resourceKey);
        OptionalLong limit = capacities.capacityOf(resourceKey);
        Occupancy occupancy = limit.isPresent()
            ? Occupancy.bounded(current, limit.getAsLong())
            : Occupancy.unbounded(current);
        log.debug("Occupancy key={} current={} limit={}", resourceKey, occupancy.current(),
            occupancy.isBounded() ? occupancy.limit() : "unbounded");
        return occupancy;
    }
}
