package ac.java.store;

import ac.core.capacity.CapacityProvider;
import ac.core.capacity.OccupancySource;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process registration store backing the admission engine in the server and in tests.
 *
 * Keeps, per role key, the registrants holding a slot and their kind, plus the
 * role's configured capacity. Exposes the member and guest counts as two
 * independent {@link OccupancySource}s.
 *
 * Thread-safety: individual operations are atomic per role. Capacity is NOT
 * enforced here; callers run {@link #register} inside the role's lock after an
 * occupancy check. A role's holder map is dropped when its last holder leaves.
 *
 * Capacity changes are reported to listeners registered with
 * {@link #addChangeListener}, after the new value is visible.
 */
public final class InMemoryRegistrationStore implements CapacityProvider {

    private final Map<String, Map<String, RegistrantKind>> registrations = new ConcurrentHashMap<>();
    private final Map<String, Long> capacities = new ConcurrentHashMap<>();
    private final List<Consumer<String>> capacityListeners = new CopyOnWriteArrayList<>();

    /**
     * Records a registration.
     *
     * @param resourceKey Role key
     * @param registrantId User id or guest e-mail
     * @param kind Member or guest
     * @throws DuplicateRegistrationException if the registrant already holds the role
     */
    public void register(String resourceKey, String registrantId, RegistrantKind kind) {
        if (resourceKey == null || registrantId == null || kind == null) {
            throw new IllegalArgumentException("resourceKey, registrantId and kind cannot be null");
        }
        boolean[] duplicate = new boolean[1];
        // Inside compute so a concurrent remove cannot drop the map under us
        registrations.compute(resourceKey, (k, holders) -> {
            Map<String, RegistrantKind> target = holders == null ? new ConcurrentHashMap<>() : holders;
            duplicate[0] = target.putIfAbsent(registrantId, kind) != null;
            return target;
        });
        if (duplicate[0]) {
            throw new DuplicateRegistrationException(resourceKey, registrantId);
        }
    }

    /**
     * Deletes a registration.
     *
     * @param resourceKey Role key
     * @param registrantId Registrant to remove
     * @return Kind of the removed registration
     * @throws RegistrationNotFoundException if the registrant holds no slot
     */
    public RegistrantKind remove(String resourceKey, String registrantId) {
        if (resourceKey == null || registrantId == null) {
            throw new IllegalArgumentException("resourceKey and registrantId cannot be null");
        }
        RegistrantKind[] removedKind = new RegistrantKind[1];
        registrations.computeIfPresent(resourceKey, (k, holders) -> {
            removedKind[0] = holders.remove(registrantId);
            return holders.isEmpty() ? null : holders;
        });
        RegistrantKind removed = removedKind[0];
        if (removed == null) {
            throw new RegistrationNotFoundException(resourceKey, registrantId);
        }
        return removed;
    }

    public Optional<RegistrantKind> find(String resourceKey, String registrantId) {
        Map<String, RegistrantKind> holders = registrations.get(resourceKey);
        return holders == null ? Optional.empty() : Optional.ofNullable(holders.get(registrantId));
    }

    public long count(String resourceKey, RegistrantKind kind) {
        Map<String, RegistrantKind> holders = registrations.get(resourceKey);
        if (holders == null) return 0L;
        return holders.values().stream().filter(k -> k == kind).count();
    }

    public OccupancySource members() {
        return key -> count(key, RegistrantKind.MEMBER);
    }

    public OccupancySource guests() {
        return key -> count(key, RegistrantKind.GUEST);
    }

    public void setCapacity(String resourceKey, long limit) {
        if (resourceKey == null) throw new IllegalArgumentException("resourceKey cannot be null");
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        capacities.put(resourceKey, limit);
        notifyCapacityChanged(resourceKey);
    }

    public void clearCapacity(String resourceKey) {
        if (resourceKey == null) throw new IllegalArgumentException("resourceKey cannot be null");
        capacities.remove(resourceKey);
        notifyCapacityChanged(resourceKey);
    }

    @Override
    public void addChangeListener(Consumer<String> listener) {
        if (listener == null) throw new IllegalArgumentException("listener cannot be null");
        capacityListeners.add(listener);
    }

    int trackedRoleCount() {
        return registrations.size();
    }

    private void notifyCapacityChanged(String resourceKey) {
        for (Consumer<String> listener : capacityListeners) {
            listener.accept(resourceKey);
        }
    }

    @Override
    public OptionalLong capacityOf(String resourceKey) {
        Long limit = capacities.get(resourceKey);
        return limit == null ? OptionalLong.empty() : OptionalLong.of(limit);
    }
}
