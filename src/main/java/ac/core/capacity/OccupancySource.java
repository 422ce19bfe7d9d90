package ac.core.capacity;

/**
 * Counts active registrations held against a resource.
 *
 * Implemented by the persistence layer: one source for members, one for guests.
 */
@FunctionalInterface
public interface OccupancySource {
    long countActive(String resourceKey);
}
