package ac.core.capacity;

import java.util.OptionalLong;
import java.util.function.Consumer;

/**
 * Looks up the configured capacity of a resource. Empty means unbounded.
 */
@FunctionalInterface
public interface CapacityProvider {
    OptionalLong capacityOf(String resourceKey);

    /**
     * Registers a callback run with the resource key after its capacity changes.
     * Providers whose capacities never change can keep the no-op default.
     *
     * @param listener Receives the key whose capacity changed
     */
    default void addChangeListener(Consumer<String> listener) {
    }
}
