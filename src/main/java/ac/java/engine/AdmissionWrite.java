package ac.java.engine;

import ac.core.model.Occupancy;

/**
 * Admitting write run under the role's lock once a free slot was observed.
 *
 * @param <T> Result of the write (e.g. the saved registration)
 * @param <E> Checked failure of the write, propagated unchanged
 */
@FunctionalInterface
public interface AdmissionWrite<T, E extends Exception> {
    T apply(Occupancy observed) throws E;
}
