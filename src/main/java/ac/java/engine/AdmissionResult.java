package ac.java.engine;

import ac.core.model.Occupancy;

/**
 * Result of {@link AdmissionEngine#admit} or {@link AdmissionEngine#move}.
 *
 * @param decision What happened
 * @param value Result of the admitting write, null unless ADMITTED
 * @param occupancy Occupancy after the decision (null when BUSY, nothing was read)
 */
public record AdmissionResult<T>(
    AdmissionDecision decision,
    T value,
    Occupancy occupancy
) {
    public static <T> AdmissionResult<T> admitted(T value, Occupancy occupancy) {
        return new AdmissionResult<>(AdmissionDecision.ADMITTED, value, occupancy);
    }

    public static <T> AdmissionResult<T> full(Occupancy occupancy) {
        return new AdmissionResult<>(AdmissionDecision.FULL, null, occupancy);
    }

    public static <T> AdmissionResult<T> busy() {
        return new AdmissionResult<>(AdmissionDecision.BUSY, null, null);
    }

    public boolean isAdmitted() {
        return decision == AdmissionDecision.ADMITTED;
    }
}
