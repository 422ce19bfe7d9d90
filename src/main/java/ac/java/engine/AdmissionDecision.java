package ac.java.engine;

/**
 * Outcome of an admission attempt.
 */
public enum AdmissionDecision {
    /** A slot was free and the admitting write ran. */
    ADMITTED,

    /** The role had no free slot. Business rejection, not an error. */
    FULL,

    /** The role's lock could not be acquired in time. Retryable. */
    BUSY
}
