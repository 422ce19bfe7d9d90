package ac.java.engine;

/**
 * Identity of a capacity-limited event role, used as both lock key and cache key.
 *
 * Member and guest sign-ups for the same role share this key, so both flows
 * serialize on one lock.
 *
 * @param eventId Event identifier
 * @param roleId Role identifier within the event
 */
public record RoleKey(String eventId, String roleId) {

    private static final String PREFIX = "role:";
    private static final char SEPARATOR = ':';

    public RoleKey {
        if (eventId == null || eventId.isEmpty()) throw new IllegalArgumentException("eventId must not be empty");
        if (eventId.indexOf(SEPARATOR) >= 0) throw new IllegalArgumentException("eventId must not contain ':'");
        if (roleId == null || roleId.isEmpty()) throw new IllegalArgumentException("roleId must not be empty");
    }

    public static RoleKey of(String eventId, String roleId) {
        return new RoleKey(eventId, roleId);
    }

    /**
     * @return {@code role:<eventId>:<roleId>}
     */
    public String asString() {
        return eventPrefix(eventId) + roleId;
    }

    /**
     * Common prefix of every role key of one event.
     *
     * @param eventId Event identifier
     * @return {@code role:<eventId>:}
     */
    public static String eventPrefix(String eventId) {
        if (eventId == null || eventId.isEmpty()) throw new IllegalArgumentException("eventId must not be empty");
        return PREFIX + eventId + SEPARATOR;
    }

    @Override
    public String toString() {
        return asString();
    }
}
