package ac.java.store;

/**
 * Who holds a slot. Both kinds count against the same role capacity.
 */
public enum RegistrantKind {
    MEMBER,
    GUEST
}
