package ac.java.store;

/**
 * The registrant already holds a slot in the role.
 */
public class DuplicateRegistrationException extends RuntimeException {

    public DuplicateRegistrationException(String resourceKey, String registrantId) {
        super("Registrant " + registrantId + " is already signed up for " + resourceKey);
    }
}
