package ac.java.store;

/**
 * The registrant holds no slot in the role.
 */
public class RegistrationNotFoundException extends RuntimeException {

    public RegistrationNotFoundException(String resourceKey, String registrantId) {
        super("Registrant " + registrantId + " is not signed up for " + resourceKey);
    }
}
