package eventlog;

/**
 * Thrown at construction time for settings that can never work: an empty or out-of-bounds
 * slice range, a non-positive page size, a malformed persistence id, and the like.
 *
 * <p>Raised before any store call is made.
 */
public class InvalidConfigurationException extends IllegalArgumentException {
    public InvalidConfigurationException(String message) {
        super(message);
    }
}
