package win.ixuni.strontium.core.exception;

/**
 * Thrown when no registered driver matches the requested capabilities or the driver
 * could not be instantiated
 */
public class SessionCreationFailedException extends StrontiumException {

    public SessionCreationFailedException(String message) {
        super("session not created", message, 500);
    }

    public SessionCreationFailedException(String message, Throwable cause) {
        super("session not created", message, 500, cause);
    }
}
