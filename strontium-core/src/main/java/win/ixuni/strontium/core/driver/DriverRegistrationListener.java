package win.ixuni.strontium.core.driver;

/**
 * Receives driver registration failures
 * <p>
 * Called synchronously, on the registering thread, at the point of failure.
 */
@FunctionalInterface
public interface DriverRegistrationListener {

    /**
     * @param typeDescriptor the descriptor exactly as passed to the registry
     * @param reason         human-readable failure reason
     */
    void onRegistrationFailed(String typeDescriptor, String reason);
}
