package win.ixuni.strontium.core.exception;

/**
 * Driver capability not supported exception
 * <p>
 * Thrown when the session's driver does not implement an optional capability
 * (for example input devices) that a command needs.
 */
public class DriverCapabilityNotSupportedException extends StrontiumException {

    private final Class<?> capability;
    private final String driverType;

    public DriverCapabilityNotSupportedException(Class<?> capability, String driverType) {
        super("unsupported operation",
                String.format("The driver '%s' does not implement '%s'",
                        driverType, capability.getSimpleName()),
                500);
        this.capability = capability;
        this.driverType = driverType;
    }

    public Class<?> getCapability() {
        return capability;
    }

    public String getDriverType() {
        return driverType;
    }
}
