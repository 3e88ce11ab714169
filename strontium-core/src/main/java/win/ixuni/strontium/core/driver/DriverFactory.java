package win.ixuni.strontium.core.driver;

/**
 * Driver factory interface
 * <p>
 * A driver registration entry. Each registered backend provides a factory that creates one
 * driver instance per session.
 */
public interface DriverFactory {

    /**
     * Get the driver type this factory creates
     *
     * @return driver type identifier (the implementing class name for loaded drivers)
     */
    String getDriverType();

    /**
     * Create a driver instance for a new session
     *
     * @param capabilities capabilities requested by the client
     * @return driver instance
     */
    AutomationDriver createDriver(Capabilities capabilities);

    /**
     * Get the driver description
     *
     * @return description text
     */
    default String getDescription() {
        return getDriverType() + " automation driver";
    }
}
