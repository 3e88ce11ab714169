package win.ixuni.strontium.core.driver;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.strontium.core.exception.DriverRegistrationFailedException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * 驱动注册表
 * <p>
 * Maps capability keys to driver factories. Drivers are registered either by descriptor
 * ({@link #registerDriver(Capabilities, String, DriverRegistrationListener)}), in which case the
 * type is loaded through the {@link DriverTypeLoader}, or directly with a known factory.
 * <p>
 * Registration by descriptor never throws: failures go to the listener and leave the registry
 * exactly as it was.
 */
@Slf4j
public class DriverRegistry {

    private static final DriverRegistrationListener LOGGING_LISTENER = (typeDescriptor, reason) ->
            log.warn("Driver registration failed for '{}': {}", typeDescriptor, reason);

    private final DriverTypeLoader typeLoader;

    /**
     * Capability key -> factory, in registration order
     */
    private final Map<Capabilities, DriverFactory> factories = new LinkedHashMap<>();

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public DriverRegistry(DriverTypeLoader typeLoader) {
        this.typeLoader = typeLoader;
    }

    /**
     * Register a driver by type descriptor, reporting failures to the log
     *
     * @param capabilities   capability key the driver serves
     * @param typeDescriptor {@code "TypeName"} or {@code "TypeName, ModuleName"}
     * @return true if the driver was registered
     */
    public boolean registerDriver(Capabilities capabilities, String typeDescriptor) {
        return registerDriver(capabilities, typeDescriptor, LOGGING_LISTENER);
    }

    /**
     * Register a driver by type descriptor
     *
     * @param capabilities   capability key the driver serves
     * @param typeDescriptor {@code "TypeName"} or {@code "TypeName, ModuleName"}
     * @param listener       notified once if the registration fails
     * @return true if the driver was registered
     */
    public boolean registerDriver(Capabilities capabilities, String typeDescriptor,
                                  DriverRegistrationListener listener) {
        DriverFactory factory;
        try {
            factory = createFactory(typeDescriptor);
        } catch (DriverRegistrationFailedException e) {
            log.debug("Driver registration failed", e);
            listener.onRegistrationFailed(typeDescriptor, e.getReason());
            return false;
        } catch (RuntimeException | LinkageError e) {
            log.debug("Unexpected error registering driver", e);
            listener.onRegistrationFailed(typeDescriptor,
                    "Unexpected error loading driver type: " + e);
            return false;
        }
        register(capabilities, factory);
        return true;
    }

    /**
     * Register a known driver factory
     *
     * @param capabilities capability key the driver serves
     * @param factory      driver factory
     */
    public void register(Capabilities capabilities, DriverFactory factory) {
        Capabilities key = capabilities != null ? capabilities : Capabilities.empty();
        lock.writeLock().lock();
        try {
            DriverFactory previous = factories.put(key, factory);
            if (previous != null) {
                log.info("Replaced driver {} with {} for {}", previous.getDriverType(), factory.getDriverType(), key);
            } else {
                log.info("Registered driver {} for {}", factory.getDriverType(), key);
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Find the first registered driver whose capability key matches the request
     *
     * @param requested requested capabilities
     * @return matching factory, empty if none matches
     */
    public Optional<DriverFactory> resolve(Capabilities requested) {
        lock.readLock().lock();
        try {
            for (Map.Entry<Capabilities, DriverFactory> entry : factories.entrySet()) {
                if (entry.getKey().matches(requested)) {
                    return Optional.of(entry.getValue());
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Capabilities> getRegisteredCapabilities() {
        lock.readLock().lock();
        try {
            return List.copyOf(factories.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return factories.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private DriverFactory createFactory(String typeDescriptor) {
        Class<?> type = typeLoader.loadType(typeDescriptor);
        if (!AutomationDriver.class.isAssignableFrom(type)) {
            throw new DriverRegistrationFailedException(typeDescriptor,
                    "Class " + type.getName() + " does not implement " + AutomationDriver.class.getSimpleName());
        }
        try {
            return new ReflectiveDriverFactory(type.asSubclass(AutomationDriver.class));
        } catch (IllegalArgumentException e) {
            throw new DriverRegistrationFailedException(typeDescriptor, e.getMessage(), e);
        }
    }
}
