package win.ixuni.strontium.core.driver;

import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;

/**
 * Driver factory for a driver class loaded by name
 * <p>
 * Prefers a public {@code (Capabilities)} constructor and falls back to a public no-arg one.
 */
@Slf4j
public class ReflectiveDriverFactory implements DriverFactory {

    private final Class<? extends AutomationDriver> driverType;
    private final Constructor<? extends AutomationDriver> constructor;
    private final boolean acceptsCapabilities;

    public ReflectiveDriverFactory(Class<? extends AutomationDriver> driverType) {
        if (driverType.isInterface() || Modifier.isAbstract(driverType.getModifiers())) {
            throw new IllegalArgumentException("Driver type is not a concrete class: " + driverType.getName());
        }
        this.driverType = driverType;
        Constructor<? extends AutomationDriver> withCapabilities = findConstructor(driverType, Capabilities.class);
        if (withCapabilities != null) {
            this.constructor = withCapabilities;
            this.acceptsCapabilities = true;
        } else {
            Constructor<? extends AutomationDriver> noArgs = findConstructor(driverType);
            if (noArgs == null) {
                throw new IllegalArgumentException("Driver type has no public (Capabilities) or no-arg constructor: "
                        + driverType.getName());
            }
            this.constructor = noArgs;
            this.acceptsCapabilities = false;
        }
    }

    @Override
    public String getDriverType() {
        return driverType.getName();
    }

    public Class<? extends AutomationDriver> getDriverClass() {
        return driverType;
    }

    @Override
    public AutomationDriver createDriver(Capabilities capabilities) {
        log.debug("Instantiating driver {} for {}", driverType.getName(), capabilities);
        try {
            return acceptsCapabilities ? constructor.newInstance(capabilities) : constructor.newInstance();
        } catch (InvocationTargetException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Driver constructor failed: " + driverType.getName(), cause);
        } catch (InstantiationException | IllegalAccessException e) {
            throw new IllegalStateException("Cannot instantiate driver: " + driverType.getName(), e);
        } catch (LinkageError e) {
            // Static initializer failures surface on first instantiation
            throw new IllegalStateException("Cannot initialize driver type " + driverType.getName() + ": " + e, e);
        }
    }

    private static Constructor<? extends AutomationDriver> findConstructor(
            Class<? extends AutomationDriver> type, Class<?>... parameterTypes) {
        try {
            Constructor<? extends AutomationDriver> candidate = type.getConstructor(parameterTypes);
            return Modifier.isPublic(type.getModifiers()) ? candidate : null;
        } catch (NoSuchMethodException e) {
            return null;
        }
    }
}
