package win.ixuni.strontium.core.handler;

import win.ixuni.strontium.core.command.SessionCommandHandler;
import win.ixuni.strontium.core.driver.AutomationDriver;
import win.ixuni.strontium.core.driver.HasInputDevices;
import win.ixuni.strontium.core.driver.Mouse;
import win.ixuni.strontium.core.exception.DriverCapabilityNotSupportedException;
import win.ixuni.strontium.core.session.DriverSession;
import win.ixuni.strontium.core.session.SessionManager;

import java.util.Map;

/**
 * Mouse handler 抽象基类
 * <p>
 * Resolves the session driver's pointer device; subclasses only act on it.
 */
public abstract class AbstractMouseHandler extends SessionCommandHandler {

    protected AbstractMouseHandler(SessionManager sessionManager, Map<String, String> locatorParameters,
                                   Map<String, Object> parameters) {
        super(sessionManager, locatorParameters, parameters);
    }

    @Override
    protected final Object execute(DriverSession session) {
        AutomationDriver driver = session.getDriver();
        if (!(driver instanceof HasInputDevices)) {
            throw new DriverCapabilityNotSupportedException(HasInputDevices.class, driver.getClass().getName());
        }
        execute(((HasInputDevices) driver).getMouse());
        return null;
    }

    /**
     * Perform the pointer action at the last known coordinates
     *
     * @param mouse the driver's pointer device
     */
    protected abstract void execute(Mouse mouse);
}
