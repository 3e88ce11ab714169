package win.ixuni.strontium.core.handler;

import win.ixuni.strontium.core.command.SessionCommandHandler;
import win.ixuni.strontium.core.session.DriverSession;
import win.ixuni.strontium.core.session.SessionManager;

import java.util.Map;

/**
 * Handler for {@code getCurrentWindowHandle}
 */
public class GetCurrentWindowHandler extends SessionCommandHandler {

    public GetCurrentWindowHandler(SessionManager sessionManager, Map<String, String> locatorParameters,
                                   Map<String, Object> parameters) {
        super(sessionManager, locatorParameters, parameters);
    }

    @Override
    protected Object execute(DriverSession session) {
        return session.getDriver().getWindowHandle();
    }

    @Override
    public String describe() {
        return "[get current window handle]";
    }
}
