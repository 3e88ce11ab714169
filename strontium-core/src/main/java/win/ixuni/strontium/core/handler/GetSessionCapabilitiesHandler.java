package win.ixuni.strontium.core.handler;

import win.ixuni.strontium.core.command.SessionCommandHandler;
import win.ixuni.strontium.core.session.DriverSession;
import win.ixuni.strontium.core.session.SessionManager;

import java.util.Map;

/**
 * Handler for {@code getCapabilities}
 */
public class GetSessionCapabilitiesHandler extends SessionCommandHandler {

    public GetSessionCapabilitiesHandler(SessionManager sessionManager, Map<String, String> locatorParameters,
                                         Map<String, Object> parameters) {
        super(sessionManager, locatorParameters, parameters);
    }

    @Override
    protected Object execute(DriverSession session) {
        return session.getCapabilities().asMap();
    }

    @Override
    public String describe() {
        return "[get session capabilities]";
    }
}
