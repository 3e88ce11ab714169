package win.ixuni.strontium.core.handler;

import win.ixuni.strontium.core.command.CommandHandler;
import win.ixuni.strontium.core.driver.Capabilities;
import win.ixuni.strontium.core.session.DriverSession;
import win.ixuni.strontium.core.session.SessionId;
import win.ixuni.strontium.core.session.SessionManager;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handler for {@code newSession}
 */
public class NewSessionHandler extends CommandHandler {

    public static final String DESIRED_CAPABILITIES_PARAMETER = "desiredCapabilities";

    private final SessionManager sessionManager;
    private final Capabilities desiredCapabilities;

    @SuppressWarnings("unchecked")
    public NewSessionHandler(SessionManager sessionManager, Map<String, String> locatorParameters,
                             Map<String, Object> parameters) {
        super(locatorParameters, parameters);
        this.sessionManager = sessionManager;
        this.desiredCapabilities = Capabilities.of(
                getCommandParameter(DESIRED_CAPABILITIES_PARAMETER, Map.class));
    }

    /**
     * @return {@code sessionId} and {@code capabilities} of the new session
     */
    @Override
    public Object execute() {
        SessionId sessionId = sessionManager.createSession(desiredCapabilities);
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("sessionId", sessionId.toString());
        result.put("capabilities", sessionManager.getSession(sessionId)
                .map(DriverSession::getCapabilities)
                .orElse(desiredCapabilities)
                .asMap());
        return result;
    }

    @Override
    public String describe() {
        return "[new session: " + desiredCapabilities + "]";
    }
}
