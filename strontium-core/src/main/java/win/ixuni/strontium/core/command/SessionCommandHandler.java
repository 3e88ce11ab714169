package win.ixuni.strontium.core.command;

import win.ixuni.strontium.core.exception.SessionNotFoundException;
import win.ixuni.strontium.core.session.DriverSession;
import win.ixuni.strontium.core.session.SessionManager;

import java.util.Map;

/**
 * Base class for handlers that act on one session's driver
 * <p>
 * The session is looked up when the handler executes, and the command body runs while holding
 * the session's lock. Exceptions thrown by the driver reach the caller unchanged.
 */
public abstract class SessionCommandHandler extends CommandHandler {

    public static final String SESSION_ID_PARAMETER = "sessionId";

    private final SessionManager sessionManager;
    private final String sessionId;

    protected SessionCommandHandler(SessionManager sessionManager, Map<String, String> locatorParameters,
                                    Map<String, Object> parameters) {
        super(locatorParameters, parameters);
        this.sessionManager = sessionManager;
        this.sessionId = getLocatorParameters().get(SESSION_ID_PARAMETER);
    }

    @Override
    public final Object execute() {
        DriverSession session = sessionManager.getSession(sessionId)
                .orElseThrow(() -> new SessionNotFoundException(sessionId));
        return session.execute(() -> execute(session));
    }

    /**
     * Execute against the resolved session; the session lock is held
     *
     * @param session target session
     * @return result, or null for commands without a value
     */
    protected abstract Object execute(DriverSession session);

    protected SessionManager getSessionManager() {
        return sessionManager;
    }

    protected String getSessionId() {
        return sessionId;
    }
}
