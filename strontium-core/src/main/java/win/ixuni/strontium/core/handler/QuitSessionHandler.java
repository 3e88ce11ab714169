package win.ixuni.strontium.core.handler;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.strontium.core.command.SessionCommandHandler;
import win.ixuni.strontium.core.session.DriverSession;
import win.ixuni.strontium.core.session.SessionManager;

import java.util.Map;

/**
 * Handler for {@code quit}
 * <p>
 * Removes the session from the store, then quits its driver. A driver failure during quit is
 * reported to the caller; the session stays removed.
 */
@Slf4j
public class QuitSessionHandler extends SessionCommandHandler {

    public QuitSessionHandler(SessionManager sessionManager, Map<String, String> locatorParameters,
                              Map<String, Object> parameters) {
        super(sessionManager, locatorParameters, parameters);
    }

    @Override
    protected Object execute(DriverSession session) {
        getSessionManager().removeSession(session.getId());
        session.quit();
        log.info("Session {} quit", session.getId());
        return null;
    }

    @Override
    public String describe() {
        return "[quit session]";
    }
}
