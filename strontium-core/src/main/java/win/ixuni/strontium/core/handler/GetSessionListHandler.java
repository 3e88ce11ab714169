package win.ixuni.strontium.core.handler;

import win.ixuni.strontium.core.command.CommandHandler;
import win.ixuni.strontium.core.session.SessionManager;

import java.util.Map;

/**
 * Handler for {@code getAllSessions}
 */
public class GetSessionListHandler extends CommandHandler {

    private final SessionManager sessionManager;

    public GetSessionListHandler(SessionManager sessionManager, Map<String, String> locatorParameters,
                                 Map<String, Object> parameters) {
        super(locatorParameters, parameters);
        this.sessionManager = sessionManager;
    }

    @Override
    public Object execute() {
        return sessionManager.listSessionIds();
    }

    @Override
    public String describe() {
        return "[get all sessions]";
    }
}
