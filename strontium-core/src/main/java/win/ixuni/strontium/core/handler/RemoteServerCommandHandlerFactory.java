package win.ixuni.strontium.core.handler;

import win.ixuni.strontium.core.command.CommandHandlerFactory;
import win.ixuni.strontium.core.command.DriverCommand;
import win.ixuni.strontium.core.session.SessionManager;

/**
 * Command handler factory of the remote server
 */
public class RemoteServerCommandHandlerFactory extends CommandHandlerFactory {

    public RemoteServerCommandHandlerFactory(SessionManager sessionManager) {
        super(sessionManager);
    }

    @Override
    protected void addHandlers() {
        SessionManager sessions = getSessionManager();

        // Session handlers (4)
        register(DriverCommand.NEW_SESSION, (locator, params) -> new NewSessionHandler(sessions, locator, params));
        register(DriverCommand.GET_ALL_SESSIONS, (locator, params) -> new GetSessionListHandler(sessions, locator, params));
        register(DriverCommand.GET_CAPABILITIES,
                (locator, params) -> new GetSessionCapabilitiesHandler(sessions, locator, params));
        register(DriverCommand.QUIT, (locator, params) -> new QuitSessionHandler(sessions, locator, params));

        // Window handlers (2)
        register(DriverCommand.GET_CURRENT_WINDOW_HANDLE,
                (locator, params) -> new GetCurrentWindowHandler(sessions, locator, params));
        register(DriverCommand.GET_WINDOW_HANDLES, (locator, params) -> new GetAllWindowsHandler(sessions, locator, params));

        // Mouse handlers (2)
        register(DriverCommand.MOUSE_CLICK, (locator, params) -> new MouseClickHandler(sessions, locator, params));
        register(DriverCommand.MOUSE_DOUBLE_CLICK,
                (locator, params) -> new MouseDoubleClickHandler(sessions, locator, params));
    }
}
