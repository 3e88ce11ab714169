package win.ixuni.strontium.core.handler;

import win.ixuni.strontium.core.command.SessionCommandHandler;
import win.ixuni.strontium.core.session.DriverSession;
import win.ixuni.strontium.core.session.SessionManager;

import java.util.List;
import java.util.Map;

/**
 * Handler for {@code getWindowHandles}
 */
public class GetAllWindowsHandler extends SessionCommandHandler {

    public GetAllWindowsHandler(SessionManager sessionManager, Map<String, String> locatorParameters,
                                Map<String, Object> parameters) {
        super(sessionManager, locatorParameters, parameters);
    }

    /**
     * @return the handles of all open windows, in the order the driver reports them
     */
    @Override
    protected Object execute(DriverSession session) {
        List<String> windowHandles = session.getDriver().getWindowHandles();
        return windowHandles.toArray(new String[0]);
    }

    @Override
    public String describe() {
        return "[get all window handles]";
    }
}
