package win.ixuni.strontium.core.handler;

import win.ixuni.strontium.core.driver.Mouse;
import win.ixuni.strontium.core.session.SessionManager;

import java.util.Map;

/**
 * Handler for {@code mouseDoubleClick}
 */
public class MouseDoubleClickHandler extends AbstractMouseHandler {

    public MouseDoubleClickHandler(SessionManager sessionManager, Map<String, String> locatorParameters,
                                   Map<String, Object> parameters) {
        super(sessionManager, locatorParameters, parameters);
    }

    @Override
    protected void execute(Mouse mouse) {
        mouse.doubleClick();
    }

    @Override
    public String describe() {
        return "[double-click mouse]";
    }
}
