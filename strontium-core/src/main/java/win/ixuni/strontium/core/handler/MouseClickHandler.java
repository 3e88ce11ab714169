package win.ixuni.strontium.core.handler;

import win.ixuni.strontium.core.driver.Mouse;
import win.ixuni.strontium.core.session.SessionManager;

import java.util.Map;

/**
 * Handler for {@code mouseClick}
 * <p>
 * Button {@code 0} is the primary button; any other button code performs a context click.
 */
public class MouseClickHandler extends AbstractMouseHandler {

    public static final String BUTTON_PARAMETER = "button";

    private static final int PRIMARY_BUTTON = 0;

    private final boolean primaryButton;

    public MouseClickHandler(SessionManager sessionManager, Map<String, String> locatorParameters,
                             Map<String, Object> parameters) {
        super(sessionManager, locatorParameters, parameters);
        int button = getIntegerParameter(BUTTON_PARAMETER);
        this.primaryButton = button == PRIMARY_BUTTON;
    }

    @Override
    protected void execute(Mouse mouse) {
        if (primaryButton) {
            mouse.click();
        } else {
            mouse.contextClick();
        }
    }

    @Override
    public String describe() {
        return "[click mouse]";
    }
}
