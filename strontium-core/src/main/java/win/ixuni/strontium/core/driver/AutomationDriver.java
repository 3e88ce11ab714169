package win.ixuni.strontium.core.driver;

import java.util.List;

/**
 * Automation driver interface
 * <p>
 * The capability every pluggable backend must expose to be registered. The server only
 * invokes these actions; it never implements them.
 */
public interface AutomationDriver {

    /**
     * Get the handles of all open windows
     *
     * @return window handles, in the order the backend reports them
     */
    List<String> getWindowHandles();

    /**
     * Get the handle of the window that currently has focus
     *
     * @return window handle
     */
    String getWindowHandle();

    /**
     * Close every window and release the backend
     */
    void quit();
}
