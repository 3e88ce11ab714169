package win.ixuni.strontium.core.command;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Protocol commands understood by the remote server
 * <p>
 * Each command carries its JSON wire protocol name. A server flavor registers handlers for the
 * subset it supports; everything else is answered with "unknown command".
 */
public enum DriverCommand {

    // ==================== Server & session ====================
    STATUS("status"),
    NEW_SESSION("newSession"),
    GET_ALL_SESSIONS("getAllSessions"),
    GET_CAPABILITIES("getCapabilities"),
    QUIT("quit"),
    SET_TIMEOUT("setTimeout"),

    // ==================== Navigation ====================
    GET("get"),
    GET_CURRENT_URL("getCurrentUrl"),
    GO_BACK("goBack"),
    GO_FORWARD("goForward"),
    REFRESH("refresh"),
    GET_TITLE("getTitle"),
    GET_PAGE_SOURCE("getPageSource"),
    SCREENSHOT("screenshot"),

    // ==================== Scripts ====================
    EXECUTE_SCRIPT("executeScript"),
    EXECUTE_ASYNC_SCRIPT("executeAsyncScript"),

    // ==================== Elements ====================
    FIND_ELEMENT("findElement"),
    FIND_ELEMENTS("findElements"),
    FIND_CHILD_ELEMENT("findChildElement"),
    FIND_CHILD_ELEMENTS("findChildElements"),
    GET_ACTIVE_ELEMENT("getActiveElement"),
    CLICK_ELEMENT("clickElement"),
    CLEAR_ELEMENT("clearElement"),
    SEND_KEYS_TO_ELEMENT("sendKeysToElement"),
    GET_ELEMENT_TEXT("getElementText"),
    GET_ELEMENT_ATTRIBUTE("getElementAttribute"),

    // ==================== Windows & frames ====================
    GET_CURRENT_WINDOW_HANDLE("getCurrentWindowHandle"),
    GET_WINDOW_HANDLES("getWindowHandles"),
    SWITCH_TO_WINDOW("switchToWindow"),
    SWITCH_TO_FRAME("switchToFrame"),
    CLOSE("close"),
    GET_WINDOW_SIZE("getWindowSize"),
    SET_WINDOW_SIZE("setWindowSize"),
    MAXIMIZE_WINDOW("maximizeWindow"),

    // ==================== Cookies ====================
    GET_ALL_COOKIES("getCookies"),
    ADD_COOKIE("addCookie"),
    DELETE_COOKIE("deleteCookie"),
    DELETE_ALL_COOKIES("deleteAllCookies"),

    // ==================== Alerts ====================
    ACCEPT_ALERT("acceptAlert"),
    DISMISS_ALERT("dismissAlert"),
    GET_ALERT_TEXT("getAlertText"),

    // ==================== Input devices ====================
    MOUSE_MOVE_TO("mouseMoveTo"),
    MOUSE_CLICK("mouseClick"),
    MOUSE_DOUBLE_CLICK("mouseDoubleClick"),
    MOUSE_DOWN("mouseButtonDown"),
    MOUSE_UP("mouseButtonUp"),
    SEND_KEYS_TO_ACTIVE_ELEMENT("sendKeysToActiveElement");

    private static final Map<String, DriverCommand> BY_NAME;

    static {
        Map<String, DriverCommand> byName = new HashMap<>();
        for (DriverCommand command : values()) {
            byName.put(command.commandName, command);
        }
        BY_NAME = Collections.unmodifiableMap(byName);
    }

    private final String commandName;

    DriverCommand(String commandName) {
        this.commandName = commandName;
    }

    /**
     * Get the wire protocol name
     *
     * @return command name, e.g. "getWindowHandles"
     */
    public String getCommandName() {
        return commandName;
    }

    /**
     * Look up a command by its wire protocol name
     *
     * @param commandName wire name, case-sensitive
     * @return the command, empty if the name is not part of the protocol
     */
    public static Optional<DriverCommand> fromName(String commandName) {
        if (commandName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_NAME.get(commandName));
    }

    @Override
    public String toString() {
        return commandName;
    }
}
