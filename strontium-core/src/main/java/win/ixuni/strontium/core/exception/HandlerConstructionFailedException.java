package win.ixuni.strontium.core.exception;

import lombok.Getter;

/**
 * A required locator or body parameter is missing or malformed
 */
@Getter
public class HandlerConstructionFailedException extends StrontiumException {

    private final String parameterName;

    public HandlerConstructionFailedException(String parameterName, String message) {
        super("invalid argument", message, 400);
        this.parameterName = parameterName;
    }

    public HandlerConstructionFailedException(String parameterName, String message, Throwable cause) {
        super("invalid argument", message, 400, cause);
        this.parameterName = parameterName;
    }
}
