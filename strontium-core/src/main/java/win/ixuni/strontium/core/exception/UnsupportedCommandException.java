package win.ixuni.strontium.core.exception;

import lombok.Getter;

/**
 * No handler is registered for the requested command
 */
@Getter
public class UnsupportedCommandException extends StrontiumException {

    private final String commandName;

    public UnsupportedCommandException(String commandName) {
        super("unknown command", "Command not implemented: " + commandName, 404);
        this.commandName = commandName;
    }
}
