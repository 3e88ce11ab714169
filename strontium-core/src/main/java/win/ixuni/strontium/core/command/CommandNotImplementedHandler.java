package win.ixuni.strontium.core.command;

import win.ixuni.strontium.core.exception.UnsupportedCommandException;

import java.util.Map;

/**
 * Fallback for commands with no registered handler
 */
public class CommandNotImplementedHandler extends CommandHandler {

    private final String commandName;

    public CommandNotImplementedHandler(String commandName, Map<String, String> locatorParameters,
                                        Map<String, Object> parameters) {
        super(locatorParameters, parameters);
        this.commandName = commandName;
    }

    public String getCommandName() {
        return commandName;
    }

    @Override
    public Object execute() {
        throw new UnsupportedCommandException(commandName);
    }

    @Override
    public String describe() {
        return "[command not implemented: " + commandName + "]";
    }
}
