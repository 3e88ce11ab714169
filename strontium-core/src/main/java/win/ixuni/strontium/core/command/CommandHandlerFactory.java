package win.ixuni.strontium.core.command;

import lombok.extern.slf4j.Slf4j;
import win.ixuni.strontium.core.session.SessionManager;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Creates {@link CommandHandler} instances for protocol commands
 * <p>
 * Each server flavor subclasses this factory and registers its handlers in
 * {@link #addHandlers()}, which runs once from the constructor. The mapping is read-only
 * afterwards. Commands without a handler resolve to a {@link CommandNotImplementedHandler}, so
 * dispatch always yields a handler.
 */
@Slf4j
public abstract class CommandHandlerFactory {

    private final Object creationLock = new Object();

    private final Map<DriverCommand, CommandHandlerConstructor> handlers = new EnumMap<>(DriverCommand.class);

    private final SessionManager sessionManager;

    /**
     * @param sessionManager session store handed to session-bound handlers; available to
     *                       {@link #addHandlers()} through {@link #getSessionManager()}
     */
    protected CommandHandlerFactory(SessionManager sessionManager) {
        this.sessionManager = sessionManager;
        addHandlers();
        log.info("Registered {} command handlers in {}", handlers.size(), getClass().getSimpleName());
    }

    /**
     * Register the handlers of this server flavor
     * <p>
     * Called from the constructor, before subclass fields are assigned. Implementations may only
     * use {@link #register} and {@link #getSessionManager()}.
     */
    protected abstract void addHandlers();

    /**
     * Map a command to a handler constructor; a later registration for the same command wins
     */
    protected void register(DriverCommand command, CommandHandlerConstructor constructor) {
        CommandHandlerConstructor previous = handlers.put(command, constructor);
        if (previous != null) {
            log.debug("Replaced handler for command: {}", command);
        } else {
            log.debug("Registered handler for command: {}", command);
        }
    }

    protected SessionManager getSessionManager() {
        return sessionManager;
    }

    /**
     * Create a handler for a command
     *
     * @param command           the command
     * @param locatorParameters parameters from the request path
     * @param parameters        parameters from the request body
     * @return a handler able to execute the command, or a handler failing with
     *         {@code UnsupportedCommandException} if the command is not registered
     */
    public CommandHandler createHandler(DriverCommand command, Map<String, String> locatorParameters,
                                        Map<String, Object> parameters) {
        CommandHandlerConstructor constructor = handlers.get(command);
        if (constructor == null) {
            return notImplemented(String.valueOf(command), locatorParameters, parameters);
        }
        synchronized (creationLock) {
            return constructor.create(locatorParameters, parameters);
        }
    }

    /**
     * Create a handler for a command given by its wire name
     * <p>
     * Names outside the protocol resolve to the not-implemented handler as well.
     */
    public CommandHandler createHandler(String commandName, Map<String, String> locatorParameters,
                                        Map<String, Object> parameters) {
        return DriverCommand.fromName(commandName)
                .map(command -> createHandler(command, locatorParameters, parameters))
                .orElseGet(() -> notImplemented(commandName, locatorParameters, parameters));
    }

    public boolean canCreateHandler(DriverCommand command) {
        return handlers.containsKey(command);
    }

    public Set<DriverCommand> getSupportedCommands() {
        if (handlers.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(EnumSet.copyOf(handlers.keySet()));
    }

    private CommandHandler notImplemented(String commandName, Map<String, String> locatorParameters,
                                          Map<String, Object> parameters) {
        log.debug("No handler registered for command: {}", commandName);
        return new CommandNotImplementedHandler(commandName, locatorParameters, parameters);
    }
}
