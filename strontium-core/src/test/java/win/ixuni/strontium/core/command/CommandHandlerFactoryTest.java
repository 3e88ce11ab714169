package win.ixuni.strontium.core.command;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import win.ixuni.strontium.core.driver.DriverRegistry;
import win.ixuni.strontium.core.driver.DriverTypeLoader;
import win.ixuni.strontium.core.exception.HandlerConstructionFailedException;
import win.ixuni.strontium.core.exception.UnsupportedCommandException;
import win.ixuni.strontium.core.handler.GetAllWindowsHandler;
import win.ixuni.strontium.core.handler.MouseClickHandler;
import win.ixuni.strontium.core.handler.RemoteServerCommandHandlerFactory;
import win.ixuni.strontium.core.session.SessionManager;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command registry tests
 */
class CommandHandlerFactoryTest {

    private SessionManager sessionManager;
    private CommandHandlerFactory factory;

    @BeforeEach
    void setUp() {
        sessionManager = new SessionManager(new DriverRegistry(new DriverTypeLoader(Path.of("target", "no-driver-libraries"))));
        factory = new RemoteServerCommandHandlerFactory(sessionManager);
    }

    @Test
    void createsRegisteredHandler() {
        CommandHandler handler = factory.createHandler(DriverCommand.GET_WINDOW_HANDLES,
                Map.of(SessionCommandHandler.SESSION_ID_PARAMETER, "abc"), Map.of());

        assertInstanceOf(GetAllWindowsHandler.class, handler);
        assertEquals("[get all window handles]", handler.describe());
        assertEquals("[get all window handles]", handler.toString());
        assertEquals("abc", handler.getLocatorParameters().get(SessionCommandHandler.SESSION_ID_PARAMETER));
    }

    @ParameterizedTest
    @EnumSource(value = DriverCommand.class, names = {"GET", "FIND_ELEMENT", "SCREENSHOT", "MOUSE_MOVE_TO"})
    @DisplayName("Unregistered commands get a handler failing with UnsupportedCommandException")
    void unregisteredCommandFallsBackToNotImplemented(DriverCommand command) {
        assertFalse(factory.canCreateHandler(command));

        CommandHandler handler = factory.createHandler(command, Map.of(), Map.of());

        assertInstanceOf(CommandNotImplementedHandler.class, handler);
        UnsupportedCommandException e = assertThrows(UnsupportedCommandException.class, handler::execute);
        assertEquals(command.getCommandName(), e.getCommandName());
        assertEquals("unknown command", e.getErrorCode());
        assertEquals(404, e.getHttpStatus());
    }

    @Test
    void unknownCommandNameFallsBackToNotImplemented() {
        CommandHandler handler = factory.createHandler("teleport", Map.of(), Map.of());

        UnsupportedCommandException e = assertThrows(UnsupportedCommandException.class, handler::execute);
        assertEquals("teleport", e.getCommandName());
    }

    @Test
    void commandNameResolvesToRegisteredHandler() {
        CommandHandler handler = factory.createHandler("mouseClick", Map.of(), Map.of("button", 0));

        assertInstanceOf(MouseClickHandler.class, handler);
    }

    @Test
    @DisplayName("canCreateHandler is true exactly for the registered commands")
    void canCreateHandlerMatchesRegistration() {
        Set<DriverCommand> expected = EnumSet.of(
                DriverCommand.NEW_SESSION,
                DriverCommand.GET_ALL_SESSIONS,
                DriverCommand.GET_CAPABILITIES,
                DriverCommand.QUIT,
                DriverCommand.GET_CURRENT_WINDOW_HANDLE,
                DriverCommand.GET_WINDOW_HANDLES,
                DriverCommand.MOUSE_CLICK,
                DriverCommand.MOUSE_DOUBLE_CLICK);

        for (DriverCommand command : DriverCommand.values()) {
            assertEquals(expected.contains(command), factory.canCreateHandler(command), command.name());
        }
        assertEquals(expected, factory.getSupportedCommands());
    }

    @Test
    void constructionFailurePropagatesToCaller() {
        HandlerConstructionFailedException e = assertThrows(HandlerConstructionFailedException.class,
                () -> factory.createHandler(DriverCommand.MOUSE_CLICK, Map.of(), Map.of()));

        assertEquals("button", e.getParameterName());
        assertEquals(400, e.getHttpStatus());
    }

    @Test
    void laterRegistrationWins() {
        CommandHandlerFactory overriding = new CommandHandlerFactory(sessionManager) {
            @Override
            protected void addHandlers() {
                register(DriverCommand.STATUS, (locator, params) -> new FixedResultHandler("first"));
                register(DriverCommand.STATUS, (locator, params) -> new FixedResultHandler("second"));
            }
        };

        assertEquals("second", overriding.createHandler(DriverCommand.STATUS, Map.of(), Map.of()).execute());
        assertEquals(Set.of(DriverCommand.STATUS), overriding.getSupportedCommands());
    }

    @Test
    void emptyFactorySupportsNothing() {
        CommandHandlerFactory empty = new CommandHandlerFactory(sessionManager) {
            @Override
            protected void addHandlers() {
            }
        };

        assertTrue(empty.getSupportedCommands().isEmpty());
        assertInstanceOf(CommandNotImplementedHandler.class,
                empty.createHandler(DriverCommand.STATUS, null, null));
    }

    @Test
    void fromNameIsCaseSensitive() {
        assertEquals(DriverCommand.GET_WINDOW_HANDLES, DriverCommand.fromName("getWindowHandles").orElseThrow());
        assertTrue(DriverCommand.fromName("GETWINDOWHANDLES").isEmpty());
        assertTrue(DriverCommand.fromName(null).isEmpty());
    }

    private static class FixedResultHandler extends CommandHandler {

        private final String result;

        FixedResultHandler(String result) {
            super(Map.of(), Map.of());
            this.result = result;
        }

        @Override
        public Object execute() {
            return result;
        }

        @Override
        public String describe() {
            return "[fixed " + result + "]";
        }
    }
}
