package win.ixuni.strontium.server.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import win.ixuni.strontium.core.command.CommandDispatcher;
import win.ixuni.strontium.core.command.CommandHandlerFactory;
import win.ixuni.strontium.core.command.CommandInterceptor;
import win.ixuni.strontium.core.command.interceptor.LoggingInterceptor;
import win.ixuni.strontium.core.config.StrontiumProperties;
import win.ixuni.strontium.core.driver.DriverRegistry;
import win.ixuni.strontium.core.driver.DriverTypeLoader;
import win.ixuni.strontium.core.handler.RemoteServerCommandHandlerFactory;
import win.ixuni.strontium.core.session.SessionManager;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Server component wiring
 * <p>
 * The session manager defined here is the single session store of the process.
 */
@Slf4j
@Configuration
public class StrontiumServerConfig {

    @Bean(destroyMethod = "close")
    public DriverTypeLoader driverTypeLoader(StrontiumProperties properties) {
        String configured = properties.getDriverLibraryPath();
        Path libraryDirectory = configured != null && !configured.isBlank()
                ? Paths.get(configured)
                : DriverTypeLoader.defaultLibraryDirectory();
        log.info("Driver library directory: {}", libraryDirectory.toAbsolutePath());
        return new DriverTypeLoader(libraryDirectory);
    }

    @Bean
    public DriverRegistry driverRegistry(DriverTypeLoader driverTypeLoader) {
        return new DriverRegistry(driverTypeLoader);
    }

    @Bean
    public SessionManager sessionManager(DriverRegistry driverRegistry) {
        return new SessionManager(driverRegistry);
    }

    @Bean
    public CommandHandlerFactory commandHandlerFactory(SessionManager sessionManager) {
        return new RemoteServerCommandHandlerFactory(sessionManager);
    }

    @Bean
    public LoggingInterceptor loggingInterceptor() {
        return new LoggingInterceptor();
    }

    @Bean
    public CommandDispatcher commandDispatcher(CommandHandlerFactory commandHandlerFactory,
                                               List<CommandInterceptor> interceptors) {
        return new CommandDispatcher(commandHandlerFactory, interceptors);
    }
}
