package win.ixuni.strontium.server.registry;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import win.ixuni.strontium.core.config.DriverRegistrationConfig;
import win.ixuni.strontium.core.config.StrontiumProperties;
import win.ixuni.strontium.core.driver.DriverRegistry;
import win.ixuni.strontium.core.session.SessionManager;

import java.util.ArrayList;
import java.util.List;

/**
 * Registers the configured drivers at startup
 * <p>
 * A driver that cannot be registered is logged and skipped; the server still starts.
 * On shutdown every remaining session is quit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DriverRegistrationInitializer {

    private final StrontiumProperties properties;
    private final DriverRegistry driverRegistry;
    private final SessionManager sessionManager;

    private final List<String> failedRegistrations = new ArrayList<>();

    @PostConstruct
    public void initialize() {
        log.info("Registering {} configured drivers...", properties.getDrivers().size());

        int registered = 0;
        for (DriverRegistrationConfig config : properties.getDrivers()) {
            if (!config.isEnabled()) {
                log.info("Driver '{}' is disabled, skipping", config.getDisplayName());
                continue;
            }

            boolean success = driverRegistry.registerDriver(config.toCapabilities(), config.getType(),
                    (typeDescriptor, reason) -> {
                        log.error("Failed to register driver '{}' ({}): {}",
                                config.getDisplayName(), typeDescriptor, reason);
                        failedRegistrations.add(config.getDisplayName());
                    });
            if (success) {
                registered++;
            }
        }

        log.info("Driver registration complete: {} registered, {} failed",
                registered, failedRegistrations.size());
    }

    @PreDestroy
    public void shutdown() {
        log.info("Shutting down {} active sessions...", sessionManager.getSessionCount());
        sessionManager.closeAll();
        log.info("Session shutdown complete");
    }

    /**
     * Names of the configured drivers that failed to register
     */
    public List<String> getFailedRegistrations() {
        return List.copyOf(failedRegistrations);
    }
}
