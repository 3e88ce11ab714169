package win.ixuni.strontium.core.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Strontium main configuration
 */
@Data
@ConfigurationProperties(prefix = "strontium")
public class StrontiumProperties {

    /**
     * Directory driver libraries are loaded from
     * <p>
     * When unset, {@code DriverLibraries} beside the server's own jar is used.
     */
    private String driverLibraryPath;

    /**
     * Drivers registered at startup
     */
    private List<DriverRegistrationConfig> drivers = new ArrayList<>();

    /**
     * Session configuration
     */
    private SessionConfig session = new SessionConfig();

    /**
     * Session configuration
     */
    @Data
    public static class SessionConfig {

        /**
         * Sessions idle for longer than this are quit and removed; zero disables expiry
         */
        private Duration idleTimeout = Duration.ZERO;

        /**
         * How often idle sessions are looked for
         */
        private Duration reaperInterval = Duration.ofSeconds(60);
    }
}
