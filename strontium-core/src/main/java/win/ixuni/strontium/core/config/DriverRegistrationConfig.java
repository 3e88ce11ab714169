package win.ixuni.strontium.core.config;

import lombok.Data;
import win.ixuni.strontium.core.driver.Capabilities;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Driver registration configuration
 */
@Data
public class DriverRegistrationConfig {

    /**
     * Name used in logs
     */
    private String name;

    /**
     * Type descriptor: {@code "TypeName"} or {@code "TypeName, ModuleName"}
     */
    private String type;

    /**
     * Whether enabled
     */
    private boolean enabled = true;

    /**
     * Capability key the driver is registered under
     */
    private Map<String, Object> capabilities = new LinkedHashMap<>();

    public Capabilities toCapabilities() {
        return Capabilities.of(capabilities);
    }

    public String getDisplayName() {
        return name != null ? name : type;
    }
}
