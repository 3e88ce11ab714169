package win.ixuni.strontium.core.driver;

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Capability set
 * <p>
 * Describes the automation features a client requests when creating a session, and doubles as
 * the match key of a driver registration. Immutable.
 */
@EqualsAndHashCode
public final class Capabilities {

    public static final String BROWSER_NAME = "browserName";

    private static final Capabilities EMPTY = new Capabilities(Collections.emptyMap());

    private final Map<String, Object> capabilities;

    private Capabilities(Map<String, Object> capabilities) {
        this.capabilities = Collections.unmodifiableMap(new LinkedHashMap<>(capabilities));
    }

    public static Capabilities of(Map<String, ?> capabilities) {
        if (capabilities == null || capabilities.isEmpty()) {
            return EMPTY;
        }
        return new Capabilities(new LinkedHashMap<>(capabilities));
    }

    public static Capabilities of(String key, Object value) {
        Objects.requireNonNull(key, "capability name");
        Map<String, Object> single = new LinkedHashMap<>();
        single.put(key, value);
        return new Capabilities(single);
    }

    public static Capabilities empty() {
        return EMPTY;
    }

    public Object getCapability(String name) {
        return capabilities.get(name);
    }

    public String getBrowserName() {
        Object browserName = capabilities.get(BROWSER_NAME);
        return browserName != null ? browserName.toString() : null;
    }

    public Map<String, Object> asMap() {
        return capabilities;
    }

    public boolean isEmpty() {
        return capabilities.isEmpty();
    }

    /**
     * Check whether the requested capabilities satisfy this registration key
     * <p>
     * Every entry of this set must be present in {@code requested} with an equal value.
     * Extra requested entries are ignored, so an empty key matches any request.
     *
     * @param requested capabilities requested by the client
     * @return true if this key matches
     */
    public boolean matches(Capabilities requested) {
        if (requested == null) {
            return capabilities.isEmpty();
        }
        for (Map.Entry<String, Object> entry : capabilities.entrySet()) {
            if (!Objects.equals(entry.getValue(), requested.capabilities.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return "Capabilities" + capabilities;
    }
}
