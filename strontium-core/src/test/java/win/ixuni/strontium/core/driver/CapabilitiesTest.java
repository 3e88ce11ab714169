package win.ixuni.strontium.core.driver;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CapabilitiesTest {

    @Test
    void keyMatchesRequestContainingAllItsEntries() {
        Capabilities key = Capabilities.of(Capabilities.BROWSER_NAME, "chrome");

        assertTrue(key.matches(Capabilities.of(Map.of(Capabilities.BROWSER_NAME, "chrome", "version", "120"))));
        assertFalse(key.matches(Capabilities.of(Capabilities.BROWSER_NAME, "firefox")));
        assertFalse(key.matches(Capabilities.empty()));
        assertFalse(key.matches(null));
    }

    @Test
    void emptyKeyMatchesAnything() {
        assertTrue(Capabilities.empty().matches(Capabilities.of("browser", "test")));
        assertTrue(Capabilities.empty().matches(null));
    }

    @Test
    void isImmutableCopy() {
        Map<String, Object> source = new HashMap<>();
        source.put("browser", "test");
        Capabilities capabilities = Capabilities.of(source);
        source.put("browser", "changed");

        assertEquals("test", capabilities.getCapability("browser"));
        assertThrows(UnsupportedOperationException.class, () -> capabilities.asMap().put("x", 1));
        assertEquals(Capabilities.of("browser", "test"), capabilities);
    }

    @Test
    void singleCapabilityMayBeNull() {
        Capabilities withoutProxy = Capabilities.of("proxy", null);

        assertTrue(withoutProxy.asMap().containsKey("proxy"));
        assertNull(withoutProxy.getCapability("proxy"));
        assertTrue(withoutProxy.matches(Capabilities.of(Capabilities.BROWSER_NAME, "chrome")));
        assertEquals(Capabilities.of(source("proxy", null)), withoutProxy);
        assertThrows(NullPointerException.class, () -> Capabilities.of(null, "x"));
    }

    private static Map<String, Object> source(String key, Object value) {
        Map<String, Object> map = new HashMap<>();
        map.put(key, value);
        return map;
    }
}
