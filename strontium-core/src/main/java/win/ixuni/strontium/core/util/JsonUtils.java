package win.ixuni.strontium.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * JSON 工具类
 * <p>
 * Command parameters are decoded by the transport into plain maps, lists and boxed scalars;
 * these helpers convert them into the types handlers expect.
 */
public final class JsonUtils {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private JsonUtils() {
    }

    /**
     * Convert a decoded JSON value to the given type
     *
     * @throws IllegalArgumentException if the value cannot be converted
     */
    public static <T> T convert(Object value, Class<T> type) {
        if (type.isInstance(value)) {
            return type.cast(value);
        }
        return MAPPER.convertValue(value, type);
    }
}
