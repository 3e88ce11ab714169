package win.ixuni.strontium.core.command;

import win.ixuni.strontium.core.exception.HandlerConstructionFailedException;
import win.ixuni.strontium.core.util.JsonUtils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Handles one protocol command
 * <p>
 * A handler is built from the request's locator and body parameters, executed once and then
 * discarded. Constructors read their required parameters eagerly so a malformed request fails
 * before anything touches a session.
 */
public abstract class CommandHandler {

    private final Map<String, String> locatorParameters;
    private final Map<String, Object> parameters;

    protected CommandHandler(Map<String, String> locatorParameters, Map<String, Object> parameters) {
        this.locatorParameters = locatorParameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(locatorParameters));
        this.parameters = parameters == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Execute the command
     *
     * @return the command's result, or null for commands without a value
     */
    public abstract Object execute();

    /**
     * Short label for diagnostics
     *
     * @return label such as "[get all window handles]"
     */
    public abstract String describe();

    public Map<String, String> getLocatorParameters() {
        return locatorParameters;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    /**
     * Get a required locator parameter
     */
    protected String getLocatorParameter(String name) {
        String value = locatorParameters.get(name);
        if (value == null) {
            throw new HandlerConstructionFailedException(name, "Missing locator parameter: " + name);
        }
        return value;
    }

    /**
     * Get a required body parameter as sent by the client
     */
    protected Object getCommandParameter(String name) {
        Object value = parameters.get(name);
        if (value == null) {
            throw new HandlerConstructionFailedException(name, "Missing parameter: " + name);
        }
        return value;
    }

    /**
     * Get a required body parameter converted to the given type
     * <p>
     * JSON numbers arrive as whatever type the decoder chose, so values are converted rather
     * than cast.
     */
    protected <T> T getCommandParameter(String name, Class<T> type) {
        Object value = getCommandParameter(name);
        try {
            return JsonUtils.convert(value, type);
        } catch (IllegalArgumentException e) {
            throw new HandlerConstructionFailedException(name,
                    "Parameter '" + name + "' is not a valid " + type.getSimpleName() + ": " + value, e);
        }
    }

    /**
     * Get a required integer body parameter
     * <p>
     * JSON decoders may deliver integers as any {@link Number} type. Only integral values within
     * {@code int} range are accepted; fractions and numeric strings are rejected.
     */
    protected int getIntegerParameter(String name) {
        Object value = getCommandParameter(name);
        Integer integer = toInteger(value);
        if (integer == null) {
            throw new HandlerConstructionFailedException(name,
                    "Parameter '" + name + "' is not a valid integer: " + value);
        }
        return integer;
    }

    protected boolean hasCommandParameter(String name) {
        return parameters.get(name) != null;
    }

    @Override
    public String toString() {
        return describe();
    }

    private static Integer toInteger(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).intValue();
        }
        try {
            if (value instanceof Long) {
                return Math.toIntExact((Long) value);
            }
            if (value instanceof BigInteger) {
                return ((BigInteger) value).intValueExact();
            }
            if (value instanceof BigDecimal) {
                return ((BigDecimal) value).intValueExact();
            }
        } catch (ArithmeticException e) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (number == Math.rint(number) && number >= Integer.MIN_VALUE && number <= Integer.MAX_VALUE) {
                return (int) number;
            }
        }
        return null;
    }
}
