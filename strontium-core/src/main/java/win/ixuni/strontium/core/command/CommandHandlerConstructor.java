package win.ixuni.strontium.core.command;

import java.util.Map;

/**
 * Creates a handler from the parameters of one request
 */
@FunctionalInterface
public interface CommandHandlerConstructor {

    /**
     * @param locatorParameters parameters taken from the request path
     * @param parameters        parameters taken from the request body
     * @return a new handler, used for exactly one execution
     * @throws win.ixuni.strontium.core.exception.HandlerConstructionFailedException
     *         if a required parameter is missing or malformed
     */
    CommandHandler create(Map<String, String> locatorParameters, Map<String, Object> parameters);
}
