package win.ixuni.strontium.core.command;

import reactor.core.publisher.Mono;

/**
 * Command interceptor
 * <p>
 * Wraps handler execution, e.g. for logging or metering. Chain of responsibility: an
 * interceptor runs its own logic around {@code chain.proceed(handler)}.
 */
public interface CommandInterceptor {

    /**
     * @param command the dispatched command name
     * @param handler the handler about to execute
     * @param chain   remaining interceptors and finally the handler itself
     * @return the command result; empty for commands without a value
     */
    Mono<Object> intercept(String command, CommandHandler handler, CommandInterceptorChain chain);

    /**
     * Lower values run first (outermost). Default 0.
     */
    default int getOrder() {
        return 0;
    }
}
