package win.ixuni.strontium.core.command;

import reactor.core.publisher.Mono;

/**
 * Invokes the next interceptor, or the handler at the end of the chain
 */
@FunctionalInterface
public interface CommandInterceptorChain {

    Mono<Object> proceed(String command, CommandHandler handler);
}
