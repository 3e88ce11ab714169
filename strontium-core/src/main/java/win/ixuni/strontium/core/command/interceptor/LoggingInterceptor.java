package win.ixuni.strontium.core.command.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.strontium.core.command.CommandHandler;
import win.ixuni.strontium.core.command.CommandInterceptor;
import win.ixuni.strontium.core.command.CommandInterceptorChain;

/**
 * 日志拦截器
 * <p>
 * Logs each command before and after execution, with elapsed time and outcome.
 */
@Slf4j
public class LoggingInterceptor implements CommandInterceptor {

    @Override
    public Mono<Object> intercept(String command, CommandHandler handler, CommandInterceptorChain chain) {
        final long startTime = System.currentTimeMillis();
        final String description = handler.describe();

        log.debug("Starting command {} {}", command, description);

        return chain.proceed(command, handler)
                .doOnSuccess(result -> {
                    long duration = System.currentTimeMillis() - startTime;
                    log.debug("Command {} {} completed in {}ms", command, description, duration);
                })
                .doOnError(error -> {
                    long duration = System.currentTimeMillis() - startTime;
                    log.warn("Command {} {} failed during handler execution after {}ms: {}",
                            command, description, duration, error.toString());
                });
    }

    @Override
    public int getOrder() {
        return -100; // outermost
    }
}
