package win.ixuni.strontium.core.command;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the transport layer
 * <p>
 * Builds the handler for a request, runs it through the interceptor chain and executes it.
 * Driver actions block, so execution is moved to a bounded elastic scheduler. A handler
 * returning null completes the result empty. Errors from construction or execution are emitted
 * unchanged.
 */
@Slf4j
public class CommandDispatcher {

    private final CommandHandlerFactory handlerFactory;
    private final List<CommandInterceptor> interceptors;
    private final Scheduler scheduler;

    public CommandDispatcher(CommandHandlerFactory handlerFactory, List<CommandInterceptor> interceptors) {
        this(handlerFactory, interceptors, Schedulers.boundedElastic());
    }

    public CommandDispatcher(CommandHandlerFactory handlerFactory, List<CommandInterceptor> interceptors,
                             Scheduler scheduler) {
        this.handlerFactory = handlerFactory;
        List<CommandInterceptor> sorted = new ArrayList<>(interceptors);
        sorted.sort(Comparator.comparingInt(CommandInterceptor::getOrder));
        this.interceptors = List.copyOf(sorted);
        this.scheduler = scheduler;
    }

    public Mono<Object> dispatch(DriverCommand command, Map<String, String> locatorParameters,
                                 Map<String, Object> parameters) {
        return Mono.defer(() -> run(command.getCommandName(),
                        handlerFactory.createHandler(command, locatorParameters, parameters)))
                .subscribeOn(scheduler);
    }

    /**
     * Dispatch a command given by wire name; unknown names fail with "unknown command"
     */
    public Mono<Object> dispatch(String commandName, Map<String, String> locatorParameters,
                                 Map<String, Object> parameters) {
        return Mono.defer(() -> run(commandName,
                        handlerFactory.createHandler(commandName, locatorParameters, parameters)))
                .subscribeOn(scheduler);
    }

    public boolean canDispatch(DriverCommand command) {
        return handlerFactory.canCreateHandler(command);
    }

    public int interceptorCount() {
        return interceptors.size();
    }

    private Mono<Object> run(String command, CommandHandler handler) {
        log.debug("Dispatching {} to {} through {} interceptors", command, handler, interceptors.size());
        return buildChain(0).proceed(command, handler);
    }

    private CommandInterceptorChain buildChain(int index) {
        if (index >= interceptors.size()) {
            // Chain end: run the handler
            return (command, handler) -> Mono.fromCallable(handler::execute);
        }
        CommandInterceptor interceptor = interceptors.get(index);
        CommandInterceptorChain next = buildChain(index + 1);
        return (command, handler) -> interceptor.intercept(command, handler, next);
    }
}
