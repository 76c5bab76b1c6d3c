package it.unimib.datai.funcorch.controlplane.invoke;

import it.unimib.datai.funcorch.common.runtime.FunctionHandler;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.function.Function;

/**
 * Resolves in-process function bodies by entry point. Handlers are Spring beans named after
 * their entry point.
 */
@Component
public class HandlerRegistry {
    private final Function<String, FunctionHandler> resolver;

    @Autowired
    public HandlerRegistry(ListableBeanFactory beanFactory) {
        this(entryPoint -> beanFactory.getBeansOfType(FunctionHandler.class).get(entryPoint));
    }

    HandlerRegistry(Function<String, FunctionHandler> resolver) {
        this.resolver = resolver;
    }

    public static HandlerRegistry of(Map<String, FunctionHandler> handlers) {
        Map<String, FunctionHandler> copy = Map.copyOf(handlers);
        return new HandlerRegistry(copy::get);
    }

    public FunctionHandler resolve(String entryPoint) {
        if (entryPoint == null || entryPoint.isBlank()) {
            throw new HandlerNotFoundException(String.valueOf(entryPoint));
        }
        FunctionHandler handler = resolver.apply(entryPoint);
        if (handler == null) {
            throw new HandlerNotFoundException(entryPoint);
        }
        return handler;
    }
}
