package it.unimib.datai.funcorch.controlplane.invoke;

import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.InvocationRequest;
import it.unimib.datai.funcorch.common.runtime.ExecutionContext;
import it.unimib.datai.funcorch.common.runtime.FunctionHandler;
import it.unimib.datai.funcorch.sdk.FunctionContext;
import org.springframework.stereotype.Component;

/**
 * Runs the handler named by the location's entry point on the calling thread.
 */
@Component
public class LocalFunctionInvoker implements FunctionInvoker {
    private final HandlerRegistry handlers;

    public LocalFunctionInvoker(HandlerRegistry handlers) {
        this.handlers = handlers;
    }

    @Override
    public Object invoke(FunctionDefinition definition, InvocationRequest request, ExecutionContext context)
            throws Exception {
        FunctionHandler handler = handlers.resolve(definition.location().entryPoint());
        try (FunctionContext.Scope ignored = FunctionContext.bind(context.invocationId(), context.retryCount())) {
            return handler.handle(request, context);
        }
    }
}
