package it.unimib.datai.funcorch.controlplane.invoke;

import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.InvocationRequest;
import it.unimib.datai.funcorch.common.runtime.ExecutionContext;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * Picks the invoker for the location kind. Blob-backed and local functions run in process.
 */
@Primary
@Component
public class InvokerRouter implements FunctionInvoker {
    private final LocalFunctionInvoker localInvoker;
    private final HttpFunctionInvoker httpInvoker;

    public InvokerRouter(LocalFunctionInvoker localInvoker, HttpFunctionInvoker httpInvoker) {
        this.localInvoker = localInvoker;
        this.httpInvoker = httpInvoker;
    }

    @Override
    public Object invoke(FunctionDefinition definition, InvocationRequest request, ExecutionContext context)
            throws Exception {
        FunctionInvoker target = switch (definition.location().kind()) {
            case REMOTE, LOCAL -> localInvoker;
            case URL -> httpInvoker;
        };
        return target.invoke(definition, request, context);
    }
}
