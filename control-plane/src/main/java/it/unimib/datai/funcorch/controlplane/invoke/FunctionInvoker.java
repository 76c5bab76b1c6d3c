package it.unimib.datai.funcorch.controlplane.invoke;

import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.InvocationRequest;
import it.unimib.datai.funcorch.common.runtime.ExecutionContext;

/**
 * Runs one attempt of a function body. Any exception fails the attempt.
 */
public interface FunctionInvoker {
    Object invoke(FunctionDefinition definition, InvocationRequest request, ExecutionContext context) throws Exception;
}
