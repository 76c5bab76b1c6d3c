package it.unimib.datai.funcorch.common.runtime;

import it.unimib.datai.funcorch.common.model.InvocationRequest;

/**
 * A function body. Throwing fails the current attempt; the orchestrator decides whether to retry.
 */
@FunctionalInterface
public interface FunctionHandler {
    Object handle(InvocationRequest request, ExecutionContext context) throws Exception;
}
