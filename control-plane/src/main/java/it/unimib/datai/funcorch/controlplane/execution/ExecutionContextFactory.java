package it.unimib.datai.funcorch.controlplane.execution;

import it.unimib.datai.funcorch.common.runtime.ExecutionContext;

/**
 * Builds the context handed to the function body for the attempt described by the snapshot.
 */
@FunctionalInterface
public interface ExecutionContextFactory {

    ExecutionContext create(InvocationAttempt.Snapshot attempt);

    static ExecutionContextFactory standard() {
        return attempt -> new ExecutionContext(
                attempt.invocationId(),
                attempt.functionId(),
                attempt.retryCount(),
                attempt.maxRetryCount());
    }
}
