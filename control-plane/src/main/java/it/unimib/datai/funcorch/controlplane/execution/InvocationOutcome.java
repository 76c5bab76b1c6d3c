package it.unimib.datai.funcorch.controlplane.execution;

public record InvocationOutcome(
        String invocationId,
        String functionId,
        Object output,
        int retryCount,
        int maxRetryCount
) {
}
