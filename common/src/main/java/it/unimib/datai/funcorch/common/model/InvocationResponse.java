package it.unimib.datai.funcorch.common.model;

/**
 * Outcome of one logical invocation.
 *
 * @param status {@code success}, {@code exhausted}, {@code error} or {@code cancelled}
 * @param retryCount attempt index the invocation ended on
 */
public record InvocationResponse(
        String invocationId,
        String functionId,
        String status,
        Object output,
        ErrorInfo error,
        int retryCount,
        int maxRetryCount,
        boolean hostIsRunning
) {
}
