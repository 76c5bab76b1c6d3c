package it.unimib.datai.funcorch.common.runtime;

/**
 * Retry context handed to a function body for one attempt.
 *
 * @param retryCount zero-based index of the current attempt
 * @param maxRetryCount number of retries allowed after the first attempt
 */
public record ExecutionContext(
        String invocationId,
        String functionId,
        int retryCount,
        int maxRetryCount
) {
    public boolean isLastAttempt() {
        return retryCount >= maxRetryCount;
    }
}
