package it.unimib.datai.funcorch.controlplane.execution;

/**
 * Every allowed attempt failed. The cause is the failure of the last attempt.
 */
public class RetryExhaustedException extends RuntimeException {
    private final String invocationId;
    private final String functionId;
    private final int retryCount;
    private final int maxRetryCount;

    public RetryExhaustedException(String invocationId, String functionId, int retryCount, int maxRetryCount,
                                   Throwable cause) {
        super("Function " + functionId + " failed after " + (retryCount + 1) + " attempts: "
                + (cause == null ? "unknown error" : cause.getMessage()), cause);
        this.invocationId = invocationId;
        this.functionId = functionId;
        this.retryCount = retryCount;
        this.maxRetryCount = maxRetryCount;
    }

    public String invocationId() {
        return invocationId;
    }

    public String functionId() {
        return functionId;
    }

    public int retryCount() {
        return retryCount;
    }

    public int maxRetryCount() {
        return maxRetryCount;
    }
}
