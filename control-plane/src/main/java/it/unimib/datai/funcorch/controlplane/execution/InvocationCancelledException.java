package it.unimib.datai.funcorch.controlplane.execution;

public class InvocationCancelledException extends RuntimeException {
    private final String invocationId;
    private final int retryCount;

    public InvocationCancelledException(String invocationId, int retryCount) {
        super("Invocation " + invocationId + " was cancelled before attempt " + retryCount);
        this.invocationId = invocationId;
        this.retryCount = retryCount;
    }

    public String invocationId() {
        return invocationId;
    }

    public int retryCount() {
        return retryCount;
    }
}
