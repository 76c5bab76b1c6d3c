package it.unimib.datai.funcorch.controlplane.execution;

public class InvocationInProgressException extends RuntimeException {
    private final String invocationId;

    public InvocationInProgressException(String invocationId) {
        super("Invocation " + invocationId + " is still running");
        this.invocationId = invocationId;
    }

    public String invocationId() {
        return invocationId;
    }
}
