package it.unimib.datai.funcorch.controlplane.invoke;

/**
 * A URL-hosted function answered with a non-2xx status.
 */
public class FunctionInvocationException extends RuntimeException {
    private final int statusCode;

    public FunctionInvocationException(int statusCode, String message) {
        super("Function endpoint returned " + statusCode + ": " + message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
