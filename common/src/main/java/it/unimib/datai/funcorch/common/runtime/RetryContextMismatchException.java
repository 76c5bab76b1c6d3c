package it.unimib.datai.funcorch.common.runtime;

/**
 * The retry harness and the function body disagree about which attempt is running or about the
 * retry bound. Never retried.
 */
public class RetryContextMismatchException extends RuntimeException {
    private final String field;
    private final int expected;
    private final int actual;

    public RetryContextMismatchException(String field, int expected, int actual) {
        super(field + "=" + actual + " is not equal to expected " + field + "=" + expected);
        this.field = field;
        this.expected = expected;
        this.actual = actual;
    }

    public String field() {
        return field;
    }

    public int expected() {
        return expected;
    }

    public int actual() {
        return actual;
    }
}
