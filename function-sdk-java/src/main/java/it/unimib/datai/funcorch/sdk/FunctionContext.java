package it.unimib.datai.funcorch.sdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Provides execution context for orchestrated functions.
 * Values are populated by the control plane via SLF4J MDC while a function body runs.
 */
public final class FunctionContext {
    public static final String INVOCATION_ID_KEY = "invocationId";
    public static final String RETRY_COUNT_KEY = "retryCount";

    private FunctionContext() {}

    /** Current logical invocation ID. */
    public static String getInvocationId() {
        return MDC.get(INVOCATION_ID_KEY);
    }

    /** Zero-based attempt index of the running body, or -1 outside an invocation. */
    public static int getRetryCount() {
        String value = MDC.get(RETRY_COUNT_KEY);
        if (value == null) {
            return -1;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            return -1;
        }
    }

    /**
     * Binds the context to the current thread. The returned scope restores the previous values.
     */
    public static Scope bind(String invocationId, int retryCount) {
        String previousId = MDC.get(INVOCATION_ID_KEY);
        String previousRetry = MDC.get(RETRY_COUNT_KEY);
        MDC.put(INVOCATION_ID_KEY, invocationId);
        MDC.put(RETRY_COUNT_KEY, Integer.toString(retryCount));
        return () -> {
            restore(INVOCATION_ID_KEY, previousId);
            restore(RETRY_COUNT_KEY, previousRetry);
        };
    }

    /** Convenience logger that automatically includes invocation context from MDC. */
    public static Logger getLogger(Class<?> clazz) {
        return LoggerFactory.getLogger(clazz);
    }

    private static void restore(String key, String value) {
        if (value == null) {
            MDC.remove(key);
        } else {
            MDC.put(key, value);
        }
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
