package it.unimib.datai.funcorch.examples.retrycheck;

import it.unimib.datai.funcorch.common.model.InvocationRequest;
import it.unimib.datai.funcorch.common.runtime.ExecutionContext;
import it.unimib.datai.funcorch.common.runtime.FunctionHandler;
import it.unimib.datai.funcorch.common.runtime.RetryContextMismatchException;
import it.unimib.datai.funcorch.sdk.FunctionContext;
import it.unimib.datai.funcorch.sdk.OrchestratedFunction;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fails until it has been attempted twice within one logical invocation, and checks that the
 * retry context it receives matches the attempts it has observed.
 *
 * Output: {@code "invocationCount: <n>"} where n is the number of executions in the invocation.
 */
@OrchestratedFunction("retryCheck")
public class RetryCheckHandler implements FunctionHandler {
    private static final Logger log = FunctionContext.getLogger(RetryCheckHandler.class);

    static final int EXPECTED_MAX_RETRY_COUNT = 2;
    static final int REQUIRED_EXECUTIONS = 2;

    static final int MAX_TRACKED_INVOCATIONS = 1024;

    // Next retry index expected per invocation still in flight. Invocations that never come back
    // (cancelled, or retried elsewhere) are dropped oldest first.
    private final Map<String, Integer> expectedRetryCounts = Collections.synchronizedMap(
            new LinkedHashMap<>(16, 0.75f, false) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, Integer> eldest) {
                    return size() > MAX_TRACKED_INVOCATIONS;
                }
            });

    @Override
    public Object handle(InvocationRequest request, ExecutionContext context) {
        Integer expected = expectedRetryCounts.get(context.invocationId());
        if (context.retryCount() != 0 && expected != null && expected != context.retryCount()) {
            expectedRetryCounts.remove(context.invocationId());
            throw new RetryContextMismatchException("retryCount", expected, context.retryCount());
        }
        if (context.maxRetryCount() != EXPECTED_MAX_RETRY_COUNT) {
            expectedRetryCounts.remove(context.invocationId());
            throw new RetryContextMismatchException("maxRetryCount", EXPECTED_MAX_RETRY_COUNT, context.maxRetryCount());
        }

        int invocationCount = context.retryCount() + 1;
        log.info("Retry check processed a request. invocationCount: {}", invocationCount);

        if (invocationCount < REQUIRED_EXECUTIONS) {
            expectedRetryCounts.put(context.invocationId(), invocationCount);
            throw new IllegalStateException("An error occurred");
        }
        expectedRetryCounts.remove(context.invocationId());
        return "invocationCount: " + invocationCount;
    }

    int trackedInvocations() {
        return expectedRetryCounts.size();
    }
}
