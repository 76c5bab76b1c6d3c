package it.unimib.datai.funcorch.controlplane.execution;

import it.unimib.datai.funcorch.common.model.ErrorInfo;
import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.InvocationRequest;
import it.unimib.datai.funcorch.common.runtime.ExecutionContext;
import it.unimib.datai.funcorch.common.runtime.RetryContextMismatchException;
import it.unimib.datai.funcorch.controlplane.config.RetryProperties;
import it.unimib.datai.funcorch.controlplane.invoke.FunctionInvoker;
import it.unimib.datai.funcorch.controlplane.service.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Runs a logical invocation through its attempts: up to {@code maxRetryCount} re-attempts after
 * the first, sequentially, on the calling thread.
 *
 * <p>Before each attempt the context handed to the body is checked against the tracked counter
 * and the configured bound. A mismatch, from either side, ends the invocation without a retry.
 */
@Component
public class ExecutionOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(ExecutionOrchestrator.class);

    public static final String FUNCTION_ERROR = "FUNCTION_ERROR";
    public static final String RETRIES_EXHAUSTED = "RETRIES_EXHAUSTED";
    public static final String INTERNAL_CONSISTENCY = "INTERNAL_CONSISTENCY";
    public static final String CANCELLED = "CANCELLED";

    private final FunctionInvoker invoker;
    private final AttemptTracker tracker;
    private final ExecutionContextFactory contextFactory;
    private final BackoffPolicy backoffPolicy;
    private final RetryProperties retryProperties;
    private final Metrics metrics;
    private final Clock clock;

    public ExecutionOrchestrator(FunctionInvoker invoker,
                                 AttemptTracker tracker,
                                 ExecutionContextFactory contextFactory,
                                 BackoffPolicy backoffPolicy,
                                 RetryProperties retryProperties,
                                 Metrics metrics,
                                 Clock clock) {
        this.invoker = invoker;
        this.tracker = tracker;
        this.contextFactory = contextFactory;
        this.backoffPolicy = backoffPolicy;
        this.retryProperties = retryProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * @param reset restart the counter of {@code invocationId} at 0 instead of carrying it over
     * @throws RetryExhaustedException when the last allowed attempt fails
     * @throws RetryContextMismatchException when the attempt context is inconsistent
     * @throws InvocationCancelledException when cancelled between attempts
     * @throws InvocationInProgressException when {@code invocationId} is already running
     */
    public InvocationOutcome execute(FunctionDefinition definition, InvocationRequest request,
                                     String invocationId, boolean reset) {
        String functionId = definition.id();
        int bound = retryProperties.maxRetryCount();
        InvocationAttempt attempt = tracker.begin(invocationId, functionId, reset);
        CancellationToken token = attempt.cancellationToken();

        while (true) {
            if (token.isCancelled()) {
                throw cancelled(attempt);
            }
            attempt.markAttemptStarted(clock.instant());
            InvocationAttempt.Snapshot snapshot = attempt.snapshot();
            ExecutionContext context = contextFactory.create(snapshot);
            try {
                verify(context, snapshot.retryCount(), bound);
            } catch (RetryContextMismatchException ex) {
                throw failed(attempt, ex);
            }

            metrics.attempt(functionId);
            long start = System.nanoTime();
            Object output;
            try {
                output = invoker.invoke(definition, request, context);
            } catch (RetryContextMismatchException ex) {
                throw failed(attempt, ex);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                token.cancel();
                throw cancelled(attempt);
            } catch (Exception ex) {
                ErrorInfo error = new ErrorInfo(FUNCTION_ERROR, messageOf(ex));
                if (context.retryCount() >= bound) {
                    attempt.markExhausted(new ErrorInfo(RETRIES_EXHAUSTED, error.message()), clock.instant());
                    metrics.exhausted(functionId);
                    log.warn("Invocation {} of {} exhausted after {} attempts: {}",
                            invocationId, functionId, context.retryCount() + 1, error.message());
                    throw new RetryExhaustedException(invocationId, functionId, context.retryCount(), bound, ex);
                }
                attempt.advance(error, clock.instant());
                metrics.retry(functionId);
                log.info("Attempt {} of invocation {} for {} failed, retrying: {}",
                        context.retryCount(), invocationId, functionId, error.message());
                backOff(token, attempt.retryCount());
                continue;
            } finally {
                metrics.latency(functionId).record(System.nanoTime() - start, TimeUnit.NANOSECONDS);
            }

            attempt.markSucceeded(output, clock.instant());
            metrics.success(functionId);
            log.debug("Invocation {} of {} succeeded on attempt {}", invocationId, functionId, context.retryCount());
            return new InvocationOutcome(invocationId, functionId, output, context.retryCount(), bound);
        }
    }

    static void verify(ExecutionContext context, int expectedRetryCount, int expectedMaxRetryCount) {
        if (context.retryCount() != expectedRetryCount) {
            throw new RetryContextMismatchException("retryCount", expectedRetryCount, context.retryCount());
        }
        if (context.maxRetryCount() != expectedMaxRetryCount) {
            throw new RetryContextMismatchException("maxRetryCount", expectedMaxRetryCount, context.maxRetryCount());
        }
    }

    private void backOff(CancellationToken token, int nextRetryCount) {
        Duration delay = backoffPolicy.delayBefore(nextRetryCount);
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return;
        }
        try {
            token.await(delay);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            token.cancel();
        }
    }

    private RetryContextMismatchException failed(InvocationAttempt attempt, RetryContextMismatchException ex) {
        attempt.markFailed(new ErrorInfo(INTERNAL_CONSISTENCY, ex.getMessage()), clock.instant());
        metrics.consistencyError(attempt.functionId());
        log.error("Invocation {} of {} stopped: {}", attempt.invocationId(), attempt.functionId(), ex.getMessage());
        return ex;
    }

    private InvocationCancelledException cancelled(InvocationAttempt attempt) {
        int retryCount = attempt.retryCount();
        attempt.markCancelled(new ErrorInfo(CANCELLED, "Cancelled before attempt " + retryCount), clock.instant());
        metrics.cancelled(attempt.functionId());
        log.info("Invocation {} of {} cancelled before attempt {}", attempt.invocationId(), attempt.functionId(), retryCount);
        return new InvocationCancelledException(attempt.invocationId(), retryCount);
    }

    private static String messageOf(Throwable ex) {
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
