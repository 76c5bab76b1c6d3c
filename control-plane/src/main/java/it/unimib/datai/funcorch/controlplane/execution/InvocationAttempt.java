package it.unimib.datai.funcorch.controlplane.execution;

import it.unimib.datai.funcorch.common.model.ErrorInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;

/**
 * Retry state of one logical invocation.
 *
 * All mutable state is guarded by {@code this}. Use {@link #snapshot()} for a consistent view.
 */
public class InvocationAttempt {
    private static final Logger log = LoggerFactory.getLogger(InvocationAttempt.class);
    private static final Map<AttemptState, EnumSet<AttemptState>> ALLOWED_TRANSITIONS;

    static {
        ALLOWED_TRANSITIONS = new EnumMap<>(AttemptState.class);
        ALLOWED_TRANSITIONS.put(AttemptState.PENDING, EnumSet.of(AttemptState.ATTEMPTING, AttemptState.CANCELLED));
        ALLOWED_TRANSITIONS.put(AttemptState.ATTEMPTING, EnumSet.of(AttemptState.PENDING, AttemptState.SUCCEEDED,
                AttemptState.EXHAUSTED, AttemptState.FAILED, AttemptState.CANCELLED));
        EnumSet<AttemptState> reopen = EnumSet.of(AttemptState.PENDING);
        ALLOWED_TRANSITIONS.put(AttemptState.SUCCEEDED, reopen);
        ALLOWED_TRANSITIONS.put(AttemptState.EXHAUSTED, reopen);
        ALLOWED_TRANSITIONS.put(AttemptState.FAILED, reopen);
        ALLOWED_TRANSITIONS.put(AttemptState.CANCELLED, reopen);
    }

    private final String invocationId;
    private final String functionId;

    private int maxRetryCount;
    private int retryCount;
    private AttemptState state;
    private Instant startedAt;
    private Instant finishedAt;
    private Instant updatedAt;
    private ErrorInfo lastError;
    private Object output;
    private CancellationToken cancellationToken;

    public InvocationAttempt(String invocationId, String functionId, int maxRetryCount, Instant now) {
        this.invocationId = invocationId;
        this.functionId = functionId;
        this.maxRetryCount = maxRetryCount;
        this.state = AttemptState.PENDING;
        this.updatedAt = now;
        this.cancellationToken = new CancellationToken();
    }

    public String invocationId() {
        return invocationId;
    }

    public String functionId() {
        return functionId;
    }

    public synchronized Snapshot snapshot() {
        return new Snapshot(invocationId, functionId, state, retryCount, maxRetryCount,
                startedAt, finishedAt, lastError, output);
    }

    private void validateTransition(AttemptState target) {
        EnumSet<AttemptState> allowed = ALLOWED_TRANSITIONS.getOrDefault(state, EnumSet.noneOf(AttemptState.class));
        if (!allowed.contains(target)) {
            log.warn("Invalid attempt transition {} -> {} for invocation {}", state, target, invocationId);
        }
    }

    /**
     * Starts a new logical invocation on a finished record. The counter is kept unless {@code reset}.
     */
    public synchronized void reopen(boolean reset, int maxRetryCount, Instant now) {
        validateTransition(AttemptState.PENDING);
        if (reset) {
            this.retryCount = 0;
        }
        this.maxRetryCount = maxRetryCount;
        this.state = AttemptState.PENDING;
        this.startedAt = null;
        this.finishedAt = null;
        this.lastError = null;
        this.output = null;
        this.updatedAt = now;
        this.cancellationToken = new CancellationToken();
    }

    public synchronized void markAttemptStarted(Instant now) {
        validateTransition(AttemptState.ATTEMPTING);
        this.state = AttemptState.ATTEMPTING;
        if (startedAt == null) {
            startedAt = now;
        }
        this.updatedAt = now;
    }

    public synchronized void markSucceeded(Object output, Instant now) {
        validateTransition(AttemptState.SUCCEEDED);
        this.state = AttemptState.SUCCEEDED;
        this.output = output;
        this.lastError = null;
        this.finishedAt = now;
        this.updatedAt = now;
    }

    /**
     * Records a failed attempt and moves the counter to the next one.
     */
    public synchronized void advance(ErrorInfo error, Instant now) {
        validateTransition(AttemptState.PENDING);
        this.state = AttemptState.PENDING;
        this.retryCount++;
        this.lastError = error;
        this.updatedAt = now;
    }

    public synchronized void markExhausted(ErrorInfo error, Instant now) {
        finish(AttemptState.EXHAUSTED, error, now);
    }

    public synchronized void markFailed(ErrorInfo error, Instant now) {
        finish(AttemptState.FAILED, error, now);
    }

    public synchronized void markCancelled(ErrorInfo error, Instant now) {
        finish(AttemptState.CANCELLED, error, now);
    }

    private void finish(AttemptState target, ErrorInfo error, Instant now) {
        validateTransition(target);
        this.state = target;
        this.lastError = error;
        this.output = null;
        this.finishedAt = now;
        this.updatedAt = now;
    }

    public synchronized boolean isActive() {
        return !state.isTerminal();
    }

    public synchronized int retryCount() {
        return retryCount;
    }

    public synchronized AttemptState state() {
        return state;
    }

    public synchronized Instant updatedAt() {
        return updatedAt;
    }

    public synchronized CancellationToken cancellationToken() {
        return cancellationToken;
    }

    public record Snapshot(
            String invocationId,
            String functionId,
            AttemptState state,
            int retryCount,
            int maxRetryCount,
            Instant startedAt,
            Instant finishedAt,
            ErrorInfo lastError,
            Object output
    ) {}
}
