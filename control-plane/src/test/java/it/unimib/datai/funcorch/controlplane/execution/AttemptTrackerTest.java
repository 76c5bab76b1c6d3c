package it.unimib.datai.funcorch.controlplane.execution;

import it.unimib.datai.funcorch.common.model.ErrorInfo;
import it.unimib.datai.funcorch.controlplane.config.RetryProperties;
import it.unimib.datai.funcorch.controlplane.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AttemptTrackerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private MutableClock clock;
    private AttemptTracker tracker;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        tracker = new AttemptTracker(new RetryProperties(2, null, null, null, 60_000L), clock);
    }

    @AfterEach
    void tearDown() {
        tracker.shutdown();
    }

    private static void finishWithSuccessOnAttempt(InvocationAttempt attempt, int retryCount) {
        for (int i = 0; i < retryCount; i++) {
            attempt.markAttemptStarted(T0);
            attempt.advance(new ErrorInfo("FUNCTION_ERROR", "boom"), T0);
        }
        attempt.markAttemptStarted(T0);
        attempt.markSucceeded("ok", T0);
    }

    @Test
    void begin_newId_startsAtZero() {
        InvocationAttempt attempt = tracker.begin("inv-1", "fn", false);

        assertThat(attempt.retryCount()).isZero();
        assertThat(attempt.state()).isEqualTo(AttemptState.PENDING);
        assertThat(attempt.snapshot().maxRetryCount()).isEqualTo(2);
    }

    @Test
    void begin_whileActive_throwsInProgress() {
        tracker.begin("inv-1", "fn", false);

        assertThatThrownBy(() -> tracker.begin("inv-1", "fn", false))
                .isInstanceOf(InvocationInProgressException.class);
    }

    @Test
    void begin_afterFinish_carriesCounterOver() {
        finishWithSuccessOnAttempt(tracker.begin("inv-1", "fn", false), 1);

        InvocationAttempt again = tracker.begin("inv-1", "fn", false);

        assertThat(again.retryCount()).isEqualTo(1);
        assertThat(again.isActive()).isTrue();
    }

    @Test
    void begin_withReset_restartsAtZero() {
        finishWithSuccessOnAttempt(tracker.begin("inv-1", "fn", false), 1);

        InvocationAttempt again = tracker.begin("inv-1", "fn", true);

        assertThat(again.retryCount()).isZero();
        assertThat(again.snapshot().lastError()).isNull();
    }

    @Test
    void begin_sameIdOtherFunction_startsFresh() {
        finishWithSuccessOnAttempt(tracker.begin("inv-1", "fn", false), 2);

        InvocationAttempt other = tracker.begin("inv-1", "other-fn", false);

        assertThat(other.functionId()).isEqualTo("other-fn");
        assertThat(other.retryCount()).isZero();
    }

    @Test
    void begin_sameIdOtherFunctionWhileActive_isRejectedAndKeepsRunningAttempt() {
        InvocationAttempt running = tracker.begin("inv-1", "fn", false);
        running.markAttemptStarted(T0);

        assertThatThrownBy(() -> tracker.begin("inv-1", "other-fn", false))
                .isInstanceOf(InvocationInProgressException.class);

        assertThat(tracker.get("inv-1")).containsSame(running);
        assertThat(tracker.cancel("inv-1")).isTrue();
        assertThat(running.cancellationToken().isCancelled()).isTrue();
    }

    @Test
    void counters_areIndependentPerInvocation() {
        InvocationAttempt a = tracker.begin("a", "fn", false);
        InvocationAttempt b = tracker.begin("b", "fn", false);

        a.markAttemptStarted(T0);
        a.advance(new ErrorInfo("FUNCTION_ERROR", "boom"), T0);

        assertThat(a.retryCount()).isEqualTo(1);
        assertThat(b.retryCount()).isZero();
    }

    @Test
    void cancel_activeInvocation_signalsToken() {
        InvocationAttempt attempt = tracker.begin("inv-1", "fn", false);

        assertThat(tracker.cancel("inv-1")).isTrue();
        assertThat(attempt.cancellationToken().isCancelled()).isTrue();
    }

    @Test
    void cancel_unknownOrFinished_returnsFalse() {
        finishWithSuccessOnAttempt(tracker.begin("inv-1", "fn", false), 0);

        assertThat(tracker.cancel("inv-1")).isFalse();
        assertThat(tracker.cancel("missing")).isFalse();
    }

    @Test
    void reopen_replacesCancelledToken() {
        InvocationAttempt attempt = tracker.begin("inv-1", "fn", false);
        tracker.cancel("inv-1");
        attempt.markCancelled(new ErrorInfo("CANCELLED", "x"), T0);

        InvocationAttempt again = tracker.begin("inv-1", "fn", false);

        assertThat(again.cancellationToken().isCancelled()).isFalse();
    }

    @Test
    void evictExpired_removesFinishedAfterTtl_keepsActiveUntilStale() {
        finishWithSuccessOnAttempt(tracker.begin("done", "fn", false), 0);
        tracker.begin("running", "fn", false);

        tracker.evictExpired(T0.plus(Duration.ofSeconds(61)));

        assertThat(tracker.get("done")).isEmpty();
        assertThat(tracker.get("running")).isPresent();

        tracker.evictExpired(T0.plus(Duration.ofSeconds(121)));

        assertThat(tracker.get("running")).isEmpty();
        assertThat(tracker.size()).isZero();
    }
}
