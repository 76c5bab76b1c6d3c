package it.unimib.datai.funcorch.controlplane.execution;

import it.unimib.datai.funcorch.controlplane.config.RetryProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Retry counters keyed by invocation id.
 */
@Component
public class AttemptTracker {
    private static final Logger log = LoggerFactory.getLogger(AttemptTracker.class);

    private final Map<String, InvocationAttempt> attempts = new ConcurrentHashMap<>();
    private final ScheduledExecutorService janitor = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "funcorch-attempt-janitor");
        t.setDaemon(true);
        return t;
    });
    private final RetryProperties properties;
    private final Clock clock;
    private final Duration ttl;
    /** Active records are force-evicted after this, so a stuck invocation cannot pin its id forever. */
    private final Duration staleTtl;

    public AttemptTracker(RetryProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.ttl = Duration.ofMillis(properties.attemptTtlMs());
        this.staleTtl = ttl.multipliedBy(2);
        janitor.scheduleAtFixedRate(() -> evictExpired(clock.instant()), 1, 1, TimeUnit.MINUTES);
    }

    /**
     * Opens a logical invocation. A known id keeps its counter unless {@code reset}; an id reused
     * for a different function starts over.
     *
     * @throws InvocationInProgressException if the id is still attempting
     */
    public InvocationAttempt begin(String invocationId, String functionId, boolean reset) {
        Instant now = clock.instant();
        int maxRetryCount = properties.maxRetryCount();
        return attempts.compute(invocationId, (id, existing) -> {
            if (existing == null) {
                return new InvocationAttempt(id, functionId, maxRetryCount, now);
            }
            if (existing.isActive()) {
                throw new InvocationInProgressException(id);
            }
            if (!existing.functionId().equals(functionId)) {
                return new InvocationAttempt(id, functionId, maxRetryCount, now);
            }
            existing.reopen(reset, maxRetryCount, now);
            return existing;
        });
    }

    public Optional<InvocationAttempt> get(String invocationId) {
        return Optional.ofNullable(attempts.get(invocationId));
    }

    /**
     * Signals cancellation to an active invocation.
     *
     * @return false if the id is unknown or already finished
     */
    public boolean cancel(String invocationId) {
        InvocationAttempt attempt = attempts.get(invocationId);
        if (attempt == null || !attempt.isActive()) {
            return false;
        }
        attempt.cancellationToken().cancel();
        log.info("Cancellation requested for invocation {}", invocationId);
        return true;
    }

    public int size() {
        return attempts.size();
    }

    void evictExpired(Instant now) {
        Instant cutoff = now.minus(ttl);
        Instant staleCutoff = now.minus(staleTtl);
        attempts.entrySet().removeIf(entry -> {
            InvocationAttempt attempt = entry.getValue();
            Instant updatedAt = attempt.updatedAt();
            if (updatedAt.isBefore(staleCutoff)) {
                return true;
            }
            return updatedAt.isBefore(cutoff) && !attempt.isActive();
        });
    }

    @PreDestroy
    public void shutdown() {
        janitor.shutdownNow();
    }
}
