package it.unimib.datai.funcorch.controlplane.config;

import it.unimib.datai.funcorch.controlplane.execution.BackoffPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Retry bound and inter-attempt backoff shared by every invocation.
 */
@ConfigurationProperties(prefix = "funcorch.retry")
public record RetryProperties(
        Integer maxRetryCount,
        BackoffKind backoff,
        Long backoffMs,
        Long maxBackoffMs,
        Long attemptTtlMs
) {
    public static final int DEFAULT_MAX_RETRY_COUNT = 2;

    public RetryProperties {
        if (maxRetryCount == null || maxRetryCount < 0) {
            maxRetryCount = DEFAULT_MAX_RETRY_COUNT;
        }
        if (backoff == null) {
            backoff = BackoffKind.NONE;
        }
        if (backoffMs == null || backoffMs < 0) {
            backoffMs = 0L;
        }
        if (maxBackoffMs == null || maxBackoffMs < backoffMs) {
            maxBackoffMs = Math.max(backoffMs, 30_000L);
        }
        if (attemptTtlMs == null || attemptTtlMs <= 0) {
            attemptTtlMs = 600_000L;
        }
    }

    public static RetryProperties defaults() {
        return new RetryProperties(null, null, null, null, null);
    }

    public BackoffPolicy backoffPolicy() {
        return switch (backoff) {
            case NONE -> BackoffPolicy.none();
            case FIXED -> BackoffPolicy.fixed(Duration.ofMillis(backoffMs));
            case EXPONENTIAL -> BackoffPolicy.exponential(Duration.ofMillis(backoffMs), Duration.ofMillis(maxBackoffMs));
        };
    }

    public enum BackoffKind {
        NONE,
        FIXED,
        EXPONENTIAL
    }
}
