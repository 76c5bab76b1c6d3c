package it.unimib.datai.funcorch.controlplane.execution;

import java.time.Duration;

/**
 * Delay applied before re-dispatching a failed attempt.
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param retryCount index of the attempt about to run, always at least 1
     */
    Duration delayBefore(int retryCount);

    static BackoffPolicy none() {
        return retryCount -> Duration.ZERO;
    }

    static BackoffPolicy fixed(Duration delay) {
        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must not be negative");
        }
        return retryCount -> delay;
    }

    /**
     * {@code base * 2^(retryCount - 1)}, capped at {@code max}.
     */
    static BackoffPolicy exponential(Duration base, Duration max) {
        if (base.isNegative() || max.compareTo(base) < 0) {
            throw new IllegalArgumentException("expected 0 <= base <= max, got base=" + base + " max=" + max);
        }
        return retryCount -> {
            int shift = Math.min(Math.max(retryCount - 1, 0), 30);
            long millis = base.toMillis() << shift;
            if (millis < 0 || millis > max.toMillis()) {
                return max;
            }
            return Duration.ofMillis(millis);
        };
    }
}
