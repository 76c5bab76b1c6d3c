package it.unimib.datai.funcorch.controlplane.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class Metrics {
    private final MeterRegistry registry;
    private final Map<String, Counter> attemptCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> retryCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> successCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> exhaustedCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> consistencyErrorCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> cancelledCounters = new ConcurrentHashMap<>();
    private final Map<String, Counter> scanCounters = new ConcurrentHashMap<>();
    private final Map<String, Timer> latencyTimers = new ConcurrentHashMap<>();

    public Metrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void attempt(String function) {
        counter(attemptCounters, "invocation_attempt_total", "function", function).increment();
    }

    public void retry(String function) {
        counter(retryCounters, "invocation_retry_total", "function", function).increment();
    }

    public void success(String function) {
        counter(successCounters, "invocation_success_total", "function", function).increment();
    }

    public void exhausted(String function) {
        counter(exhaustedCounters, "invocation_exhausted_total", "function", function).increment();
    }

    public void consistencyError(String function) {
        counter(consistencyErrorCounters, "invocation_consistency_error_total", "function", function).increment();
    }

    public void cancelled(String function) {
        counter(cancelledCounters, "invocation_cancelled_total", "function", function).increment();
    }

    public void scanned(String account, int entries) {
        counter(scanCounters, "scan_entries_total", "account", account).increment(entries);
    }

    public Timer latency(String function) {
        return latencyTimers.computeIfAbsent(function, name -> Timer.builder("invocation_latency_ms")
                .tag("function", name)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry));
    }

    private Counter counter(Map<String, Counter> map, String name, String tag, String value) {
        return map.computeIfAbsent(value, key -> Counter.builder(name)
                .tag(tag, value)
                .register(registry));
    }
}
