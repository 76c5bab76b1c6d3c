package it.unimib.datai.funcorch.controlplane.heartbeat;

import it.unimib.datai.funcorch.common.model.RunningHost;
import it.unimib.datai.funcorch.controlplane.config.HeartbeatProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Last heartbeat per host assembly. Liveness is derived from the stored timestamp at query time.
 */
@Component
public class HeartbeatTracker {
    private static final Logger log = LoggerFactory.getLogger(HeartbeatTracker.class);

    private final Map<String, Instant> lastHeartbeats = new ConcurrentHashMap<>();
    private final Clock clock;
    private final Duration pollInterval;

    public HeartbeatTracker(Clock clock, HeartbeatProperties properties) {
        this.clock = clock;
        this.pollInterval = properties.pollInterval();
    }

    /**
     * Records "now" as the last heartbeat of the given assembly.
     */
    public RunningHost touch(String assemblyFullName) {
        if (assemblyFullName == null || assemblyFullName.isBlank()) {
            throw new IllegalArgumentException("assemblyFullName is required");
        }
        Instant now = clock.instant();
        Instant previous = lastHeartbeats.put(assemblyFullName, now);
        if (previous == null) {
            log.info("First heartbeat from {}", assemblyFullName);
        }
        return new RunningHost(assemblyFullName, now);
    }

    public boolean isLive(String assemblyFullName) {
        if (assemblyFullName == null) {
            return false;
        }
        Instant last = lastHeartbeats.get(assemblyFullName);
        return last != null && isLive(new RunningHost(assemblyFullName, last));
    }

    /**
     * Applies the liveness rule to a record read earlier, e.g. from {@link #readAll()}.
     */
    public boolean isLive(RunningHost heartbeat) {
        if (heartbeat == null || heartbeat.lastHeartbeatUtc() == null) {
            return false;
        }
        return clock.instant().isBefore(heartbeat.lastHeartbeatUtc().plus(pollInterval));
    }

    public List<RunningHost> readAll() {
        return lastHeartbeats.entrySet().stream()
                .map(e -> new RunningHost(e.getKey(), e.getValue()))
                .toList();
    }

    public Duration pollInterval() {
        return pollInterval;
    }
}
