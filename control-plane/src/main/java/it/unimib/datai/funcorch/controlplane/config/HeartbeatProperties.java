package it.unimib.datai.funcorch.controlplane.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * @param pollInterval time-to-live of a heartbeat; a host is live until its last heartbeat plus this interval
 */
@ConfigurationProperties(prefix = "funcorch.heartbeat")
public record HeartbeatProperties(Duration pollInterval) {
    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofSeconds(30);

    public HeartbeatProperties {
        if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
            pollInterval = DEFAULT_POLL_INTERVAL;
        }
    }
}
