package it.unimib.datai.funcorch.controlplane.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "funcorch.scan")
public record ScanProperties(
        Duration timeout,
        Boolean rescanEnabled,
        Duration rescanInterval
) {
    public ScanProperties {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            timeout = Duration.ofSeconds(30);
        }
        if (rescanEnabled == null) {
            rescanEnabled = false;
        }
        if (rescanInterval == null || rescanInterval.isNegative() || rescanInterval.isZero()) {
            rescanInterval = Duration.ofMinutes(5);
        }
    }

    public static ScanProperties defaults() {
        return new ScanProperties(null, null, null);
    }
}
