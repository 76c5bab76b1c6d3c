package it.unimib.datai.funcorch.common.model;

import java.time.Instant;

/**
 * Last heartbeat seen from a host, keyed by the full name of the assembly it runs.
 */
public record RunningHost(
        String assemblyFullName,
        Instant lastHeartbeatUtc
) {
}
