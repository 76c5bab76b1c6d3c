package it.unimib.datai.funcorch.common.model;

import java.time.Instant;

public record HostStatus(
        String assemblyFullName,
        Instant lastHeartbeatUtc,
        boolean live
) {
}
