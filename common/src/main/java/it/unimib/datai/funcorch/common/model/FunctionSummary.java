package it.unimib.datai.funcorch.common.model;

import java.time.Instant;

/**
 * Read-only view of a registered function, annotated with the liveness of its host.
 */
public record FunctionSummary(
        String id,
        String shortName,
        LocationKind kind,
        String description,
        Instant timestamp,
        String assemblyFullName,
        boolean hostIsRunning
) {
}
