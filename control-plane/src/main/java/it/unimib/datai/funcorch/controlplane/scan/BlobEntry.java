package it.unimib.datai.funcorch.controlplane.scan;

import java.time.Instant;
import java.util.Map;

/**
 * One blob found while enumerating a container.
 *
 * @param name blob name relative to its container
 * @param lastModified may be null when the store does not report it
 */
public record BlobEntry(
        String name,
        Instant lastModified,
        Map<String, String> metadata
) {
    public BlobEntry {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
