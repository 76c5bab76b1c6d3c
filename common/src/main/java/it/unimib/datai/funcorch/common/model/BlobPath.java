package it.unimib.datai.funcorch.common.model;

import jakarta.validation.constraints.NotBlank;

/**
 * A container plus an optional blob name. When used as a scan target the blob name acts as a prefix.
 */
public record BlobPath(
        @NotBlank String container,
        String blobName
) {
    public BlobPath {
        if (container == null || container.isBlank()) {
            throw new IllegalArgumentException("Container name is required");
        }
        if (blobName != null && blobName.isBlank()) {
            blobName = null;
        }
    }

    /**
     * Parses {@code "container"} or {@code "container/some/blob"}. A leading slash is ignored.
     */
    public static BlobPath parse(String path) {
        if (path == null) {
            throw new IllegalArgumentException("Blob path is required");
        }
        String trimmed = path.trim();
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        int slash = trimmed.indexOf('/');
        if (slash < 0) {
            return new BlobPath(trimmed, null);
        }
        return new BlobPath(trimmed.substring(0, slash), trimmed.substring(slash + 1));
    }

    public BlobPath child(String name) {
        return new BlobPath(container, name);
    }

    @Override
    public String toString() {
        return blobName == null ? container : container + "/" + blobName;
    }
}
