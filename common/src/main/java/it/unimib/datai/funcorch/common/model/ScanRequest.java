package it.unimib.datai.funcorch.common.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Scan command: the account plus {@code container[/prefix]}.
 */
public record ScanRequest(
        String accountName,
        String accountKey,
        String accountConnectionString,
        @NotBlank(message = "containerPath is required") String containerPath
) {
    public IndexOperation.Index toIndexOperation() {
        return new IndexOperation.Index(accountName, accountKey, accountConnectionString, containerPath);
    }
}
