package it.unimib.datai.funcorch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Function packaged as a blob inside a storage account.
 */
public record RemoteFunctionLocation(
        @NotBlank @JsonProperty(access = JsonProperty.Access.WRITE_ONLY) String accountConnectionString,
        @NotNull BlobPath blob,
        @NotBlank String entryPoint
) implements FunctionLocation {

    @Override
    public LocationKind kind() {
        return LocationKind.REMOTE;
    }

    @Override
    public String id() {
        return StorageAccount.accountNameOf(accountConnectionString) + "/" + blob;
    }

    @Override
    public String shortName() {
        return blob.blobName() == null ? blob.container() : blob.blobName();
    }

    public StorageAccount account() {
        return StorageAccount.fromConnectionString(accountConnectionString);
    }
}
