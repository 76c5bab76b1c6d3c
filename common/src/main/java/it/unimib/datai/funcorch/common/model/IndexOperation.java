package it.unimib.datai.funcorch.common.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import jakarta.validation.constraints.NotBlank;

/**
 * Command consumed once by the indexer: scan a blob path into the registry, or delete a function.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IndexOperation.Index.class, name = "index"),
        @JsonSubTypes.Type(value = IndexOperation.Delete.class, name = "delete")
})
public sealed interface IndexOperation permits IndexOperation.Index, IndexOperation.Delete {

    /**
     * Scan {@code blobPath} of an account. The account is given either as a full connection string
     * or as a name with an optional key; with no key the indexer looks up a connection string
     * already seen for that account name.
     */
    record Index(
            String accountName,
            String accountKey,
            String accountConnectionString,
            @NotBlank(message = "blobPath is required") String blobPath
    ) implements IndexOperation {

        public static Index forConnectionString(String accountConnectionString, String blobPath) {
            return new Index(null, null, accountConnectionString, blobPath);
        }

        public static Index forAccount(String accountName, String accountKey, String blobPath) {
            return new Index(accountName, accountKey, null, blobPath);
        }

        @Override
        public String toString() {
            return "Index[account=" + accountName + ", blobPath=" + blobPath + "]";
        }
    }

    record Delete(
            @NotBlank(message = "functionId is required") String functionId
    ) implements IndexOperation {
    }
}
