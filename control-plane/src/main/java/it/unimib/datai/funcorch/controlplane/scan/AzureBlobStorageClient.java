package it.unimib.datai.funcorch.controlplane.scan;

import com.azure.core.util.Context;
import com.azure.storage.blob.BlobContainerClient;
import com.azure.storage.blob.BlobServiceClientBuilder;
import com.azure.storage.blob.models.BlobItem;
import com.azure.storage.blob.models.BlobItemProperties;
import com.azure.storage.blob.models.BlobListDetails;
import com.azure.storage.blob.models.ListBlobsOptions;
import it.unimib.datai.funcorch.common.model.BlobPath;
import it.unimib.datai.funcorch.common.model.StorageAccount;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Enumerates blobs with the Azure Storage Blob SDK. A client is built per call from the
 * account's connection string, and the whole call is bounded by the given timeout.
 */
@Component
public class AzureBlobStorageClient implements BlobStorageClient {
    private static final Logger log = LoggerFactory.getLogger(AzureBlobStorageClient.class);

    @Override
    public List<BlobEntry> list(StorageAccount account, BlobPath path, Duration timeout) {
        BlobContainerClient container = new BlobServiceClientBuilder()
                .connectionString(account.connectionString())
                .buildClient()
                .getBlobContainerClient(path.container());

        Instant deadline = Instant.now().plus(timeout);
        if (!container.existsWithResponse(timeout, Context.NONE).getValue()) {
            log.debug("Container {} does not exist in account {}", path.container(), account.name());
            return List.of();
        }

        ListBlobsOptions options = new ListBlobsOptions()
                .setPrefix(path.blobName())
                .setDetails(new BlobListDetails().setRetrieveMetadata(true));

        List<BlobEntry> entries = new ArrayList<>();
        for (BlobItem item : container.listBlobs(options, remaining(deadline, path))) {
            if (Boolean.TRUE.equals(item.isPrefix())) {
                continue;
            }
            entries.add(new BlobEntry(item.getName(), lastModified(item.getProperties()), item.getMetadata()));
        }
        return entries;
    }

    // The existence check and the listing share one budget.
    private static Duration remaining(Instant deadline, BlobPath path) {
        Duration left = Duration.between(Instant.now(), deadline);
        if (left.isNegative() || left.isZero()) {
            throw new IllegalStateException("Timed out before listing " + path);
        }
        return left;
    }

    private static Instant lastModified(BlobItemProperties properties) {
        if (properties == null || properties.getLastModified() == null) {
            return null;
        }
        return properties.getLastModified().toInstant();
    }
}
