package it.unimib.datai.funcorch.controlplane.scan;

import it.unimib.datai.funcorch.common.model.BlobPath;
import it.unimib.datai.funcorch.common.model.StorageAccount;

import java.time.Duration;
import java.util.List;

public interface BlobStorageClient {

    /**
     * Lists the blobs of {@code path.container()} whose names start with {@code path.blobName()}.
     * A container that does not exist yields an empty list.
     *
     * @throws RuntimeException when the store is unreachable or the call exceeds {@code timeout}
     */
    List<BlobEntry> list(StorageAccount account, BlobPath path, Duration timeout);
}
