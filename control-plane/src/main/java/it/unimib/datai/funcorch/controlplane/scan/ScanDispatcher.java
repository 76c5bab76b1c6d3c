package it.unimib.datai.funcorch.controlplane.scan;

import it.unimib.datai.funcorch.common.model.BlobPath;
import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.RemoteFunctionLocation;
import it.unimib.datai.funcorch.common.model.StorageAccount;
import it.unimib.datai.funcorch.controlplane.config.ScanProperties;
import it.unimib.datai.funcorch.controlplane.registry.FunctionRegistry;
import it.unimib.datai.funcorch.controlplane.service.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Discovers functions by enumerating a storage container. Discovery is best effort: storage
 * failures are logged and count as nothing scanned.
 */
@Service
public class ScanDispatcher {
    private static final Logger log = LoggerFactory.getLogger(ScanDispatcher.class);

    static final String ENTRY_POINT_METADATA = "entrypoint";
    static final String ASSEMBLY_METADATA = "assembly";
    static final String DESCRIPTION_METADATA = "description";

    private final BlobStorageClient storageClient;
    private final FunctionRegistry registry;
    private final ScanProperties properties;
    private final Metrics metrics;
    private final Clock clock;

    public ScanDispatcher(BlobStorageClient storageClient,
                          FunctionRegistry registry,
                          ScanProperties properties,
                          Metrics metrics,
                          Clock clock) {
        this.storageClient = storageClient;
        this.registry = registry;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
    }

    /**
     * Registers every blob under {@code containerPath} not yet known and refreshes the timestamp of
     * the known ones.
     *
     * @return number of blobs examined, including those already registered
     */
    public int scan(StorageAccount account, BlobPath containerPath) {
        List<BlobEntry> entries;
        try {
            entries = storageClient.list(account, containerPath, properties.timeout());
        } catch (RuntimeException ex) {
            log.warn("Scan of {}/{} failed, nothing scanned: {}", account.name(), containerPath, ex.getMessage());
            return 0;
        }

        int added = 0;
        for (BlobEntry entry : entries) {
            if (registry.register(toDefinition(account, containerPath, entry))) {
                added++;
            }
        }
        metrics.scanned(account.name(), entries.size());
        log.info("Scanned {} entries under {}/{}, {} new", entries.size(), account.name(), containerPath, added);
        return entries.size();
    }

    FunctionDefinition toDefinition(StorageAccount account, BlobPath containerPath, BlobEntry entry) {
        String baseName = baseName(entry.name());
        String entryPoint = entry.metadata().getOrDefault(ENTRY_POINT_METADATA, baseName);
        String assembly = entry.metadata().getOrDefault(ASSEMBLY_METADATA, baseName);
        BlobPath blob = containerPath.child(entry.name());
        String description = entry.metadata().getOrDefault(DESCRIPTION_METADATA, "Discovered in " + blob);
        return new FunctionDefinition(
                new RemoteFunctionLocation(account.connectionString(), blob, entryPoint),
                description,
                entry.lastModified() == null ? clock.instant() : entry.lastModified(),
                assembly
        );
    }

    static String baseName(String blobName) {
        String name = blobName;
        int slash = name.lastIndexOf('/');
        if (slash >= 0) {
            name = name.substring(slash + 1);
        }
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
