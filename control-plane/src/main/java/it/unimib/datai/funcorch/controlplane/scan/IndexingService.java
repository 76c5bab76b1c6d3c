package it.unimib.datai.funcorch.controlplane.scan;

import it.unimib.datai.funcorch.common.model.BlobPath;
import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.FunctionLocation;
import it.unimib.datai.funcorch.common.model.IndexOperation;
import it.unimib.datai.funcorch.common.model.IndexOperationResult;
import it.unimib.datai.funcorch.common.model.RemoteFunctionLocation;
import it.unimib.datai.funcorch.common.model.StorageAccount;
import it.unimib.datai.funcorch.controlplane.registry.FunctionNotFoundException;
import it.unimib.datai.funcorch.controlplane.registry.FunctionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Entry point for registration and deletion commands.
 */
@Service
public class IndexingService {
    private static final Logger log = LoggerFactory.getLogger(IndexingService.class);

    private final ScanDispatcher scanDispatcher;
    private final FunctionService functionService;

    public IndexingService(ScanDispatcher scanDispatcher, FunctionService functionService) {
        this.scanDispatcher = scanDispatcher;
        this.functionService = functionService;
    }

    public IndexOperationResult process(IndexOperation operation) {
        if (operation instanceof IndexOperation.Index index) {
            StorageAccount account = resolveAccount(index);
            BlobPath path;
            try {
                path = BlobPath.parse(index.blobPath());
            } catch (IllegalArgumentException ex) {
                log.warn("Scan of {}/{} skipped, invalid blob path: {}", account.name(), index.blobPath(), ex.getMessage());
                return IndexOperationResult.scanned(account.name() + "/" + index.blobPath(), 0);
            }
            return IndexOperationResult.scanned(account.name() + "/" + path, scanDispatcher.scan(account, path));
        }
        if (operation instanceof IndexOperation.Delete delete) {
            return IndexOperationResult.deleted(delete.functionId(), functionService.delete(delete.functionId()));
        }
        throw new IllegalArgumentException("Unsupported index operation: " + operation);
    }

    /**
     * Scans again the container that holds a registered function.
     */
    public IndexOperationResult rescan(String functionId) {
        FunctionDefinition definition = functionService.get(functionId)
                .orElseThrow(() -> new FunctionNotFoundException(functionId));
        StorageAccount account = accountOf(definition.location());
        BlobPath container = containerOf(definition.location());
        return IndexOperationResult.scanned(account.name() + "/" + container, scanDispatcher.scan(account, container));
    }

    /**
     * Rescans every distinct container that currently holds a registered remote function.
     *
     * @return total number of entries examined
     */
    public int rescanAll() {
        Set<ScanTarget> targets = new LinkedHashSet<>();
        for (FunctionDefinition definition : functionService.list()) {
            if (definition.location() instanceof RemoteFunctionLocation remote) {
                targets.add(new ScanTarget(remote.accountConnectionString(), remote.blob().container()));
            }
        }
        int total = 0;
        for (ScanTarget target : targets) {
            try {
                total += scanDispatcher.scan(StorageAccount.fromConnectionString(target.connectionString()),
                        new BlobPath(target.container(), null));
            } catch (IllegalArgumentException ex) {
                log.warn("Skipping rescan of container {}: {}", target.container(), ex.getMessage());
            }
        }
        return total;
    }

    /**
     * Resolution order: explicit connection string, then a connection string already registered for
     * the account name when no key is given, then name and key.
     */
    StorageAccount resolveAccount(IndexOperation.Index index) {
        if (index.accountConnectionString() != null && !index.accountConnectionString().isBlank()) {
            return StorageAccount.fromConnectionString(index.accountConnectionString());
        }
        String accountName = index.accountName();
        if (accountName == null || accountName.isBlank()) {
            throw new UnknownAccountException("Either accountConnectionString or accountName is required");
        }
        if (index.accountKey() == null || index.accountKey().isBlank()) {
            if (StorageAccount.DEVELOPMENT_ACCOUNT_NAME.equals(accountName)) {
                return StorageAccount.development();
            }
            return functionService.tryLookupConnectionString(accountName)
                    .map(StorageAccount::fromConnectionString)
                    .orElseThrow(() -> new UnknownAccountException(
                            "No key given and no registered function uses account " + accountName));
        }
        return StorageAccount.fromNameAndKey(accountName, index.accountKey());
    }

    private static StorageAccount accountOf(FunctionLocation location) {
        return switch (location.kind()) {
            case REMOTE -> ((RemoteFunctionLocation) location).account();
            case URL, LOCAL -> {
                if (location.accountConnectionString() == null) {
                    throw new IllegalArgumentException("Function " + location.id() + " has no storage account");
                }
                yield StorageAccount.fromConnectionString(location.accountConnectionString());
            }
        };
    }

    private static BlobPath containerOf(FunctionLocation location) {
        if (location instanceof RemoteFunctionLocation remote) {
            return new BlobPath(remote.blob().container(), null);
        }
        throw new IllegalArgumentException("Function " + location.id() + " is not stored in a blob container");
    }

    private record ScanTarget(String connectionString, String container) {
    }
}
