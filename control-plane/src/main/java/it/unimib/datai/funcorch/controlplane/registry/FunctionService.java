package it.unimib.datai.funcorch.controlplane.registry;

import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import it.unimib.datai.funcorch.common.model.FunctionGroup;
import it.unimib.datai.funcorch.common.model.FunctionListing;
import it.unimib.datai.funcorch.common.model.FunctionLocation;
import it.unimib.datai.funcorch.common.model.FunctionSummary;
import it.unimib.datai.funcorch.common.model.RemoteFunctionLocation;
import it.unimib.datai.funcorch.common.model.RunningHost;
import it.unimib.datai.funcorch.common.model.StorageAccount;
import it.unimib.datai.funcorch.common.model.UrlFunctionLocation;
import it.unimib.datai.funcorch.controlplane.heartbeat.HeartbeatTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class FunctionService {
    private static final Logger log = LoggerFactory.getLogger(FunctionService.class);
    static final String OTHER_GROUP = "other";

    private final FunctionRegistry registry;
    private final HeartbeatTracker heartbeatTracker;
    private final Clock clock;

    public FunctionService(FunctionRegistry registry, HeartbeatTracker heartbeatTracker, Clock clock) {
        this.registry = registry;
        this.heartbeatTracker = heartbeatTracker;
        this.clock = clock;
    }

    public List<FunctionDefinition> list() {
        return registry.readAll();
    }

    public Optional<FunctionDefinition> get(String id) {
        return registry.get(id);
    }

    /**
     * Registers a definition, stamping it with the current time when it carries none.
     *
     * @return true if the function was not known before
     */
    public boolean register(FunctionDefinition definition) {
        FunctionDefinition stamped = definition.timestamp() == null
                ? definition.withTimestamp(clock.instant())
                : definition;
        boolean added = registry.register(stamped);
        if (added) {
            log.info("Registered function {}", stamped.id());
        }
        return added;
    }

    public boolean delete(String id) {
        boolean deleted = registry.delete(id);
        if (deleted) {
            log.info("Deleted function {}", id);
        } else {
            log.debug("Delete of unknown function {} ignored", id);
        }
        return deleted;
    }

    /**
     * All functions grouped by location, each annotated with the liveness of its host.
     * Heartbeats are read once so every function is judged against the same snapshot.
     */
    public FunctionListing listing() {
        Map<String, RunningHost> heartbeats = heartbeatTracker.readAll().stream()
                .collect(Collectors.toMap(RunningHost::assemblyFullName, Function.identity(), (a, b) -> b));

        Map<String, List<FunctionSummary>> groups = new LinkedHashMap<>();
        boolean hasWarning = false;
        for (FunctionDefinition definition : registry.readAll()) {
            RunningHost heartbeat = definition.assemblyFullName() == null
                    ? null
                    : heartbeats.get(definition.assemblyFullName());
            boolean running = heartbeatTracker.isLive(heartbeat);
            hasWarning |= !running;
            groups.computeIfAbsent(groupingKey(definition.location()), k -> new ArrayList<>())
                    .add(toSummary(definition, running));
        }

        List<FunctionGroup> result = groups.entrySet().stream()
                .map(e -> new FunctionGroup(e.getKey(), List.copyOf(e.getValue())))
                .toList();
        return new FunctionListing(result, hasWarning);
    }

    /**
     * Finds the connection string of an account already seen on a registered function.
     * Account names compare case-insensitively.
     */
    public Optional<String> tryLookupConnectionString(String accountName) {
        if (accountName == null || accountName.isBlank()) {
            return Optional.empty();
        }
        for (FunctionDefinition definition : registry.readAll()) {
            String connectionString = definition.location().accountConnectionString();
            if (connectionString == null) {
                continue;
            }
            try {
                if (StorageAccount.accountNameOf(connectionString).equalsIgnoreCase(accountName)) {
                    return Optional.of(connectionString);
                }
            } catch (IllegalArgumentException ex) {
                log.debug("Skipping function {} with unreadable account: {}", definition.id(), ex.getMessage());
            }
        }
        return Optional.empty();
    }

    static String groupingKey(FunctionLocation location) {
        return switch (location.kind()) {
            case REMOTE -> ((RemoteFunctionLocation) location).blob().toString();
            case URL -> normalizedUrl(((UrlFunctionLocation) location).invokeUrl());
            case LOCAL -> OTHER_GROUP;
        };
    }

    // Unparseable URLs group under themselves.
    private static String normalizedUrl(String invokeUrl) {
        try {
            return new URI(invokeUrl).normalize().toString();
        } catch (URISyntaxException ex) {
            log.debug("Grouping unparseable invoke URL {} as is", invokeUrl);
            return invokeUrl;
        }
    }

    private static FunctionSummary toSummary(FunctionDefinition definition, boolean hostIsRunning) {
        FunctionLocation location = definition.location();
        return new FunctionSummary(
                location.id(),
                location.shortName(),
                location.kind(),
                definition.description(),
                definition.timestamp(),
                definition.assemblyFullName(),
                hostIsRunning
        );
    }
}
