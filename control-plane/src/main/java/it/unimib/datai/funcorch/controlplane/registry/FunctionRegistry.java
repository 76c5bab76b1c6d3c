package it.unimib.datai.funcorch.controlplane.registry;

import it.unimib.datai.funcorch.common.model.FunctionDefinition;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Function definitions keyed by location identifier.
 */
@Component
public class FunctionRegistry {
    private final Map<String, FunctionDefinition> functions = new ConcurrentHashMap<>();

    /**
     * Snapshot of all definitions; iteration order is unspecified.
     */
    public List<FunctionDefinition> readAll() {
        return List.copyOf(functions.values());
    }

    public Optional<FunctionDefinition> get(String id) {
        return Optional.ofNullable(functions.get(id));
    }

    /**
     * Upserts by location id. An existing definition keeps its content and only takes the newer timestamp.
     *
     * @return true if the definition was not registered before
     */
    public boolean register(FunctionDefinition definition) {
        boolean[] added = {false};
        functions.compute(definition.id(), (id, existing) -> {
            if (existing == null) {
                added[0] = true;
                return definition;
            }
            return definition.timestamp() == null ? existing : existing.withTimestamp(definition.timestamp());
        });
        return added[0];
    }

    public boolean delete(String id) {
        return id != null && functions.remove(id) != null;
    }

    public int size() {
        return functions.size();
    }
}
