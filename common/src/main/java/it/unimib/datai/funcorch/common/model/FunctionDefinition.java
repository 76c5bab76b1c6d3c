package it.unimib.datai.funcorch.common.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.time.Instant;

/**
 * A registered function. Identity is the identity of its location.
 *
 * @param assemblyFullName identity of the host assembly; joins the definition to its heartbeats
 */
public record FunctionDefinition(
        @NotNull @Valid FunctionLocation location,
        String description,
        Instant timestamp,
        String assemblyFullName
) {
    public String id() {
        return location.id();
    }

    public FunctionDefinition withTimestamp(Instant refreshed) {
        return new FunctionDefinition(location, description, refreshed, assemblyFullName);
    }

    @Override
    public String toString() {
        return location.id();
    }
}
