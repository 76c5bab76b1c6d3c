package it.unimib.datai.funcorch.common.model;

import jakarta.validation.constraints.NotBlank;

/**
 * Function whose handler is deployed inside the orchestrator process.
 */
public record LocalFunctionLocation(@NotBlank String entryPoint) implements FunctionLocation {

    @Override
    public LocationKind kind() {
        return LocationKind.LOCAL;
    }

    @Override
    public String id() {
        return "local:" + entryPoint;
    }

    @Override
    public String shortName() {
        return entryPoint;
    }

    @Override
    public String accountConnectionString() {
        return null;
    }
}
