package it.unimib.datai.funcorch.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

/**
 * Function invoked by POSTing to a URL.
 */
public record UrlFunctionLocation(
        @NotBlank String invokeUrl,
        String entryPoint,
        @JsonProperty(access = JsonProperty.Access.WRITE_ONLY) String accountConnectionString
) implements FunctionLocation {

    @Override
    public LocationKind kind() {
        return LocationKind.URL;
    }

    @Override
    public String id() {
        return invokeUrl;
    }

    @Override
    public String shortName() {
        if (entryPoint != null && !entryPoint.isBlank()) {
            return entryPoint;
        }
        String trimmed = invokeUrl.endsWith("/") ? invokeUrl.substring(0, invokeUrl.length() - 1) : invokeUrl;
        int slash = trimmed.lastIndexOf('/');
        return slash >= 0 ? trimmed.substring(slash + 1) : trimmed;
    }
}
