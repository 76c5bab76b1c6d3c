package it.unimib.datai.funcorch.common.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Where a function lives. The set of variants is closed; code that needs variant-specific
 * behaviour switches on {@link #kind()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = RemoteFunctionLocation.class, name = "remote"),
        @JsonSubTypes.Type(value = UrlFunctionLocation.class, name = "url"),
        @JsonSubTypes.Type(value = LocalFunctionLocation.class, name = "local")
})
public sealed interface FunctionLocation
        permits RemoteFunctionLocation, UrlFunctionLocation, LocalFunctionLocation {

    LocationKind kind();

    /**
     * Stable identifier, unique within a registry snapshot.
     */
    String id();

    String shortName();

    /**
     * Name of the handler that executes the function body.
     */
    String entryPoint();

    /**
     * Connection string of the owning storage account, or {@code null} when the location has none.
     */
    String accountConnectionString();
}
