package it.unimib.datai.funcorch.common.model;

import jakarta.validation.constraints.NotBlank;

public record HeartbeatRequest(
        @NotBlank(message = "assemblyFullName is required") String assemblyFullName
) {
}
