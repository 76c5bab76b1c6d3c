package it.unimib.datai.funcorch.common.model;

import java.util.List;

public record FunctionGroup(
        String key,
        List<FunctionSummary> functions
) {
}
