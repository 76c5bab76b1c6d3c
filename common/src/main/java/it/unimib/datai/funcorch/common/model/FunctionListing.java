package it.unimib.datai.funcorch.common.model;

import java.util.List;

/**
 * @param hasWarning true when at least one listed function has no live host
 */
public record FunctionListing(
        List<FunctionGroup> groups,
        boolean hasWarning
) {
}
