package it.unimib.datai.funcorch.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record IndexOperationResult(
        String operation,
        String target,
        Integer countScanned,
        Boolean deleted
) {
    public static IndexOperationResult scanned(String target, int countScanned) {
        return new IndexOperationResult("index", target, countScanned, null);
    }

    public static IndexOperationResult deleted(String target, boolean deleted) {
        return new IndexOperationResult("delete", target, null, deleted);
    }
}
