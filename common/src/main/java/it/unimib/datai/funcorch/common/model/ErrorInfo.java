package it.unimib.datai.funcorch.common.model;

public record ErrorInfo(
        String code,
        String message
) {
}
