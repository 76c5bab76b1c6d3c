package it.unimib.datai.funcorch.common.model;

import java.time.Instant;

public record InvocationStatus(
        String invocationId,
        String functionId,
        String state,
        int retryCount,
        int maxRetryCount,
        Instant startedAt,
        Instant finishedAt,
        ErrorInfo lastError
) {
}
