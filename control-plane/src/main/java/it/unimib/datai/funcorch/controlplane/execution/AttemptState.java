package it.unimib.datai.funcorch.controlplane.execution;

public enum AttemptState {
    PENDING,
    ATTEMPTING,
    SUCCEEDED,
    EXHAUSTED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED || this == FAILED || this == CANCELLED;
    }
}
