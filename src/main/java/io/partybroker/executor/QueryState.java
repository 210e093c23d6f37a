package io.partybroker.executor;

public enum QueryState {
    CREATED,
    PREPARING,
    CHECKSUM_EXCHANGE,
    COMPILING,
    DISPATCHING,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
