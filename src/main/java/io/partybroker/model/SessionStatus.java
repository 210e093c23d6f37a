package io.partybroker.model;

public enum SessionStatus {
    RUNNING,
    FINISHED,
    FAILED,
    CANCELED,
    EXPIRED
}
