package io.partybroker.model;

public enum StatusCode {
    OK(0),
    BAD_REQUEST(100),
    NOT_FOUND(104),
    INTERNAL(300),
    SESSION_NOT_FOUND(340),
    DATA_INCONSISTENCY(341);

    private final int value;

    StatusCode(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
