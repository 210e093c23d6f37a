package io.partybroker.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Status object carried by inter-party and engine replies. Call sites branch on {@link #kind()}
 * rather than comparing raw codes.
 */
public record Status(int code, String message) {

    public enum Kind {
        OK,
        SESSION_NOT_FOUND,
        DATA_INCONSISTENCY,
        OTHER
    }

    public static Status ok() {
        return new Status(StatusCode.OK.value(), "");
    }

    public static Status of(StatusCode code, String message) {
        return new Status(code.value(), message == null ? "" : message);
    }

    @JsonIgnore
    public Kind kind() {
        if (code == StatusCode.OK.value()) {
            return Kind.OK;
        }
        if (code == StatusCode.SESSION_NOT_FOUND.value()) {
            return Kind.SESSION_NOT_FOUND;
        }
        if (code == StatusCode.DATA_INCONSISTENCY.value()) {
            return Kind.DATA_INCONSISTENCY;
        }
        return Kind.OTHER;
    }
}
