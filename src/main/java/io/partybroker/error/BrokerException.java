package io.partybroker.error;

/**
 * Failure of a broker operation. Every error raised by the query lifecycle carries a code so callers
 * can tell a disagreement between parties from a transport fault or a bad plan.
 */
public class BrokerException extends RuntimeException {
    private final ErrorCode code;

    public BrokerException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    public BrokerException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode code() {
        return code;
    }

    @Override
    public String toString() {
        return code + ": " + getMessage();
    }
}
