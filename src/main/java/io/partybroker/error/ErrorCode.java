package io.partybroker.error;

public enum ErrorCode {
    TABLE_NOT_FOUND,
    TRANSPORT_ERROR,
    CHECKSUM_MISMATCH,
    COMPILE_ERROR,
    DISPATCH_ERROR,
    ENGINE_EXECUTION_ERROR,
    GC_TRANSIENT,
    CANCELED,
    STORAGE_ERROR,
    UNSUPPORTED_COLUMN_TYPE,
    INVALID_STATE
}
