package io.partybroker.model;

public enum CompareResult {
    EQUAL,
    TABLE_SCHEMA_NOT_EQUAL,
    CCL_NOT_EQUAL
}
