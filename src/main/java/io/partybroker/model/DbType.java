package io.partybroker.model;

public enum DbType {
    UNKNOWN,
    MYSQL,
    SQLITE,
    POSTGRESQL,
    CSVDB,
    ODPS,
    HIVE;

    public static DbType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        for (DbType value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown database type: " + raw);
    }
}
