package io.partybroker.model;

public record DbTable(String dbName, String tableName) {

    public static DbTable parse(String qualified) {
        if (qualified == null || qualified.isBlank()) {
            throw new IllegalArgumentException("table reference must not be blank");
        }
        String trimmed = qualified.trim();
        int dot = trimmed.indexOf('.');
        if (dot <= 0 || dot == trimmed.length() - 1 || trimmed.indexOf('.', dot + 1) >= 0) {
            throw new IllegalArgumentException("table reference must look like db.table: " + qualified);
        }
        return new DbTable(trimmed.substring(0, dot), trimmed.substring(dot + 1));
    }

    @Override
    public String toString() {
        return dbName + "." + tableName;
    }
}
