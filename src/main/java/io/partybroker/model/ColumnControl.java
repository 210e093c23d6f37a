package io.partybroker.model;

/**
 * One column control list entry: what {@code partyCode} may see of {@code dbName.tableName.columnName}.
 */
public record ColumnControl(
        String dbName,
        String tableName,
        String columnName,
        String partyCode,
        Visibility visibility
) {
}
