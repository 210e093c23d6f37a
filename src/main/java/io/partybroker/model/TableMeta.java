package io.partybroker.model;

import java.util.List;

/**
 * Metadata of one registered table, as resolved for a query. {@code refTable} names the physical
 * table in the owner's storage, {@code dbType} its backing database.
 */
public record TableMeta(
        String projectId,
        String tableName,
        String owner,
        String refTable,
        String dbType,
        List<ColumnMeta> columns
) {
    public TableMeta {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public DbTable dbTable() {
        return new DbTable(projectId, tableName);
    }
}
