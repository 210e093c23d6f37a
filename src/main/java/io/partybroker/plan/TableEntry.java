package io.partybroker.plan;

import java.util.List;

/**
 * Catalog entry handed to the compiler. {@code tableName} is qualified with the project id.
 */
public record TableEntry(
        String tableName,
        boolean isView,
        String refTable,
        String dbType,
        String owner,
        List<Column> columns
) {
    public TableEntry {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public record Column(String name, String type) {
    }
}
