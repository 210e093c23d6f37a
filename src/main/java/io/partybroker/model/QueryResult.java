package io.partybroker.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record QueryResult(
        Status status,
        List<JsonNode> outColumns,
        long affectedRows,
        double costTimeSeconds,
        List<String> warnings
) {
    public QueryResult {
        outColumns = outColumns == null ? List.of() : List.copyOf(outColumns);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
