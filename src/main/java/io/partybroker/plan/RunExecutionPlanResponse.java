package io.partybroker.plan;

import com.fasterxml.jackson.databind.JsonNode;
import io.partybroker.model.Status;

import java.util.List;

public record RunExecutionPlanResponse(Status status, List<JsonNode> outColumns, long affectedRows) {
    public RunExecutionPlanResponse {
        outColumns = outColumns == null ? List.of() : List.copyOf(outColumns);
    }
}
