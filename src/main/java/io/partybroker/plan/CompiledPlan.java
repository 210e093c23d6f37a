package io.partybroker.plan;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * Output of the compiler. The order of {@code parties} fixes each party's rank in the secure
 * computation; {@code subGraphs} holds the execution graph of each party.
 */
public record CompiledPlan(
        List<String> parties,
        Map<String, JsonNode> subGraphs,
        JsonNode spuRuntimeConfig,
        List<String> outputColumns,
        PlanWarning warning,
        String explain
) {
    public CompiledPlan {
        parties = parties == null ? List.of() : List.copyOf(parties);
        subGraphs = subGraphs == null ? Map.of() : Map.copyOf(subGraphs);
        outputColumns = outputColumns == null ? List.of() : List.copyOf(outputColumns);
        warning = warning == null ? PlanWarning.none() : warning;
    }
}
