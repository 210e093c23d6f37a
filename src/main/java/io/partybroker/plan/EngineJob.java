package io.partybroker.plan;

import java.util.List;
import java.util.Map;

public record EngineJob(Map<String, RunExecutionPlanRequest> requests, List<String> outputNames, EngineStub stub) {
    public EngineJob {
        requests = requests == null ? Map.of() : Map.copyOf(requests);
        outputNames = outputNames == null ? List.of() : List.copyOf(outputNames);
    }
}
