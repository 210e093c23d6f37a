package io.partybroker.rpc;

import java.util.List;

public record AskInfoRequest(String projectId, List<String> tableNames, String requester) {
    public AskInfoRequest {
        tableNames = tableNames == null ? List.of() : List.copyOf(tableNames);
    }
}
