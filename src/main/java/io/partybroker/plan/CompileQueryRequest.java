package io.partybroker.plan;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record CompileQueryRequest(
        String query,
        String dbName,
        String issuer,
        boolean issuerAsParticipant,
        SecurityConfig securityConfig,
        List<TableEntry> catalog,
        JsonNode compileOpts
) {
    public CompileQueryRequest {
        catalog = catalog == null ? List.of() : List.copyOf(catalog);
    }
}
