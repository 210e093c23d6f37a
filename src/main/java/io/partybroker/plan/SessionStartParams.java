package io.partybroker.plan;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

public record SessionStartParams(String partyCode, String sessionId, JsonNode spuRuntimeConfig, List<PartyEntry> parties) {
    public SessionStartParams {
        parties = parties == null ? List.of() : List.copyOf(parties);
    }
}
