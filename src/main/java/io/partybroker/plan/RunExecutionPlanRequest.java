package io.partybroker.plan;

import com.fasterxml.jackson.databind.JsonNode;

public record RunExecutionPlanRequest(SessionStartParams sessionParams, JsonNode graph, boolean async, JsonNode debugOpts) {
}
