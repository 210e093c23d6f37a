package io.partybroker.plan;

import java.util.List;

/**
 * Where and how the engine reports back to this broker once an asynchronous job finishes.
 */
public record EngineStub(
        String sessionId,
        String protocol,
        String callbackHost,
        String callbackPath,
        List<Participant> participants
) {
    public EngineStub {
        participants = participants == null ? List.of() : List.copyOf(participants);
    }

    public record Participant(String partyCode, String endpoint, String pubKey) {
    }
}
