package io.partybroker.plan;

public record PartyEntry(String code, String name, int rank, String host, String publicKey) {
}
