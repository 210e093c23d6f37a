package io.partybroker.model;

public record PartyInfo(String code, String brokerUrl, String pubKey) {
}
