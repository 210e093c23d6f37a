package io.partybroker.model;

import java.util.Locale;

public enum Visibility {
    UNKNOWN,
    PLAINTEXT,
    ENCRYPTED_ONLY,
    PLAINTEXT_AFTER_JOIN,
    PLAINTEXT_AFTER_GROUP_BY,
    PLAINTEXT_AFTER_COMPARE,
    PLAINTEXT_AFTER_AGGREGATE,
    PLAINTEXT_AS_JOIN_PAYLOAD,
    REVEAL_RANK;

    // Stored privileges are free text; anything unrecognised maps to UNKNOWN.
    public static Visibility fromPriv(String priv) {
        if (priv == null || priv.isBlank()) {
            return UNKNOWN;
        }
        String normalized = priv.trim().toUpperCase(Locale.ROOT);
        for (Visibility value : values()) {
            if (value.name().equals(normalized)) {
                return value;
            }
        }
        return UNKNOWN;
    }
}
