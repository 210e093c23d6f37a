package io.partybroker.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class Hashing {
    private static final HexFormat HEX = HexFormat.of();

    private Hashing() {
    }

    public static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }

    public static String sha256Hex(String value) {
        byte[] digest = sha256().digest((value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
        return HEX.formatHex(digest);
    }

    public static String toHex(byte[] data) {
        if (data == null) {
            return "";
        }
        return HEX.formatHex(data);
    }
}
