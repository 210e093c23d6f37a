package io.partybroker.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class BrokerConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final int DEFAULT_EXCHANGE_RETRY_TIMES = 3;
    public static final long DEFAULT_EXCHANGE_RETRY_INTERVAL_MS = 200L;
    public static final long DEFAULT_SESSION_CHECK_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_SESSION_EXPIRE_MS = 24L * 60L * 60L * 1000L;
    public static final String DEFAULT_INTRA_PROTOCOL = "http";
    public static final String DEFAULT_ENGINE_CALLBACK_PATH = "/engine/callback";

    private final Path rootDir;
    private final String partyCode;

    public BrokerConfig(Path rootDir, String partyCode) {
        this.rootDir = rootDir;
        this.partyCode = partyCode;
    }

    public static BrokerConfig fromRoot(String root, String partyCode) {
        if (partyCode == null || partyCode.isBlank()) {
            throw new IllegalArgumentException("party code must not be blank");
        }
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new BrokerConfig(resolved.toAbsolutePath().normalize(), partyCode.trim());
    }

    public Path rootDir() {
        return rootDir;
    }

    public String partyCode() {
        return partyCode;
    }

    public Path dbFile() {
        return rootDir.resolve("broker.db");
    }

    public Path partiesFile() {
        return rootDir.resolve("parties.json");
    }

    public Path settingsFile() {
        return rootDir.resolve("broker-settings.json");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
