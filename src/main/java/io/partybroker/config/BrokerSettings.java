package io.partybroker.config;

import io.partybroker.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables of one broker process. Loaded from {@code broker-settings.json} under the data root;
 * every field is optional and falls back to its default when absent or below its floor.
 */
public record BrokerSettings(
        int exchangeJobInfoRetryTimes,
        long exchangeJobInfoRetryIntervalMs,
        long sessionCheckIntervalMs,
        long sessionExpireMs,
        String selfEngineEndpoint,
        String callbackHost,
        String intraProtocol,
        String engineCallbackPath
) {
    public static BrokerSettings defaults() {
        return new BrokerSettings(
                BrokerConfig.DEFAULT_EXCHANGE_RETRY_TIMES,
                BrokerConfig.DEFAULT_EXCHANGE_RETRY_INTERVAL_MS,
                BrokerConfig.DEFAULT_SESSION_CHECK_INTERVAL_MS,
                BrokerConfig.DEFAULT_SESSION_EXPIRE_MS,
                "",
                "",
                BrokerConfig.DEFAULT_INTRA_PROTOCOL,
                BrokerConfig.DEFAULT_ENGINE_CALLBACK_PATH
        );
    }

    public static BrokerSettings load(Path file) {
        if (file == null || !Files.exists(file)) {
            return defaults();
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults());
        } catch (IOException e) {
            throw new RuntimeException("Failed to load broker settings: " + file, e);
        }
    }

    static BrokerSettings fromFile(SettingsFile file, BrokerSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new BrokerSettings(
                sanitizeInt(file.exchangeJobInfoRetryTimes(), defaults.exchangeJobInfoRetryTimes(), 1),
                sanitizeLong(file.exchangeJobInfoRetryIntervalMs(), defaults.exchangeJobInfoRetryIntervalMs(), 0L),
                sanitizeLong(file.sessionCheckIntervalMs(), defaults.sessionCheckIntervalMs(), 100L),
                sanitizeLong(file.sessionExpireMs(), defaults.sessionExpireMs(), 1_000L),
                sanitizeString(file.selfEngineEndpoint(), defaults.selfEngineEndpoint()),
                sanitizeString(file.callbackHost(), defaults.callbackHost()),
                sanitizeString(file.intraProtocol(), defaults.intraProtocol()),
                sanitizeString(file.engineCallbackPath(), defaults.engineCallbackPath())
        );
    }

    public BrokerSettings withExchangeRetry(int retryTimes, long retryIntervalMs) {
        return new BrokerSettings(
                Math.max(1, retryTimes),
                Math.max(0L, retryIntervalMs),
                sessionCheckIntervalMs,
                sessionExpireMs,
                selfEngineEndpoint,
                callbackHost,
                intraProtocol,
                engineCallbackPath
        );
    }

    public BrokerSettings withSelfEngineEndpoint(String endpoint) {
        return new BrokerSettings(
                exchangeJobInfoRetryTimes,
                exchangeJobInfoRetryIntervalMs,
                sessionCheckIntervalMs,
                sessionExpireMs,
                endpoint == null ? "" : endpoint.trim(),
                callbackHost,
                intraProtocol,
                engineCallbackPath
        );
    }

    private static int sanitizeInt(Integer value, int fallback, int min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static long sanitizeLong(Long value, long fallback, long min) {
        if (value == null) {
            return fallback;
        }
        return Math.max(min, value);
    }

    private static String sanitizeString(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim();
    }

    record SettingsFile(
            Integer exchangeJobInfoRetryTimes,
            Long exchangeJobInfoRetryIntervalMs,
            Long sessionCheckIntervalMs,
            Long sessionExpireMs,
            String selfEngineEndpoint,
            String callbackHost,
            String intraProtocol,
            String engineCallbackPath
    ) {
    }
}
