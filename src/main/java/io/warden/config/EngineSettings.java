package io.warden.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import io.warden.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables read from {@code warden-settings.json}; any field left out keeps its default.
 */
public record EngineSettings(
        int workerThreads,
        long connectorTimeoutMs,
        boolean maskAuditDetails
) {
    public EngineSettings {
        workerThreads = Math.max(1, workerThreads);
        connectorTimeoutMs = Math.max(0L, connectorTimeoutMs);
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
                WardenConfig.DEFAULT_WORKER_THREADS,
                WardenConfig.DEFAULT_CONNECTOR_TIMEOUT_MS,
                true
        );
    }

    public static EngineSettings load(Path file) {
        EngineSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper()
                    .readerFor(SettingsFile.class)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(file.toFile());
            if (raw == null) {
                return defaults;
            }
            return new EngineSettings(
                    raw.workerThreads() == null ? defaults.workerThreads() : raw.workerThreads(),
                    raw.connectorTimeoutMs() == null ? defaults.connectorTimeoutMs() : raw.connectorTimeoutMs(),
                    raw.maskAuditDetails() == null ? defaults.maskAuditDetails() : raw.maskAuditDetails()
            );
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid settings file: " + file, e);
        }
    }

    private record SettingsFile(
            Integer workerThreads,
            Long connectorTimeoutMs,
            Boolean maskAuditDetails
    ) {
    }
}
