package io.warden.connector;

import com.fasterxml.jackson.databind.JsonNode;
import io.warden.util.Jsons;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs an external command per call. The request {@code {"operation": ..., "payload": {...}}} is
 * written to stdin; stdout must be a JSON object, which becomes the task output. A non-JSON stdout
 * is returned under {@code "stdout"}.
 */
public final class ScriptConnector implements Connector {
    private static final int MAX_ERROR_CHARS = 512;

    private final String id;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptConnector(String id, List<String> command, long timeoutMs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script connector id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script connector command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Map<String, Object> call(String operation, Map<String, Object> payload) throws Exception {
        // stdout goes to a file so a chatty script never blocks on a full pipe
        Path outputFile = Files.createTempFile("warden-script-" + id + "-", ".out");
        try {
            return run(operation, payload, outputFile);
        } finally {
            Files.deleteIfExists(outputFile);
        }
    }

    private Map<String, Object> run(String operation, Map<String, Object> payload, Path outputFile) throws Exception {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.redirectOutput(outputFile.toFile());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new IOException("script spawn failed: " + e.getMessage(), e);
        }

        try {
            Map<String, Object> request = new LinkedHashMap<>();
            request.put("operation", operation);
            request.put("payload", payload == null ? Map.of() : payload);
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(Jsons.toCompactJson(request).getBytes(StandardCharsets.UTF_8));
                stdin.flush();
            }

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw new IllegalStateException("script timeout after " + Duration.ofMillis(timeoutMs));
            }

            String combined = Files.readString(outputFile, StandardCharsets.UTF_8).strip();
            if (process.exitValue() != 0) {
                throw new IllegalStateException("script exit=" + process.exitValue() + " output=" + truncate(combined));
            }
            return parseOutput(combined);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private Map<String, Object> parseOutput(String stdout) {
        if (!stdout.isEmpty()) {
            try {
                JsonNode node = Jsons.readTree(stdout);
                if (node != null && node.isObject()) {
                    return Jsons.toMap(node);
                }
            } catch (IllegalArgumentException notJson) {
                // plain-text output is passed through below
            }
        }
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("stdout", stdout);
        return out;
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
