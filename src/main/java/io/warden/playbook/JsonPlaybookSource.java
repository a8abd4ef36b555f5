package io.warden.playbook;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import io.warden.model.Playbook;
import io.warden.model.TaskDefinition;
import io.warden.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads {@code <dir>/<playbookId>.json}:
 *
 * <pre>
 * {
 *   "playbook_id": "mailbox-takeover",
 *   "tasks": {
 *     "snapshot": {"type": "evidence:take_snapshot", "inputs": {"user": "{{user}}"}},
 *     "rotate":   {"type": "gmail:change_password", "needs": ["snapshot"],
 *                  "approval_required": true, "idempotency_key": "rotate-{{user}}"}
 *   }
 * }
 * </pre>
 *
 * Inputs are left untouched for the engine to resolve; only context placeholders inside
 * idempotency keys are rendered here so that the key identifies the concrete effect.
 */
public final class JsonPlaybookSource implements PlaybookSource {
    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([A-Za-z0-9_.-]+)\\s*}}");

    private final Path directory;

    public JsonPlaybookSource(Path directory) {
        this.directory = directory;
    }

    @Override
    public Playbook resolve(String playbookId, Map<String, Object> context) {
        if (playbookId == null || playbookId.isBlank() || playbookId.contains("/") || playbookId.contains("..")) {
            throw new PlaybookNotFoundException(playbookId);
        }
        Path file = directory.resolve(playbookId.trim() + ".json");
        if (!Files.exists(file)) {
            throw new PlaybookNotFoundException(playbookId);
        }
        return load(file, context);
    }

    public static Playbook load(Path file, Map<String, Object> context) {
        PlaybookFile raw;
        try {
            raw = Jsons.mapper()
                    .readerFor(PlaybookFile.class)
                    .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                    .readValue(file.toFile());
        } catch (IOException e) {
            throw new IllegalArgumentException("Invalid playbook file: " + file, e);
        }
        if (raw == null || raw.playbookId() == null || raw.playbookId().isBlank()) {
            throw new IllegalArgumentException("Playbook file has no playbook_id: " + file);
        }
        Map<String, TaskDefinition> tasks = new LinkedHashMap<>();
        if (raw.tasks() != null) {
            for (Map.Entry<String, TaskSpec> e : raw.tasks().entrySet()) {
                TaskSpec spec = e.getValue();
                if (spec == null) {
                    throw new IllegalArgumentException("Task '" + e.getKey() + "' has no definition in " + file);
                }
                tasks.put(e.getKey(), new TaskDefinition(
                        e.getKey(),
                        spec.type(),
                        spec.inputs(),
                        spec.needs(),
                        Boolean.TRUE.equals(spec.approvalRequired()),
                        renderKey(spec.idempotencyKey(), context)
                ));
            }
        }
        return new Playbook(raw.playbookId(), tasks);
    }

    static String renderKey(String template, Map<String, Object> context) {
        if (template == null || context == null || context.isEmpty()) {
            return template;
        }
        Matcher m = PLACEHOLDER.matcher(template);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            Object value = context.get(m.group(1));
            m.appendReplacement(sb, Matcher.quoteReplacement(value == null ? m.group() : String.valueOf(value)));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private record PlaybookFile(
            @JsonProperty("playbook_id") String playbookId,
            @JsonProperty("tasks") LinkedHashMap<String, TaskSpec> tasks
    ) {
    }

    private record TaskSpec(
            @JsonProperty("type") String type,
            @JsonProperty("inputs") LinkedHashMap<String, Object> inputs,
            @JsonProperty("needs") List<String> needs,
            @JsonProperty("approval_required") Boolean approvalRequired,
            @JsonProperty("idempotency_key") String idempotencyKey
    ) {
    }
}
