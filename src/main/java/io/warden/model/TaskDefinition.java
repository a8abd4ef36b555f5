package io.warden.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

public record TaskDefinition(
        String name,
        String type,
        Map<String, Object> inputs,
        List<String> needs,
        boolean approvalRequired,
        String idempotencyKey
) {
    public TaskDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("task name cannot be empty");
        }
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("task type cannot be empty: " + name);
        }
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        needs = needs == null ? List.of() : List.copyOf(new LinkedHashSet<>(needs));
        idempotencyKey = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey.trim();
    }

    public static TaskDefinition of(String name, String type, List<String> needs) {
        return new TaskDefinition(name, type, Map.of(), needs, false, null);
    }

    public TaskDefinition withInputs(Map<String, Object> newInputs) {
        return new TaskDefinition(name, type, newInputs, needs, approvalRequired, idempotencyKey);
    }

    public TaskDefinition withApprovalRequired(boolean required) {
        return new TaskDefinition(name, type, inputs, needs, required, idempotencyKey);
    }

    public TaskDefinition withIdempotencyKey(String key) {
        return new TaskDefinition(name, type, inputs, needs, approvalRequired, key);
    }

    /**
     * Connector id addressed by {@link #type()}: the text before the first {@code ':'}.
     */
    public String connectorId() {
        int idx = type.indexOf(':');
        return (idx < 0 ? type : type.substring(0, idx)).trim();
    }

    /**
     * Operation addressed by {@link #type()}: the text after the first {@code ':'}, or the
     * connector id when the type names no operation.
     */
    public String operation() {
        int idx = type.indexOf(':');
        return (idx < 0 ? type : type.substring(idx + 1)).trim();
    }
}
