package io.warden.model;

import java.time.Instant;
import java.util.Map;

public record IdempotencyRecord(
        String key,
        String taskId,
        String taskName,
        Map<String, Object> output,
        Instant completedAt
) {
    public IdempotencyRecord {
        output = output == null ? Map.of() : output;
    }
}
