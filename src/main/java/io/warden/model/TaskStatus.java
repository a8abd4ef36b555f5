package io.warden.model;

import java.util.Locale;

public enum TaskStatus {
    PENDING,
    WAITING_APPROVAL,
    APPROVED,
    RUNNING,
    COMPLETED,
    FAILED,
    SKIPPED,
    BLOCKED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED || this == BLOCKED;
    }

    public static TaskStatus parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("task status cannot be empty");
        }
        return TaskStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
