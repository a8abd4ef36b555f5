package io.warden.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record TaskView(
        String taskId,
        String caseId,
        String name,
        String type,
        TaskStatus status,
        List<String> needs,
        boolean approvalRequired,
        String idempotencyKey,
        Map<String, Object> resolvedInputs,
        Map<String, Object> output,
        String error,
        String statusReason,
        String approver,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {
    /**
     * Copy of this view carrying {@code candidate} as its output, used to evaluate rules before
     * the output is committed.
     */
    public TaskView withCandidateOutput(Map<String, Object> candidate) {
        return new TaskView(taskId, caseId, name, type, status, needs, approvalRequired, idempotencyKey,
                resolvedInputs, candidate, error, statusReason, approver, createdAt, startedAt, completedAt);
    }
}
