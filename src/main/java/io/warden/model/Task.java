package io.warden.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Runtime record of one playbook task. Only the execution engine mutates it, and only through the
 * {@code mark*} transitions; everything else sees {@link TaskView} snapshots.
 */
public final class Task {
    private static final Set<TaskStatus> RUNNABLE_FROM = EnumSet.of(TaskStatus.PENDING, TaskStatus.APPROVED);
    private static final Set<TaskStatus> FAILABLE_FROM = EnumSet.of(TaskStatus.PENDING, TaskStatus.RUNNING);
    private static final Set<TaskStatus> BLOCKABLE_FROM = EnumSet.of(TaskStatus.PENDING, TaskStatus.APPROVED);

    private final String taskId;
    private final String caseId;
    private final TaskDefinition definition;
    private final Instant createdAt;
    private TaskStatus status;
    private Map<String, Object> resolvedInputs;
    private Map<String, Object> output;
    private String error;
    private String statusReason;
    private String approver;
    private Instant startedAt;
    private Instant completedAt;

    public Task(String caseId, TaskDefinition definition) {
        this.taskId = "tsk_" + UUID.randomUUID();
        this.caseId = caseId;
        this.definition = definition;
        this.createdAt = Instant.now();
        this.status = TaskStatus.PENDING;
        this.resolvedInputs = Map.of();
    }

    public String taskId() {
        return taskId;
    }

    public String caseId() {
        return caseId;
    }

    public String name() {
        return definition.name();
    }

    public TaskDefinition definition() {
        return definition;
    }

    public synchronized TaskStatus status() {
        return status;
    }

    public synchronized Map<String, Object> resolvedInputs() {
        return resolvedInputs;
    }

    public synchronized Map<String, Object> output() {
        return output;
    }

    public synchronized String error() {
        return error;
    }

    public synchronized String approver() {
        return approver;
    }

    public synchronized void setResolvedInputs(Map<String, Object> inputs) {
        if (status != TaskStatus.PENDING) {
            throw new IllegalStateException("Inputs of task '" + name() + "' are fixed once it leaves PENDING");
        }
        this.resolvedInputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public synchronized void markWaitingApproval() {
        require(status == TaskStatus.PENDING, TaskStatus.WAITING_APPROVAL);
        status = TaskStatus.WAITING_APPROVAL;
    }

    public synchronized void markApproved(String approvedBy) {
        require(status == TaskStatus.WAITING_APPROVAL, TaskStatus.APPROVED);
        if (approvedBy == null || approvedBy.isBlank()) {
            throw new IllegalArgumentException("approver cannot be empty");
        }
        status = TaskStatus.APPROVED;
        approver = approvedBy.trim();
    }

    public synchronized void markRunning() {
        require(RUNNABLE_FROM.contains(status), TaskStatus.RUNNING);
        status = TaskStatus.RUNNING;
        startedAt = Instant.now();
    }

    public synchronized void markCompleted(Map<String, Object> result) {
        require(status == TaskStatus.RUNNING, TaskStatus.COMPLETED);
        status = TaskStatus.COMPLETED;
        output = result == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(result));
        completedAt = Instant.now();
    }

    public synchronized void markFailed(String message) {
        require(FAILABLE_FROM.contains(status), TaskStatus.FAILED);
        status = TaskStatus.FAILED;
        error = message == null || message.isBlank() ? "unknown error" : message;
        completedAt = Instant.now();
    }

    public synchronized void markSkipped(String reason) {
        require(status == TaskStatus.PENDING, TaskStatus.SKIPPED);
        status = TaskStatus.SKIPPED;
        statusReason = reason;
        completedAt = Instant.now();
    }

    public synchronized void markBlocked(String reason) {
        require(BLOCKABLE_FROM.contains(status), TaskStatus.BLOCKED);
        status = TaskStatus.BLOCKED;
        statusReason = reason;
        completedAt = Instant.now();
    }

    public synchronized TaskView view() {
        return new TaskView(
                taskId,
                caseId,
                definition.name(),
                definition.type(),
                status,
                definition.needs(),
                definition.approvalRequired(),
                definition.idempotencyKey(),
                resolvedInputs,
                output,
                error,
                statusReason,
                approver,
                createdAt,
                startedAt,
                completedAt
        );
    }

    private void require(boolean allowed, TaskStatus target) {
        if (!allowed) {
            throw new IllegalTransitionException(definition.name(), status, target);
        }
    }
}
