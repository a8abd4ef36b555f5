package io.warden.engine;

import io.warden.model.TaskStatus;

public class NotAwaitingApprovalException extends IllegalStateException {
    private final TaskStatus status;

    public NotAwaitingApprovalException(String taskName, TaskStatus status) {
        super("Task '" + taskName + "' is not awaiting approval (status=" + status + ")");
        this.status = status;
    }

    public TaskStatus status() {
        return status;
    }
}
