package io.warden.model;

public class IllegalTransitionException extends IllegalStateException {
    private final TaskStatus from;
    private final TaskStatus to;

    public IllegalTransitionException(String taskName, TaskStatus from, TaskStatus to) {
        super("Task '" + taskName + "' cannot move from " + from + " to " + to);
        this.from = from;
        this.to = to;
    }

    public TaskStatus from() {
        return from;
    }

    public TaskStatus to() {
        return to;
    }
}
