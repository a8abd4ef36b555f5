package io.warden.engine;

public class TaskNotFoundException extends IllegalArgumentException {
    public TaskNotFoundException(String taskName) {
        super("Unknown task: " + taskName);
    }
}
