package io.warden.engine;

public class UnresolvedReferenceException extends RuntimeException {
    private final String taskName;
    private final String reference;

    public UnresolvedReferenceException(String taskName, String reference, String detail) {
        super("Task '" + taskName + "' has unresolved reference {{" + reference + "}}: " + detail);
        this.taskName = taskName;
        this.reference = reference;
    }

    public String taskName() {
        return taskName;
    }

    public String reference() {
        return reference;
    }
}
