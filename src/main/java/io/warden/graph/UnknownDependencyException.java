package io.warden.graph;

public class UnknownDependencyException extends CompileException {
    private final String taskName;
    private final String dependency;

    public UnknownDependencyException(String taskName, String dependency) {
        super("Task '" + taskName + "' depends on unknown task '" + dependency + "'");
        this.taskName = taskName;
        this.dependency = dependency;
    }

    public String taskName() {
        return taskName;
    }

    public String dependency() {
        return dependency;
    }
}
