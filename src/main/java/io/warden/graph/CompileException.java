package io.warden.graph;

/**
 * Raised when a task definition set cannot be turned into an execution plan. Nothing runs once
 * this is thrown.
 */
public class CompileException extends IllegalArgumentException {
    public CompileException(String message) {
        super(message);
    }
}
