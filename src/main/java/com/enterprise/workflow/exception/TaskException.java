package com.enterprise.workflow.exception;

/**
 * Error raised by a task handler, or synthesized by the engine when a task
 * cannot produce output.
 */
public class TaskException extends WorkflowEngineException {
    
    /**
     * Kinds of task failure
     */
    public enum Kind {
        EXECUTION_FAILED,
        TIMEOUT,
        CANCELLED,
        INVALID_INPUT,
        DEPENDENCY_FAILED,
        CONDITION_NOT_MET
    }
    
    private final Kind kind;
    
    public TaskException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }
    
    public TaskException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
    
    public Kind getKind() {
        return kind;
    }
    
    public static TaskException executionFailed(String detail) {
        return new TaskException(Kind.EXECUTION_FAILED, "Task execution failed: " + detail);
    }
    
    public static TaskException timeout() {
        return new TaskException(Kind.TIMEOUT, "Task timed out");
    }
    
    public static TaskException cancelled() {
        return new TaskException(Kind.CANCELLED, "Task cancelled");
    }
    
    public static TaskException invalidInput(String detail) {
        return new TaskException(Kind.INVALID_INPUT, "Invalid input: " + detail);
    }
    
    public static TaskException dependencyFailed(String dependency) {
        return new TaskException(Kind.DEPENDENCY_FAILED, "Dependency failed: " + dependency);
    }
    
    public static TaskException conditionNotMet(String condition) {
        return new TaskException(Kind.CONDITION_NOT_MET, "Condition not met: " + condition);
    }
}
