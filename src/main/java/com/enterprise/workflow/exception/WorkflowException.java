package com.enterprise.workflow.exception;

/**
 * Exception raised while building or executing a workflow
 */
public class WorkflowException extends WorkflowEngineException {
    
    /**
     * Kinds of workflow failure
     */
    public enum Kind {
        EMPTY_WORKFLOW,
        CIRCULAR_DEPENDENCY,
        TASK_NOT_FOUND,
        EXECUTION_FAILED,
        TIMEOUT
    }
    
    private final Kind kind;
    
    public WorkflowException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }
    
    public WorkflowException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }
    
    public Kind getKind() {
        return kind;
    }
    
    public static WorkflowException emptyWorkflow() {
        return new WorkflowException(Kind.EMPTY_WORKFLOW, "Workflow is empty");
    }
    
    public static WorkflowException circularDependency(String detail) {
        return new WorkflowException(Kind.CIRCULAR_DEPENDENCY, "Circular dependency detected: " + detail);
    }
    
    public static WorkflowException executionFailed(String detail, Throwable cause) {
        return new WorkflowException(Kind.EXECUTION_FAILED, "Workflow execution failed: " + detail, cause);
    }
    
    public static WorkflowException timeout() {
        return new WorkflowException(Kind.TIMEOUT, "Workflow timed out");
    }
}
