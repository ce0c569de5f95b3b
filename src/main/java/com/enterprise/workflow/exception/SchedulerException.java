package com.enterprise.workflow.exception;

/**
 * Exception raised when scheduling a workflow
 */
public class SchedulerException extends WorkflowEngineException {
    
    /**
     * Kinds of scheduler failure
     */
    public enum Kind {
        INVALID_CRON,
        JOB_NOT_FOUND,
        CONFLICT
    }
    
    private final Kind kind;
    
    public SchedulerException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }
    
    public Kind getKind() {
        return kind;
    }
    
    public static SchedulerException invalidCron(String detail) {
        return new SchedulerException(Kind.INVALID_CRON, "Invalid cron expression: " + detail);
    }
    
    public static SchedulerException conflict(String detail) {
        return new SchedulerException(Kind.CONFLICT, "Schedule conflict: " + detail);
    }
}
