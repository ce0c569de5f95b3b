package com.enterprise.workflow.core;

/**
 * Represents the status of a task within a workflow run
 */
public enum TaskStatus {
    PENDING,        // Task is waiting for its dependencies
    QUEUED,         // Task has been selected for dispatch
    RUNNING,        // Task handler is executing
    COMPLETED,      // Task completed successfully
    FAILED,         // Task failed and won't be retried
    CANCELLED,      // Task was cancelled before it ran
    RETRYING,       // Task failed and is about to be re-executed
    TIMED_OUT,      // Task handler lost the race against its timeout
    SKIPPED;        // Task was skipped
    
    /**
     * Whether no further transition is expected from this status
     */
    public boolean isTerminal() {
        switch (this) {
            case COMPLETED:
            case FAILED:
            case CANCELLED:
            case TIMED_OUT:
            case SKIPPED:
                return true;
            default:
                return false;
        }
    }
    
    /**
     * Whether this status counts as a failure for retry and workflow outcome purposes
     */
    public boolean isFailure() {
        return this == FAILED || this == TIMED_OUT;
    }
}
