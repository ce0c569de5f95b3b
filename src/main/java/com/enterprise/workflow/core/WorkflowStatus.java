package com.enterprise.workflow.core;

/**
 * Lifecycle status of a workflow run
 */
public enum WorkflowStatus {
    CREATED,
    QUEUED,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;
    
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
