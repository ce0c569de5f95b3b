package com.enterprise.workflow.exception;

/**
 * Base exception for workflow engine related errors
 */
public class WorkflowEngineException extends Exception {
    
    public WorkflowEngineException(String message) {
        super(message);
    }
    
    public WorkflowEngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
