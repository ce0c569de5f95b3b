package com.enterprise.workflow.exception;

/**
 * Exception thrown when a task name is not part of a workflow
 */
public class TaskNotFoundException extends WorkflowException {
    
    private final String taskName;
    
    public TaskNotFoundException(String taskName) {
        super(Kind.TASK_NOT_FOUND, "Task not found: " + taskName);
        this.taskName = taskName;
    }
    
    public String getTaskName() {
        return taskName;
    }
}
