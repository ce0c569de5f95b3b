package com.enterprise.workflow.core;

import java.time.Instant;

/**
 * Statistics about the workflow engine
 */
public interface EngineStatistics {
    
    /**
     * Total number of workflow runs started
     */
    long getTotalWorkflowsExecuted();
    
    long getTotalWorkflowsCompleted();
    
    long getTotalWorkflowsFailed();
    
    long getTotalWorkflowsCancelled();
    
    /**
     * Workflow runs currently registered as running or paused
     */
    int getRunningWorkflows();
    
    /**
     * Total number of task attempts, retries included
     */
    long getTotalTaskAttempts();
    
    long getTotalTasksCompleted();
    
    long getTotalTasksFailed();
    
    long getTotalTaskRetries();
    
    /**
     * Average task attempt time in milliseconds
     */
    double getAverageTaskExecutionTimeMs();
    
    /**
     * Engine uptime in milliseconds
     */
    long getUptimeMs();
    
    Instant getStartedAt();
    
    int getActiveThreadCount();
}
