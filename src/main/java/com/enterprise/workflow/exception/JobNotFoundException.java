package com.enterprise.workflow.exception;

import java.util.UUID;

/**
 * Exception thrown when a scheduled job id is unknown
 */
public class JobNotFoundException extends SchedulerException {
    
    private final UUID jobId;
    
    public JobNotFoundException(UUID jobId) {
        super(Kind.JOB_NOT_FOUND, "Job not found: " + jobId);
        this.jobId = jobId;
    }
    
    public UUID getJobId() {
        return jobId;
    }
}
