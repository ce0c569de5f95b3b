package com.enterprise.workflow.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable outcome of a single task execution
 */
public final class TaskResult {
    
    private final UUID taskId;
    private final String taskName;
    private final TaskStatus status;
    private final JsonNode output;
    private final String error;
    private final Instant startedAt;
    private final Instant endedAt;
    private final long durationMs;
    private final int retryCount;
    
    @JsonCreator
    public TaskResult(@JsonProperty("taskId") UUID taskId,
                      @JsonProperty("taskName") String taskName,
                      @JsonProperty("status") TaskStatus status,
                      @JsonProperty("output") JsonNode output,
                      @JsonProperty("error") String error,
                      @JsonProperty("startedAt") Instant startedAt,
                      @JsonProperty("endedAt") Instant endedAt,
                      @JsonProperty("durationMs") long durationMs,
                      @JsonProperty("retryCount") int retryCount) {
        this.taskId = taskId;
        this.taskName = Objects.requireNonNull(taskName, "Task name cannot be null");
        this.status = Objects.requireNonNull(status, "Status cannot be null");
        this.output = output;
        this.error = error;
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.durationMs = durationMs;
        this.retryCount = retryCount;
    }
    
    /**
     * Creates a successful result
     */
    public static TaskResult success(UUID taskId, String taskName, JsonNode output) {
        Instant now = Instant.now();
        return new TaskResult(taskId, taskName, TaskStatus.COMPLETED, output, null, now, now, 0L, 0);
    }
    
    /**
     * Creates a failed result
     */
    public static TaskResult failure(UUID taskId, String taskName, String error) {
        Instant now = Instant.now();
        return new TaskResult(taskId, taskName, TaskStatus.FAILED, null, error, now, now, 0L, 0);
    }
    
    /**
     * Creates a result with an arbitrary terminal status and no output
     */
    public static TaskResult of(UUID taskId, String taskName, TaskStatus status, String error) {
        Instant now = Instant.now();
        return new TaskResult(taskId, taskName, status, null, error, now, now, 0L, 0);
    }
    
    public UUID getTaskId() { return taskId; }
    
    public String getTaskName() { return taskName; }
    
    public TaskStatus getStatus() { return status; }
    
    public JsonNode getOutput() { return output; }
    
    public String getError() { return error; }
    
    public Instant getStartedAt() { return startedAt; }
    
    public Instant getEndedAt() { return endedAt; }
    
    public long getDurationMs() { return durationMs; }
    
    public int getRetryCount() { return retryCount; }
    
    @JsonIgnore
    public boolean isSuccess() {
        return status == TaskStatus.COMPLETED;
    }
    
    /**
     * Copy of this result carrying the given retry count
     */
    public TaskResult withRetryCount(int retryCount) {
        return new TaskResult(taskId, taskName, status, output, error, startedAt, endedAt, durationMs, retryCount);
    }
    
    @Override
    public String toString() {
        return "TaskResult{" +
                "taskName='" + taskName + '\'' +
                ", status=" + status +
                ", error='" + error + '\'' +
                ", durationMs=" + durationMs +
                ", retryCount=" + retryCount +
                '}';
    }
}
