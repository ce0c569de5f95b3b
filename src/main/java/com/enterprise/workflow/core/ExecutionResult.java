package com.enterprise.workflow.core;

import com.enterprise.workflow.util.JsonSupport;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Outcome of one workflow run
 */
public final class ExecutionResult {
    
    private final UUID workflowId;
    private final String workflowName;
    private final WorkflowStatus status;
    private final Map<String, TaskResult> taskResults;
    private final Instant startedAt;
    private final Instant endedAt;
    private final long durationMs;
    private final String error;
    
    @JsonCreator
    public ExecutionResult(@JsonProperty("workflowId") UUID workflowId,
                           @JsonProperty("workflowName") String workflowName,
                           @JsonProperty("status") WorkflowStatus status,
                           @JsonProperty("taskResults") Map<String, TaskResult> taskResults,
                           @JsonProperty("startedAt") Instant startedAt,
                           @JsonProperty("endedAt") Instant endedAt,
                           @JsonProperty("durationMs") long durationMs,
                           @JsonProperty("error") String error) {
        this.workflowId = workflowId;
        this.workflowName = workflowName;
        this.status = status;
        this.taskResults = taskResults != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(taskResults))
                : Map.of();
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        this.durationMs = durationMs;
        this.error = error;
    }
    
    public UUID getWorkflowId() { return workflowId; }
    
    public String getWorkflowName() { return workflowName; }
    
    public WorkflowStatus getStatus() { return status; }
    
    /**
     * Task results keyed by task name, in topological order
     */
    public Map<String, TaskResult> getTaskResults() { return taskResults; }
    
    public Instant getStartedAt() { return startedAt; }
    
    public Instant getEndedAt() { return endedAt; }
    
    public long getDurationMs() { return durationMs; }
    
    public String getError() { return error; }
    
    @JsonIgnore
    public Optional<TaskResult> getTaskResult(String taskName) {
        return Optional.ofNullable(taskResults.get(taskName));
    }
    
    @JsonIgnore
    public boolean isSuccess() {
        return status == WorkflowStatus.COMPLETED;
    }
    
    /**
     * ISO-8601 JSON snapshot of this result
     */
    public String toJson() throws JsonProcessingException {
        return JsonSupport.toJson(this);
    }
    
    @Override
    public String toString() {
        return "ExecutionResult{" +
                "workflowId=" + workflowId +
                ", workflowName='" + workflowName + '\'' +
                ", status=" + status +
                ", tasks=" + taskResults.size() +
                ", durationMs=" + durationMs +
                ", error='" + error + '\'' +
                '}';
    }
}
