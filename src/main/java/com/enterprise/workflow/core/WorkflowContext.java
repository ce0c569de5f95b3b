package com.enterprise.workflow.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-run context of a workflow: shared values, published task outputs and parameters.
 * The output store accepts concurrent writers, one per in-flight task.
 */
public class WorkflowContext {
    
    private final UUID workflowId;
    private final String workflowName;
    private final SharedContext shared = new SharedContext();
    private final Map<String, JsonNode> taskOutputs = new ConcurrentHashMap<>();
    private final Map<String, JsonNode> parameters = new ConcurrentHashMap<>();
    private final AtomicBoolean cancellationRequested = new AtomicBoolean(false);
    
    public WorkflowContext(UUID workflowId, String workflowName) {
        this.workflowId = workflowId;
        this.workflowName = workflowName;
    }
    
    public UUID getWorkflowId() {
        return workflowId;
    }
    
    public String getWorkflowName() {
        return workflowName;
    }
    
    /**
     * Set a run parameter. Use {@code NullNode} for an explicit null.
     */
    public void setParameter(String key, JsonNode value) {
        parameters.put(Objects.requireNonNull(key, "Parameter name cannot be null"),
                Objects.requireNonNull(value, "Parameter value cannot be null: " + key));
    }
    
    public Optional<JsonNode> getParameter(String key) {
        return Optional.ofNullable(parameters.get(key));
    }
    
    /**
     * Publish a task's output for later consumers
     */
    public void storeTaskOutput(String taskName, JsonNode output) {
        taskOutputs.put(taskName, output);
    }
    
    public Optional<JsonNode> getTaskOutput(String taskName) {
        return Optional.ofNullable(taskOutputs.get(taskName));
    }
    
    /**
     * Create a fresh context for one task of this run
     */
    public TaskContext createTaskContext(String taskName) {
        return new TaskContext(taskName, workflowId, shared, Map.copyOf(parameters),
                cancellationRequested::get);
    }
    
    public SharedContext getShared() {
        return shared;
    }
    
    void requestCancellation() {
        cancellationRequested.set(true);
    }
    
    public boolean isCancellationRequested() {
        return cancellationRequested.get();
    }
}
