package com.enterprise.workflow.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.BooleanSupplier;

/**
 * Context handed to a task handler for one run of one task.
 * Carries the outputs of the task's dependencies, local variables and the
 * run-wide {@link SharedContext}.
 */
public class TaskContext {
    
    private final String taskName;
    private final UUID workflowId;
    private final Map<String, JsonNode> inputs = new HashMap<>();
    private final Map<String, Object> variables = new HashMap<>();
    private final Map<String, JsonNode> parameters;
    private final SharedContext shared;
    private final BooleanSupplier cancellationSignal;
    
    /**
     * Creates a standalone context, not bound to a workflow run
     */
    public TaskContext(String taskName) {
        this(taskName, null, new SharedContext(), Map.of(), () -> false);
    }
    
    TaskContext(String taskName, UUID workflowId, SharedContext shared,
                Map<String, JsonNode> parameters, BooleanSupplier cancellationSignal) {
        this.taskName = taskName;
        this.workflowId = workflowId;
        this.shared = shared;
        this.parameters = parameters;
        this.cancellationSignal = cancellationSignal;
    }
    
    public String getTaskName() {
        return taskName;
    }
    
    /**
     * Id of the workflow this context belongs to, empty for a standalone context
     */
    public Optional<UUID> getWorkflowId() {
        return Optional.ofNullable(workflowId);
    }
    
    /**
     * Set the output of a dependency
     */
    public void setInput(String dependencyName, JsonNode value) {
        inputs.put(dependencyName, value);
    }
    
    /**
     * Output of the named dependency
     */
    public Optional<JsonNode> getInput(String dependencyName) {
        return Optional.ofNullable(inputs.get(dependencyName));
    }
    
    public Map<String, JsonNode> getInputs() {
        return Collections.unmodifiableMap(inputs);
    }
    
    public void set(String key, Object value) {
        variables.put(key, value);
    }
    
    public Optional<Object> get(String key) {
        return Optional.ofNullable(variables.get(key));
    }
    
    /**
     * Workflow parameter set on the run's {@link WorkflowContext}
     */
    public Optional<JsonNode> getParameter(String key) {
        return Optional.ofNullable(parameters.get(key));
    }
    
    public SharedContext getShared() {
        return shared;
    }
    
    public void setShared(String key, Object value) {
        shared.set(key, value);
    }
    
    public Optional<Object> getShared(String key) {
        return shared.get(key);
    }
    
    /**
     * Whether the run was cancelled or passed its deadline.
     * Long-running handlers should poll this and stop early.
     */
    public boolean isCancellationRequested() {
        return cancellationSignal.getAsBoolean();
    }
}
