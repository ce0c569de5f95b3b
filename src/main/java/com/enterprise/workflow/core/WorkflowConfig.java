package com.enterprise.workflow.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Static configuration of a workflow, created by {@link Workflow.Builder}
 */
public final class WorkflowConfig {
    
    public static final String DEFAULT_VERSION = "1.0.0";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(3600);
    public static final int DEFAULT_MAX_CONCURRENT_TASKS = 5;
    
    private final String name;
    private final String description;
    private final String version;
    private final Duration timeout;
    private final boolean parallelExecution;
    private final int maxConcurrentTasks;
    private final boolean enableCheckpoints;
    private final boolean continueOnFailure;
    private final List<String> tags;
    private final JsonNode metadata;
    
    WorkflowConfig(String name, String description, String version, Duration timeout,
                   boolean parallelExecution, int maxConcurrentTasks, boolean enableCheckpoints,
                   boolean continueOnFailure, List<String> tags, JsonNode metadata) {
        this.name = Objects.requireNonNull(name, "Workflow name cannot be null");
        this.description = description;
        this.version = version;
        this.timeout = Objects.requireNonNull(timeout, "Timeout cannot be null");
        this.parallelExecution = parallelExecution;
        this.maxConcurrentTasks = maxConcurrentTasks;
        this.enableCheckpoints = enableCheckpoints;
        this.continueOnFailure = continueOnFailure;
        this.tags = Collections.unmodifiableList(new ArrayList<>(tags));
        this.metadata = metadata != null ? metadata : JsonNodeFactory.instance.objectNode();
    }
    
    /**
     * Configuration with every default and the given name
     */
    public static WorkflowConfig defaults(String name) {
        return new WorkflowConfig(name, null, DEFAULT_VERSION, DEFAULT_TIMEOUT, true,
                DEFAULT_MAX_CONCURRENT_TASKS, true, false, List.of(), null);
    }
    
    public String getName() { return name; }
    
    public String getDescription() { return description; }
    
    public String getVersion() { return version; }
    
    public Duration getTimeout() { return timeout; }
    
    public boolean isParallelExecution() { return parallelExecution; }
    
    public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
    
    /**
     * Advisory only; checkpoints are not persisted
     */
    public boolean isEnableCheckpoints() { return enableCheckpoints; }
    
    public boolean isContinueOnFailure() { return continueOnFailure; }
    
    public List<String> getTags() { return tags; }
    
    public JsonNode getMetadata() { return metadata; }
}
