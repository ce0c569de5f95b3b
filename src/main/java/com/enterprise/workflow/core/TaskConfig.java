package com.enterprise.workflow.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Static configuration of a task. Instances are created through {@link Task.Builder}.
 */
public final class TaskConfig {
    
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(300);
    public static final int DEFAULT_MAX_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_DELAY = Duration.ofSeconds(5);
    
    private final String name;
    private final String description;
    private final Duration timeout;
    private final boolean retryEnabled;
    private final int maxRetries;
    private final Duration retryDelay;
    private final List<String> dependencies;
    private final String condition;
    private final List<String> tags;
    private final int priority;
    private final JsonNode metadata;
    
    TaskConfig(String name, String description, Duration timeout, boolean retryEnabled,
               int maxRetries, Duration retryDelay, List<String> dependencies, String condition,
               List<String> tags, int priority, JsonNode metadata) {
        this.name = Objects.requireNonNull(name, "Task name cannot be null");
        this.description = description;
        this.timeout = Objects.requireNonNull(timeout, "Timeout cannot be null");
        this.retryEnabled = retryEnabled;
        this.maxRetries = maxRetries;
        this.retryDelay = Objects.requireNonNull(retryDelay, "Retry delay cannot be null");
        this.dependencies = Collections.unmodifiableList(new ArrayList<>(dependencies));
        this.condition = condition;
        this.tags = Collections.unmodifiableList(new ArrayList<>(tags));
        this.priority = priority;
        this.metadata = metadata != null ? metadata : JsonNodeFactory.instance.objectNode();
    }
    
    public String getName() { return name; }
    
    public String getDescription() { return description; }
    
    public Duration getTimeout() { return timeout; }
    
    public boolean isRetryEnabled() { return retryEnabled; }
    
    public int getMaxRetries() { return maxRetries; }
    
    public Duration getRetryDelay() { return retryDelay; }
    
    /**
     * Names of the tasks this task waits for, in declaration order
     */
    public List<String> getDependencies() { return dependencies; }
    
    /**
     * Condition expression attached with {@link Task.Builder#when(String)}.
     * The engine stores it but does not evaluate it.
     */
    public String getCondition() { return condition; }
    
    public List<String> getTags() { return tags; }
    
    public int getPriority() { return priority; }
    
    public JsonNode getMetadata() { return metadata; }
}
