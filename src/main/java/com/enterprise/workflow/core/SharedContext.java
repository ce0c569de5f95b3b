package com.enterprise.workflow.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Values and artifacts shared by every task of one workflow run.
 * Safe for concurrent writers. Null keys and values are rejected.
 */
public class SharedContext {
    
    private final Map<String, Object> values = new ConcurrentHashMap<>();
    private final Map<String, JsonNode> artifacts = new ConcurrentHashMap<>();
    
    public void set(String key, Object value) {
        values.put(Objects.requireNonNull(key, "Key cannot be null"),
                Objects.requireNonNull(value, "Shared value cannot be null: " + key));
    }
    
    public Optional<Object> get(String key) {
        return Optional.ofNullable(values.get(key));
    }
    
    public Optional<Object> remove(String key) {
        return Optional.ofNullable(values.remove(key));
    }
    
    public void setArtifact(String key, JsonNode value) {
        artifacts.put(Objects.requireNonNull(key, "Key cannot be null"),
                Objects.requireNonNull(value, "Artifact cannot be null: " + key));
    }
    
    public Optional<JsonNode> getArtifact(String key) {
        return Optional.ofNullable(artifacts.get(key));
    }
    
    public Set<String> keys() {
        return Set.copyOf(values.keySet());
    }
    
    public Set<String> artifactKeys() {
        return Set.copyOf(artifacts.keySet());
    }
    
    public void clear() {
        values.clear();
        artifacts.clear();
    }
}
