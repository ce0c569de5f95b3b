package com.enterprise.workflow.core;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Host logic bound to a task.
 * Implementations complete the returned future with the task output, or
 * exceptionally (usually with a {@link com.enterprise.workflow.exception.TaskException})
 * to signal failure. Implementations should be thread-safe.
 */
@FunctionalInterface
public interface TaskHandler {
    
    /**
     * Handle one execution of a task
     * @param context The context of this run of the task
     * @return CompletableFuture that completes with the task output
     */
    CompletableFuture<JsonNode> handle(TaskContext context);
}
