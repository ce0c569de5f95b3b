package com.enterprise.workflow.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A named unit of work inside a workflow.
 * <p>
 * A task holds its configuration, an optional handler and the mutable status
 * and retry count the engine maintains while the task runs. Tasks are created
 * through {@link #builder(String)}.
 */
public class Task {
    
    private static final Logger logger = LoggerFactory.getLogger(Task.class);
    
    private final UUID id;
    private final TaskConfig config;
    private final TaskHandler handler;
    private volatile TaskStatus status = TaskStatus.PENDING;
    private volatile int retryCount;
    
    private Task(UUID id, TaskConfig config, TaskHandler handler) {
        this.id = id;
        this.config = config;
        this.handler = handler;
    }
    
    public static Builder builder(String name) {
        return new Builder(name);
    }
    
    public UUID getId() { return id; }
    
    public String getName() { return config.getName(); }
    
    public TaskConfig getConfig() { return config; }
    
    public List<String> getDependencies() { return config.getDependencies(); }
    
    public boolean hasHandler() { return handler != null; }
    
    public TaskStatus getStatus() { return status; }
    
    public void setStatus(TaskStatus status) {
        this.status = Objects.requireNonNull(status);
    }
    
    public int getRetryCount() { return retryCount; }
    
    public void incrementRetry() {
        retryCount++;
    }
    
    /**
     * Whether another attempt is allowed by this task's retry settings
     */
    public boolean canRetry() {
        return config.isRetryEnabled() && retryCount < config.getMaxRetries();
    }
    
    /**
     * Run the handler once on the common pool with this task's own timeout
     */
    public TaskResult execute(TaskContext context) {
        return execute(context, ForkJoinPool.commonPool(), config.getTimeout());
    }
    
    /**
     * Run the handler once on the given executor, racing it against {@code timeout}.
     * <p>
     * The handler is invoked on the executor so that a handler which blocks
     * before returning its future is still bounded by the timeout. When the
     * timeout wins the handler's future is cancelled and abandoned. This method
     * never retries and leaves the task's status alone; failures are reported in
     * the returned result, never thrown.
     *
     * @param context the context passed to the handler
     * @param executor the executor the handler runs on
     * @param timeout how long to wait for the handler
     * @return the result of this attempt
     */
    public TaskResult execute(TaskContext context, Executor executor, Duration timeout) {
        Instant startedAt = Instant.now();
        
        if (handler == null) {
            return finish(TaskStatus.COMPLETED, JsonNodeFactory.instance.objectNode(), null, startedAt);
        }
        
        AtomicReference<CompletableFuture<JsonNode>> handlerFuture = new AtomicReference<>();
        AtomicBoolean abandoned = new AtomicBoolean();
        CompletableFuture<JsonNode> future;
        try {
            future = CompletableFuture.supplyAsync(() -> invokeHandler(context, handlerFuture, abandoned), executor);
        } catch (RejectedExecutionException e) {
            logger.error("Task {} rejected by executor", getName(), e);
            return finish(TaskStatus.FAILED, null, "Task rejected: " + e.getMessage(), startedAt);
        }
        
        try {
            JsonNode output = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return finish(TaskStatus.COMPLETED,
                    output != null ? output : JsonNodeFactory.instance.nullNode(), null, startedAt);
        } catch (TimeoutException e) {
            abandon(future, handlerFuture, abandoned);
            logger.warn("Task {} timed out after {} ms", getName(), timeout.toMillis());
            return finish(TaskStatus.TIMED_OUT, null, "Task timed out after " + formatTimeout(timeout), startedAt);
        } catch (ExecutionException e) {
            Throwable cause = unwrap(e.getCause());
            logger.debug("Task {} failed: {}", getName(), describe(cause));
            return finish(TaskStatus.FAILED, null, describe(cause), startedAt);
        } catch (CancellationException e) {
            return finish(TaskStatus.CANCELLED, null, "Task cancelled", startedAt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(future, handlerFuture, abandoned);
            return finish(TaskStatus.CANCELLED, null, "Task cancelled", startedAt);
        }
    }
    
    private JsonNode invokeHandler(TaskContext context, AtomicReference<CompletableFuture<JsonNode>> handlerFuture,
                                   AtomicBoolean abandoned) {
        CompletableFuture<JsonNode> result = handler.handle(context);
        if (result == null) {
            throw new IllegalStateException("Handler returned no future");
        }
        handlerFuture.set(result);
        // the attempt may have been abandoned while the handler was still building its future
        if (abandoned.get()) {
            result.cancel(true);
        }
        return result.join();
    }
    
    /**
     * Cancel both the wrapping future and the handler's own future, releasing the worker blocked on it
     */
    private static void abandon(CompletableFuture<JsonNode> future,
                                AtomicReference<CompletableFuture<JsonNode>> handlerFuture, AtomicBoolean abandoned) {
        abandoned.set(true);
        future.cancel(true);
        CompletableFuture<JsonNode> inner = handlerFuture.get();
        if (inner != null) {
            inner.cancel(true);
        }
    }
    
    private static String formatTimeout(Duration timeout) {
        if (timeout.compareTo(Duration.ofSeconds(1)) < 0) {
            return timeout.toMillis() + " ms";
        }
        return timeout.getSeconds() + " seconds";
    }
    
    private TaskResult finish(TaskStatus finalStatus, JsonNode output, String error, Instant startedAt) {
        Instant endedAt = Instant.now();
        return new TaskResult(id, getName(), finalStatus, output, error, startedAt, endedAt,
                Duration.between(startedAt, endedAt).toMillis(), retryCount);
    }
    
    private static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
    
    private static String describe(Throwable throwable) {
        String message = throwable.getMessage();
        return message != null ? message : throwable.getClass().getSimpleName();
    }
    
    @Override
    public String toString() {
        return "Task{" +
                "name='" + getName() + '\'' +
                ", status=" + status +
                ", retryCount=" + retryCount +
                '}';
    }
    
    /**
     * Fluent builder for {@link Task}
     */
    public static class Builder {
        private final String name;
        private String description;
        private Duration timeout = TaskConfig.DEFAULT_TIMEOUT;
        private boolean retryEnabled = true;
        private int maxRetries = TaskConfig.DEFAULT_MAX_RETRIES;
        private Duration retryDelay = TaskConfig.DEFAULT_RETRY_DELAY;
        private final List<String> dependencies = new ArrayList<>();
        private String condition;
        private final List<String> tags = new ArrayList<>();
        private int priority = 0;
        private JsonNode metadata;
        private TaskHandler handler;
        
        private Builder(String name) {
            this.name = Objects.requireNonNull(name, "Task name cannot be null");
        }
        
        public Builder description(String description) {
            this.description = description;
            return this;
        }
        
        public Builder dependsOn(String taskName) {
            if (!dependencies.contains(taskName)) {
                dependencies.add(taskName);
            }
            return this;
        }
        
        public Builder dependsOnAll(Collection<String> taskNames) {
            taskNames.forEach(this::dependsOn);
            return this;
        }
        
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }
        
        public Builder retry(int maxRetries, Duration delay) {
            this.retryEnabled = true;
            this.maxRetries = maxRetries;
            this.retryDelay = delay;
            return this;
        }
        
        public Builder noRetry() {
            this.retryEnabled = false;
            return this;
        }
        
        public Builder when(String condition) {
            this.condition = condition;
            return this;
        }
        
        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }
        
        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }
        
        public Builder metadata(JsonNode metadata) {
            this.metadata = metadata;
            return this;
        }
        
        public Builder handler(TaskHandler handler) {
            this.handler = handler;
            return this;
        }
        
        public Task build() {
            if (name.isBlank()) {
                throw new IllegalArgumentException("Task name cannot be blank");
            }
            if (maxRetries < 0) {
                throw new IllegalArgumentException("Max retries cannot be negative");
            }
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Timeout must be positive");
            }
            if (retryDelay.isNegative()) {
                throw new IllegalArgumentException("Retry delay cannot be negative");
            }
            String desc = description != null ? description : "Task: " + name;
            TaskConfig config = new TaskConfig(name, desc, timeout, retryEnabled, maxRetries, retryDelay,
                    dependencies, condition, tags, priority, metadata);
            return new Task(UUID.randomUUID(), config, handler);
        }
    }
}
