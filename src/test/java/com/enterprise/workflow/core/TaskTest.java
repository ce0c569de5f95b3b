package com.enterprise.workflow.core;

import com.enterprise.workflow.exception.TaskException;
import com.enterprise.workflow.util.JsonSupport;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class TaskTest {
    
    @Test
    void testBuilderDefaults() {
        Task task = Task.builder("fetch").build();
        TaskConfig config = task.getConfig();
        
        assertEquals("fetch", task.getName());
        assertNotNull(task.getId());
        assertEquals("Task: fetch", config.getDescription());
        assertEquals(Duration.ofSeconds(300), config.getTimeout());
        assertTrue(config.isRetryEnabled());
        assertEquals(3, config.getMaxRetries());
        assertEquals(Duration.ofSeconds(5), config.getRetryDelay());
        assertEquals(0, config.getPriority());
        assertTrue(config.getDependencies().isEmpty());
        assertTrue(config.getMetadata().isObject());
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertFalse(task.hasHandler());
    }
    
    @Test
    void testBuilderSettings() {
        Task task = Task.builder("report")
            .description("Build the report")
            .dependsOn("fetch")
            .dependsOnAll(List.of("fetch", "clean"))
            .timeout(Duration.ofSeconds(10))
            .retry(5, Duration.ofMillis(200))
            .when("input.ready")
            .priority(7)
            .tag("reporting")
            .metadata(JsonSupport.object().put("owner", "ops"))
            .build();
        TaskConfig config = task.getConfig();
        
        assertEquals("Build the report", config.getDescription());
        assertEquals(List.of("fetch", "clean"), config.getDependencies());
        assertEquals(Duration.ofSeconds(10), config.getTimeout());
        assertEquals(5, config.getMaxRetries());
        assertEquals(Duration.ofMillis(200), config.getRetryDelay());
        assertEquals("input.ready", config.getCondition());
        assertEquals(7, config.getPriority());
        assertEquals(List.of("reporting"), config.getTags());
        assertEquals("ops", config.getMetadata().get("owner").asText());
    }
    
    @Test
    void testInvalidBuilderSettings() {
        assertThrows(IllegalArgumentException.class, () -> Task.builder(" ").build());
        assertThrows(IllegalArgumentException.class,
            () -> Task.builder("t").timeout(Duration.ZERO).build());
        assertThrows(IllegalArgumentException.class,
            () -> Task.builder("t").retry(-1, Duration.ZERO).build());
    }
    
    @Test
    void testExecuteSuccess() {
        Task task = Task.builder("answer")
            .handler(ctx -> CompletableFuture.completedFuture(JsonSupport.object().put("value", 42)))
            .build();
        
        TaskResult result = task.execute(new TaskContext("answer"));
        
        assertEquals(TaskStatus.COMPLETED, result.getStatus());
        assertTrue(result.isSuccess());
        assertEquals(42, result.getOutput().get("value").asInt());
        assertEquals(task.getId(), result.getTaskId());
        assertNull(result.getError());
        assertNotNull(result.getStartedAt());
        assertNotNull(result.getEndedAt());
    }
    
    @Test
    void testExecuteLeavesStatusToCaller() {
        Task task = Task.builder("answer")
            .handler(ctx -> CompletableFuture.failedFuture(new IllegalStateException("nope")))
            .build();
        
        task.execute(new TaskContext("answer"));
        
        assertEquals(TaskStatus.PENDING, task.getStatus());
    }
    
    @Test
    void testTaskWithoutHandlerCompletesWithEmptyObject() {
        TaskResult result = Task.builder("noop").build().execute(new TaskContext("noop"));
        
        assertEquals(TaskStatus.COMPLETED, result.getStatus());
        assertTrue(result.getOutput().isObject());
        assertEquals(0, result.getOutput().size());
    }
    
    @Test
    void testHandlerFailureBecomesFailedResult() {
        Task task = Task.builder("broken")
            .handler(ctx -> CompletableFuture.failedFuture(TaskException.executionFailed("boom")))
            .build();
        
        TaskResult result = task.execute(new TaskContext("broken"));
        
        assertEquals(TaskStatus.FAILED, result.getStatus());
        assertEquals("Task execution failed: boom", result.getError());
        assertNull(result.getOutput());
    }
    
    @Test
    void testHandlerThrowingSynchronously() {
        Task task = Task.builder("thrower")
            .handler(ctx -> {
                throw new IllegalStateException("bad input");
            })
            .build();
        
        TaskResult result = task.execute(new TaskContext("thrower"));
        
        assertEquals(TaskStatus.FAILED, result.getStatus());
        assertEquals("bad input", result.getError());
    }
    
    @Test
    void testTimeout() {
        Task task = Task.builder("slow")
            .timeout(Duration.ofSeconds(1))
            .handler(new SleepingHandler(5000))
            .build();
        
        long start = System.currentTimeMillis();
        TaskResult result = task.execute(new TaskContext("slow"));
        long elapsed = System.currentTimeMillis() - start;
        
        assertEquals(TaskStatus.TIMED_OUT, result.getStatus());
        assertEquals("Task timed out after 1 seconds", result.getError());
        assertTrue(elapsed < 4000, "timeout should not wait for the handler, took " + elapsed + "ms");
    }
    
    @Test
    void testTimeoutCancelsHandlerFuture() {
        CompletableFuture<JsonNode> pending = new CompletableFuture<>();
        Task task = Task.builder("stuck")
            .timeout(Duration.ofMillis(200))
            .handler(ctx -> pending)
            .build();
        
        TaskResult result = task.execute(new TaskContext("stuck"));
        
        assertEquals(TaskStatus.TIMED_OUT, result.getStatus());
        assertEquals("Task timed out after 200 ms", result.getError());
        assertTrue(pending.isCancelled());
    }
    
    @Test
    void testCanRetry() {
        Task task = Task.builder("flaky").retry(2, Duration.ZERO).build();
        
        assertTrue(task.canRetry());
        task.incrementRetry();
        assertTrue(task.canRetry());
        task.incrementRetry();
        assertFalse(task.canRetry());
        assertEquals(2, task.getRetryCount());
    }
    
    @Test
    void testNoRetry() {
        Task task = Task.builder("once").noRetry().build();
        
        assertFalse(task.getConfig().isRetryEnabled());
        assertFalse(task.canRetry());
    }
    
    @Test
    void testContextInputsReachHandler() {
        Task task = Task.builder("sum")
            .handler(ctx -> {
                int a = ctx.getInput("a").map(JsonNode::asInt).orElse(0);
                int b = ctx.getInput("b").map(JsonNode::asInt).orElse(0);
                return CompletableFuture.completedFuture(JsonSupport.toTree(a + b));
            })
            .build();
        TaskContext context = new TaskContext("sum");
        context.setInput("a", JsonSupport.toTree(2));
        context.setInput("b", JsonSupport.toTree(3));
        
        TaskResult result = task.execute(context);
        
        assertEquals(5, result.getOutput().asInt());
    }
    
    private static class SleepingHandler implements TaskHandler {
        private final long sleepMs;
        
        SleepingHandler(long sleepMs) {
            this.sleepMs = sleepMs;
        }
        
        @Override
        public CompletableFuture<JsonNode> handle(TaskContext context) {
            return CompletableFuture.supplyAsync(() -> {
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return JsonSupport.object();
            });
        }
    }
}
