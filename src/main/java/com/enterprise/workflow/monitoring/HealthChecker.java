package com.enterprise.workflow.monitoring;

import com.enterprise.workflow.core.EngineStatistics;
import com.enterprise.workflow.core.WorkflowEngine;
import com.enterprise.workflow.scheduler.CronScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Health checker for the workflow engine and its scheduler
 */
public class HealthChecker {
    
    private static final Logger logger = LoggerFactory.getLogger(HealthChecker.class);
    
    private final WorkflowEngine engine;
    private final CronScheduler scheduler;
    
    /**
     * @param scheduler may be null when the engine runs without a scheduler
     */
    public HealthChecker(WorkflowEngine engine, CronScheduler scheduler) {
        this.engine = engine;
        this.scheduler = scheduler;
    }
    
    /**
     * Perform a comprehensive health check
     */
    public CompletableFuture<HealthStatus> performHealthCheck() {
        return CompletableFuture.supplyAsync(this::check);
    }
    
    /**
     * Perform the health check on the calling thread
     */
    public HealthStatus check() {
        HealthStatus.Builder builder = HealthStatus.builder();
        
        checkEngineStatus(builder);
        checkSchedulerStatus(builder);
        checkSystemResources(builder);
        checkTaskExecution(builder);
        
        HealthStatus status = builder.build();
        if (!status.isHealthy()) {
            logger.warn("Health check failed: {}", status.failedChecks());
        }
        return status;
    }
    
    private void checkEngineStatus(HealthStatus.Builder builder) {
        try {
            boolean isRunning = engine.isRunning();
            builder.addCheck("engine.running", isRunning,
                isRunning ? "Engine is running" : "Engine is not running");
            
            if (isRunning) {
                EngineStatistics stats = engine.getStatistics();
                builder.addCheck("engine.uptime", stats.getUptimeMs() >= 0,
                    String.format("Engine uptime: %dms", stats.getUptimeMs()));
                builder.addCheck("workflows.running", true,
                    String.format("Running workflows: %d", stats.getRunningWorkflows()));
            }
            
        } catch (RuntimeException e) {
            builder.addCheck("engine.status", false, "Error checking engine status: " + e.getMessage());
        }
    }
    
    private void checkSchedulerStatus(HealthStatus.Builder builder) {
        if (scheduler == null) {
            return;
        }
        boolean isRunning = scheduler.isRunning();
        builder.addCheck("scheduler.running", isRunning,
            isRunning ? "Scheduler is running" : "Scheduler is not running");
        builder.addCheck("scheduler.jobs", true,
            String.format("Scheduled jobs: %d", scheduler.listJobs().size()));
    }
    
    private void checkSystemResources(HealthStatus.Builder builder) {
        Runtime runtime = Runtime.getRuntime();
        long totalMemory = runtime.totalMemory();
        long usedMemory = totalMemory - runtime.freeMemory();
        double memoryUsagePercent = (double) usedMemory / runtime.maxMemory() * 100;
        
        boolean memoryHealthy = memoryUsagePercent < 90;
        builder.addCheck("system.memory", memoryHealthy,
            String.format("Memory usage: %.2f%% (%d/%d MB)",
                memoryUsagePercent, usedMemory / 1024 / 1024, runtime.maxMemory() / 1024 / 1024));
        
        int processors = runtime.availableProcessors();
        builder.addCheck("system.processors", processors > 0,
            String.format("Available processors: %d", processors));
    }
    
    private void checkTaskExecution(HealthStatus.Builder builder) {
        try {
            EngineStatistics stats = engine.getStatistics();
            
            long finished = stats.getTotalWorkflowsCompleted() + stats.getTotalWorkflowsFailed();
            if (finished > 0) {
                double successRate = (double) stats.getTotalWorkflowsCompleted() / finished * 100;
                builder.addCheck("workflows.success_rate", successRate > 80,
                    String.format("Workflow success rate: %.2f%% (%d/%d)",
                        successRate, stats.getTotalWorkflowsCompleted(), finished));
            }
            
            double avgExecutionTime = stats.getAverageTaskExecutionTimeMs();
            builder.addCheck("tasks.execution_time", avgExecutionTime < 30000,
                String.format("Average task execution time: %.2fms", avgExecutionTime));
            
        } catch (RuntimeException e) {
            builder.addCheck("tasks.status", false, "Error checking task execution: " + e.getMessage());
        }
    }
    
    /**
     * Health status result
     */
    public static class HealthStatus {
        private final boolean healthy;
        private final Map<String, CheckResult> checks;
        private final Instant timestamp;
        
        private HealthStatus(boolean healthy, Map<String, CheckResult> checks, Instant timestamp) {
            this.healthy = healthy;
            this.checks = checks;
            this.timestamp = timestamp;
        }
        
        public boolean isHealthy() { return healthy; }
        public Map<String, CheckResult> getChecks() { return checks; }
        public Instant getTimestamp() { return timestamp; }
        
        public java.util.List<String> failedChecks() {
            return checks.entrySet().stream()
                .filter(entry -> !entry.getValue().isPassed())
                .map(entry -> entry.getKey() + ": " + entry.getValue().getMessage())
                .sorted()
                .collect(java.util.stream.Collectors.toList());
        }
        
        public static class CheckResult {
            private final boolean passed;
            private final String message;
            
            public CheckResult(boolean passed, String message) {
                this.passed = passed;
                this.message = message;
            }
            
            public boolean isPassed() { return passed; }
            public String getMessage() { return message; }
        }
        
        public static class Builder {
            private final Map<String, CheckResult> checks = new ConcurrentHashMap<>();
            
            public Builder addCheck(String name, boolean passed, String message) {
                checks.put(name, new CheckResult(passed, message));
                return this;
            }
            
            public HealthStatus build() {
                boolean healthy = checks.values().stream().allMatch(CheckResult::isPassed);
                return new HealthStatus(healthy, checks, Instant.now());
            }
        }
        
        public static Builder builder() {
            return new Builder();
        }
    }
}
