package com.enterprise.workflow.config;

import java.time.Duration;

/**
 * Engine-wide configuration of the workflow engine
 */
public class ExecutionConfig {
    
    private final int maxConcurrentTasks;
    private final Duration taskTimeout;
    private final Duration workflowTimeout;
    private final boolean retryOnFailure;
    private final boolean enableCheckpoints;
    private final boolean continueOnFailure;
    private final Duration pollInterval;
    private final ExecutorConfig executorConfig;
    private final SchedulerConfig schedulerConfig;
    private final MonitoringConfig monitoringConfig;
    
    public ExecutionConfig(int maxConcurrentTasks, Duration taskTimeout, Duration workflowTimeout,
                           boolean retryOnFailure, boolean enableCheckpoints, boolean continueOnFailure,
                           Duration pollInterval, ExecutorConfig executorConfig,
                           SchedulerConfig schedulerConfig, MonitoringConfig monitoringConfig) {
        this.maxConcurrentTasks = maxConcurrentTasks;
        this.taskTimeout = taskTimeout;
        this.workflowTimeout = workflowTimeout;
        this.retryOnFailure = retryOnFailure;
        this.enableCheckpoints = enableCheckpoints;
        this.continueOnFailure = continueOnFailure;
        this.pollInterval = pollInterval;
        this.executorConfig = executorConfig;
        this.schedulerConfig = schedulerConfig;
        this.monitoringConfig = monitoringConfig;
    }
    
    /**
     * Upper bound on in-flight tasks per workflow run
     */
    public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
    
    /**
     * Ceiling applied on top of each task's own timeout
     */
    public Duration getTaskTimeout() { return taskTimeout; }
    
    /**
     * Ceiling applied on top of each workflow's own timeout
     */
    public Duration getWorkflowTimeout() { return workflowTimeout; }
    
    public boolean isRetryOnFailure() { return retryOnFailure; }
    
    public boolean isEnableCheckpoints() { return enableCheckpoints; }
    
    public boolean isContinueOnFailure() { return continueOnFailure; }
    
    public Duration getPollInterval() { return pollInterval; }
    
    public ExecutorConfig getExecutorConfig() { return executorConfig; }
    
    public SchedulerConfig getSchedulerConfig() { return schedulerConfig; }
    
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }
    
    /**
     * Handler thread pool configuration
     */
    public static class ExecutorConfig {
        private final Duration keepAliveTime;
        private final Duration shutdownTimeout;
        
        public ExecutorConfig(Duration keepAliveTime, Duration shutdownTimeout) {
            this.keepAliveTime = keepAliveTime;
            this.shutdownTimeout = shutdownTimeout;
        }
        
        public Duration getKeepAliveTime() { return keepAliveTime; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
    }
    
    /**
     * Scheduled workflow runner configuration
     */
    public static class SchedulerConfig {
        private final Duration tickInterval;
        
        public SchedulerConfig(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }
        
        public Duration getTickInterval() { return tickInterval; }
    }
    
    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;
        private final boolean enableHealthChecks;
        
        public MonitoringConfig(boolean enableMetrics, boolean enableHealthChecks) {
            this.enableMetrics = enableMetrics;
            this.enableHealthChecks = enableHealthChecks;
        }
        
        public boolean isEnableMetrics() { return enableMetrics; }
        public boolean isEnableHealthChecks() { return enableHealthChecks; }
    }
    
    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private int maxConcurrentTasks = 5;
        private Duration taskTimeout = Duration.ofSeconds(300);
        private Duration workflowTimeout = Duration.ofSeconds(3600);
        private boolean retryOnFailure = true;
        private boolean enableCheckpoints = true;
        private boolean continueOnFailure = false;
        private Duration pollInterval = Duration.ofMillis(100);
        private ExecutorConfig executorConfig = Defaults.defaultExecutorConfig();
        private SchedulerConfig schedulerConfig = Defaults.defaultSchedulerConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();
        
        public Builder maxConcurrentTasks(int maxConcurrentTasks) {
            this.maxConcurrentTasks = maxConcurrentTasks;
            return this;
        }
        
        public Builder taskTimeout(Duration taskTimeout) {
            this.taskTimeout = taskTimeout;
            return this;
        }
        
        public Builder workflowTimeout(Duration workflowTimeout) {
            this.workflowTimeout = workflowTimeout;
            return this;
        }
        
        public Builder retryOnFailure(boolean retryOnFailure) {
            this.retryOnFailure = retryOnFailure;
            return this;
        }
        
        public Builder enableCheckpoints(boolean enableCheckpoints) {
            this.enableCheckpoints = enableCheckpoints;
            return this;
        }
        
        public Builder continueOnFailure(boolean continueOnFailure) {
            this.continueOnFailure = continueOnFailure;
            return this;
        }
        
        public Builder pollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
            return this;
        }
        
        public Builder executorConfig(ExecutorConfig executorConfig) {
            this.executorConfig = executorConfig;
            return this;
        }
        
        public Builder schedulerConfig(SchedulerConfig schedulerConfig) {
            this.schedulerConfig = schedulerConfig;
            return this;
        }
        
        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }
        
        public ExecutionConfig build() {
            return new ExecutionConfig(maxConcurrentTasks, taskTimeout, workflowTimeout, retryOnFailure,
                    enableCheckpoints, continueOnFailure, pollInterval, executorConfig,
                    schedulerConfig, monitoringConfig);
        }
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public static ExecutionConfig defaults() {
        return builder().build();
    }
    
    /**
     * Default configurations
     */
    public static class Defaults {
        public static ExecutorConfig defaultExecutorConfig() {
            return new ExecutorConfig(Duration.ofMinutes(1), Duration.ofSeconds(30));
        }
        
        public static SchedulerConfig defaultSchedulerConfig() {
            return new SchedulerConfig(Duration.ofSeconds(15));
        }
        
        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(true, true);
        }
    }
}
