package com.enterprise.workflow;

import com.enterprise.workflow.config.ConfigValidator;
import com.enterprise.workflow.config.ExecutionConfig;
import com.enterprise.workflow.core.AsyncTaskExecutor;
import com.enterprise.workflow.core.WorkflowEngine;
import com.enterprise.workflow.core.WorkflowEngineImpl;
import com.enterprise.workflow.monitoring.HealthChecker;
import com.enterprise.workflow.monitoring.MetricsCollector;
import com.enterprise.workflow.scheduler.CronScheduler;
import com.enterprise.workflow.scheduler.ScheduledWorkflowRunner;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.composite.CompositeMeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Factory for creating and wiring the workflow engine
 */
public class WorkflowEngineFactory {
    
    private static final Logger logger = LoggerFactory.getLogger(WorkflowEngineFactory.class);
    
    /**
     * Create a workflow engine with default configuration
     */
    public static WorkflowEngine createDefault() {
        return create(ExecutionConfig.defaults());
    }
    
    /**
     * Create a workflow engine with custom configuration
     *
     * @throws IllegalArgumentException listing every validation error
     */
    public static WorkflowEngine create(ExecutionConfig config) {
        validate(config);
        return createEngine(config, createMetricsCollector(config));
    }
    
    /**
     * Create a workflow engine reporting to the given registry
     */
    public static WorkflowEngine create(ExecutionConfig config, MeterRegistry meterRegistry) {
        validate(config);
        return createEngine(config, new MetricsCollector(meterRegistry));
    }
    
    /**
     * Create an engine with a cron scheduler and a runner that builds workflows through {@code supplier}
     */
    public static WorkflowEngineWithScheduler createWithScheduler(ExecutionConfig config,
                                                                  ScheduledWorkflowRunner.WorkflowSupplier supplier) {
        return createWithScheduler(config, supplier, Clock.systemUTC());
    }
    
    public static WorkflowEngineWithScheduler createWithScheduler(ScheduledWorkflowRunner.WorkflowSupplier supplier) {
        return createWithScheduler(ExecutionConfig.defaults(), supplier);
    }
    
    public static WorkflowEngineWithScheduler createWithScheduler(ExecutionConfig config,
                                                                  ScheduledWorkflowRunner.WorkflowSupplier supplier,
                                                                  Clock clock) {
        validate(config);
        MetricsCollector metricsCollector = createMetricsCollector(config);
        WorkflowEngine engine = createEngine(config, metricsCollector);
        CronScheduler scheduler = new CronScheduler(clock);
        ScheduledWorkflowRunner runner = new ScheduledWorkflowRunner(scheduler, engine, supplier, metricsCollector);
        HealthChecker healthChecker = config.getMonitoringConfig().isEnableHealthChecks()
                ? new HealthChecker(engine, scheduler) : null;
        
        return new WorkflowEngineWithScheduler(config, engine, scheduler, runner, metricsCollector, healthChecker);
    }
    
    private static void validate(ExecutionConfig config) {
        List<ConfigValidator.ValidationError> errors = new ConfigValidator().validate(config);
        
        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }
    }
    
    private static MetricsCollector createMetricsCollector(ExecutionConfig config) {
        MeterRegistry registry = config.getMonitoringConfig().isEnableMetrics()
                ? new SimpleMeterRegistry()
                : new CompositeMeterRegistry();
        return new MetricsCollector(registry);
    }
    
    private static WorkflowEngine createEngine(ExecutionConfig config, MetricsCollector metricsCollector) {
        AsyncTaskExecutor executor = new AsyncTaskExecutor(config.getExecutorConfig().getKeepAliveTime());
        WorkflowEngine engine = new WorkflowEngineImpl(config, executor, metricsCollector);
        logger.info("WorkflowEngine created successfully");
        return engine;
    }
    
    /**
     * Wrapper class that includes the engine, its scheduler and the runner connecting them
     */
    public static class WorkflowEngineWithScheduler {
        private final ExecutionConfig config;
        private final WorkflowEngine engine;
        private final CronScheduler scheduler;
        private final ScheduledWorkflowRunner runner;
        private final MetricsCollector metricsCollector;
        private final HealthChecker healthChecker;
        
        public WorkflowEngineWithScheduler(ExecutionConfig config, WorkflowEngine engine, CronScheduler scheduler,
                                           ScheduledWorkflowRunner runner, MetricsCollector metricsCollector,
                                           HealthChecker healthChecker) {
            this.config = config;
            this.engine = engine;
            this.scheduler = scheduler;
            this.runner = runner;
            this.metricsCollector = metricsCollector;
            this.healthChecker = healthChecker;
        }
        
        public WorkflowEngine getEngine() { return engine; }
        public CronScheduler getScheduler() { return scheduler; }
        public ScheduledWorkflowRunner getRunner() { return runner; }
        public MetricsCollector getMetricsCollector() { return metricsCollector; }
        
        /**
         * Null when health checks are disabled
         */
        public HealthChecker getHealthChecker() { return healthChecker; }
        
        /**
         * Start ticking the scheduler at the configured interval
         */
        public void start() {
            runner.start(config.getSchedulerConfig().getTickInterval());
        }
        
        public void stop() {
            runner.stop();
            engine.shutdown().join();
        }
        
        public boolean isRunning() {
            return engine.isRunning() && scheduler.isRunning();
        }
    }
}
