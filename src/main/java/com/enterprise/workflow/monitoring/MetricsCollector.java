package com.enterprise.workflow.monitoring;

import com.enterprise.workflow.core.ExecutionResult;
import com.enterprise.workflow.core.Task;
import com.enterprise.workflow.core.TaskResult;
import com.enterprise.workflow.core.Workflow;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects and exposes metrics for the workflow engine
 */
public class MetricsCollector {
    
    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);
    
    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> workflowNameCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Timer> workflowNameTimers = new ConcurrentHashMap<>();
    
    private final Counter workflowsStarted;
    private final Counter workflowsCompleted;
    private final Counter workflowsFailed;
    private final Counter workflowsCancelled;
    
    private final Counter tasksCompleted;
    private final Counter tasksFailed;
    private final Counter tasksTimedOut;
    private final Counter tasksRetried;
    private final Counter tasksSkipped;
    private final Counter tasksCancelled;
    
    private final Counter scheduledRuns;
    
    private final Timer workflowDuration;
    private final Timer taskDuration;
    
    private final AtomicLong runningWorkflows = new AtomicLong(0);
    
    public MetricsCollector() {
        this(new SimpleMeterRegistry());
    }
    
    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        
        this.workflowsStarted = counter("workflow.runs.started", "Total number of workflow runs started");
        this.workflowsCompleted = counter("workflow.runs.completed", "Total number of workflow runs completed");
        this.workflowsFailed = counter("workflow.runs.failed", "Total number of workflow runs that failed");
        this.workflowsCancelled = counter("workflow.runs.cancelled", "Total number of workflow runs cancelled");
        
        this.tasksCompleted = counter("workflow.tasks.completed", "Total number of tasks completed successfully");
        this.tasksFailed = counter("workflow.tasks.failed", "Total number of tasks that failed");
        this.tasksTimedOut = counter("workflow.tasks.timedout", "Total number of tasks that timed out");
        this.tasksRetried = counter("workflow.tasks.retried", "Total number of task retries");
        this.tasksSkipped = counter("workflow.tasks.skipped", "Total number of tasks skipped");
        this.tasksCancelled = counter("workflow.tasks.cancelled", "Total number of tasks cancelled");
        
        this.scheduledRuns = counter("workflow.scheduler.runs", "Total number of scheduled workflow triggers");
        
        this.workflowDuration = Timer.builder("workflow.run.duration")
            .description("Workflow run duration")
            .register(meterRegistry);
            
        this.taskDuration = Timer.builder("workflow.task.duration")
            .description("Task execution time")
            .register(meterRegistry);
        
        Gauge.builder("workflow.runs.running", runningWorkflows, AtomicLong::get)
            .description("Number of currently running workflows")
            .register(meterRegistry);
        
        logger.info("MetricsCollector initialized");
    }
    
    private Counter counter(String name, String description) {
        return Counter.builder(name)
            .description(description)
            .register(meterRegistry);
    }
    
    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }
    
    /**
     * Record the start of a workflow run
     */
    public void recordWorkflowStarted(Workflow workflow) {
        workflowsStarted.increment();
        runningWorkflows.incrementAndGet();
        getWorkflowNameCounter(workflow.getName(), "started").increment();
        
        logger.debug("Recorded workflow start: {} ({})", workflow.getName(), workflow.getId());
    }
    
    /**
     * Record the end of a workflow run
     */
    public void recordWorkflowFinished(ExecutionResult result) {
        runningWorkflows.decrementAndGet();
        switch (result.getStatus()) {
            case COMPLETED:
                workflowsCompleted.increment();
                break;
            case CANCELLED:
                workflowsCancelled.increment();
                break;
            default:
                workflowsFailed.increment();
                break;
        }
        String status = result.getStatus().name().toLowerCase();
        getWorkflowNameCounter(result.getWorkflowName(), status).increment();
        
        workflowDuration.record(result.getDurationMs(), TimeUnit.MILLISECONDS);
        getWorkflowNameTimer(result.getWorkflowName()).record(result.getDurationMs(), TimeUnit.MILLISECONDS);
        
        logger.debug("Recorded workflow finish: {} {} in {}ms",
                result.getWorkflowName(), result.getStatus(), result.getDurationMs());
    }
    
    /**
     * Record the final result of one task
     */
    public void recordTaskResult(TaskResult result) {
        switch (result.getStatus()) {
            case COMPLETED:
                tasksCompleted.increment();
                break;
            case TIMED_OUT:
                tasksTimedOut.increment();
                tasksFailed.increment();
                break;
            case FAILED:
                tasksFailed.increment();
                break;
            case SKIPPED:
                tasksSkipped.increment();
                break;
            case CANCELLED:
                tasksCancelled.increment();
                break;
            default:
                break;
        }
        if (result.getStartedAt() != null) {
            taskDuration.record(result.getDurationMs(), TimeUnit.MILLISECONDS);
        }
        
        logger.debug("Recorded task result: {} {}", result.getTaskName(), result.getStatus());
    }
    
    /**
     * Record a task retry
     */
    public void recordTaskRetry(Task task) {
        tasksRetried.increment();
        
        logger.debug("Recorded task retry: {} (attempt {})", task.getName(), task.getRetryCount());
    }
    
    /**
     * Record a workflow triggered by the scheduler
     */
    public void recordScheduledRun(String jobName) {
        scheduledRuns.increment();
        
        logger.debug("Recorded scheduled run of job {}", jobName);
    }
    
    public long getRunningWorkflows() {
        return runningWorkflows.get();
    }
    
    private Counter getWorkflowNameCounter(String workflowName, String status) {
        String key = workflowName + "." + status;
        return workflowNameCounters.computeIfAbsent(key, k ->
            Counter.builder("workflow.runs.by.name")
                .tag("workflow", workflowName)
                .tag("status", status)
                .description("Workflow run count by name and status")
                .register(meterRegistry)
        );
    }
    
    private Timer getWorkflowNameTimer(String workflowName) {
        return workflowNameTimers.computeIfAbsent(workflowName, k ->
            Timer.builder("workflow.run.duration.by.name")
                .tag("workflow", workflowName)
                .description("Workflow run duration by name")
                .register(meterRegistry)
        );
    }
    
    /**
     * Get all metrics as a map
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();
        
        metrics.put("runs.started", workflowsStarted.count());
        metrics.put("runs.completed", workflowsCompleted.count());
        metrics.put("runs.failed", workflowsFailed.count());
        metrics.put("runs.cancelled", workflowsCancelled.count());
        metrics.put("runs.running", runningWorkflows.get());
        
        metrics.put("tasks.completed", tasksCompleted.count());
        metrics.put("tasks.failed", tasksFailed.count());
        metrics.put("tasks.timedout", tasksTimedOut.count());
        metrics.put("tasks.retried", tasksRetried.count());
        metrics.put("tasks.skipped", tasksSkipped.count());
        metrics.put("tasks.cancelled", tasksCancelled.count());
        
        metrics.put("scheduler.runs", scheduledRuns.count());
        
        metrics.put("run.duration.mean", workflowDuration.mean(TimeUnit.MILLISECONDS));
        metrics.put("run.duration.max", workflowDuration.max(TimeUnit.MILLISECONDS));
        metrics.put("task.duration.mean", taskDuration.mean(TimeUnit.MILLISECONDS));
        metrics.put("task.duration.max", taskDuration.max(TimeUnit.MILLISECONDS));
        
        return metrics;
    }
}
