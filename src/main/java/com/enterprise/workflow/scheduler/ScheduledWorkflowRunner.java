package com.enterprise.workflow.scheduler;

import com.enterprise.workflow.core.ExecutionResult;
import com.enterprise.workflow.core.Workflow;
import com.enterprise.workflow.core.WorkflowEngine;
import com.enterprise.workflow.exception.JobNotFoundException;
import com.enterprise.workflow.exception.WorkflowException;
import com.enterprise.workflow.monitoring.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Polls a {@link CronScheduler} for due jobs and runs their workflows on a {@link WorkflowEngine}
 */
public class ScheduledWorkflowRunner {
    
    private static final Logger logger = LoggerFactory.getLogger(ScheduledWorkflowRunner.class);
    
    /**
     * Builds a fresh workflow for each triggered run of a job
     */
    @FunctionalInterface
    public interface WorkflowSupplier {
        Workflow create(ScheduledJob job) throws WorkflowException;
    }
    
    private final CronScheduler scheduler;
    private final WorkflowEngine engine;
    private final WorkflowSupplier workflowSupplier;
    private final MetricsCollector metricsCollector;
    
    private ScheduledExecutorService ticker;
    private ScheduledFuture<?> tickFuture;
    
    public ScheduledWorkflowRunner(CronScheduler scheduler, WorkflowEngine engine,
                                   WorkflowSupplier workflowSupplier, MetricsCollector metricsCollector) {
        this.scheduler = scheduler;
        this.engine = engine;
        this.workflowSupplier = workflowSupplier;
        this.metricsCollector = metricsCollector;
    }
    
    /**
     * Trigger every due job once. Each job is recorded before its workflow starts,
     * so a long run is not triggered again on the next tick.
     *
     * @return the runs started by this tick
     */
    public List<CompletableFuture<ExecutionResult>> tick() {
        List<CompletableFuture<ExecutionResult>> started = new ArrayList<>();
        for (ScheduledJob job : scheduler.getDueJobs()) {
            try {
                scheduler.recordExecution(job.getId());
            } catch (JobNotFoundException e) {
                logger.debug("Job {} was unscheduled before it could run", job.getName());
                continue;
            }
            
            Workflow workflow;
            try {
                workflow = workflowSupplier.create(job);
            } catch (WorkflowException e) {
                logger.error("Could not build workflow for job {}", job.getName(), e);
                continue;
            }
            
            logger.info("Triggering workflow {} for job {}", workflow.getName(), job.getName());
            metricsCollector.recordScheduledRun(job.getName());
            started.add(engine.executeAsync(workflow).whenComplete((result, throwable) -> {
                if (throwable != null) {
                    logger.error("Scheduled run of job {} failed", job.getName(), throwable);
                }
            }));
        }
        return started;
    }
    
    /**
     * Start the scheduler and tick every {@code interval} on a single background thread
     */
    public synchronized void start(Duration interval) {
        if (ticker != null) {
            return;
        }
        scheduler.start();
        ticker = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "workflow-scheduler");
            t.setDaemon(true);
            return t;
        });
        tickFuture = ticker.scheduleWithFixedDelay(this::safeTick, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        logger.info("ScheduledWorkflowRunner started with interval {}ms", interval.toMillis());
    }
    
    public synchronized void stop() {
        if (ticker == null) {
            return;
        }
        tickFuture.cancel(false);
        ticker.shutdown();
        try {
            if (!ticker.awaitTermination(10, TimeUnit.SECONDS)) {
                ticker.shutdownNow();
            }
        } catch (InterruptedException e) {
            ticker.shutdownNow();
            Thread.currentThread().interrupt();
        }
        ticker = null;
        tickFuture = null;
        scheduler.stop();
        logger.info("ScheduledWorkflowRunner stopped");
    }
    
    public synchronized boolean isRunning() {
        return ticker != null;
    }
    
    private void safeTick() {
        try {
            tick();
        } catch (RuntimeException e) {
            logger.error("Error processing scheduled jobs", e);
        }
    }
}
