package com.enterprise.workflow.monitoring;

import com.enterprise.workflow.config.ExecutionConfig;
import com.enterprise.workflow.core.Task;
import com.enterprise.workflow.core.Workflow;
import com.enterprise.workflow.core.WorkflowEngineImpl;
import com.enterprise.workflow.scheduler.CronScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class HealthCheckerTest {
    
    private WorkflowEngineImpl engine;
    private CronScheduler scheduler;
    
    @BeforeEach
    void setUp() {
        engine = new WorkflowEngineImpl(ExecutionConfig.builder().pollInterval(Duration.ofMillis(10)).build());
        scheduler = new CronScheduler();
    }
    
    @AfterEach
    void tearDown() throws Exception {
        engine.shutdown().get(5, TimeUnit.SECONDS);
    }
    
    @Test
    void testRunningEngineAndScheduler() throws Exception {
        scheduler.start();
        scheduler.scheduleCron("nightly", UUID.randomUUID(), "0 2 * * *");
        
        HealthChecker.HealthStatus status = new HealthChecker(engine, scheduler).performHealthCheck()
            .get(5, TimeUnit.SECONDS);
        
        assertTrue(status.getChecks().get("engine.running").isPassed());
        assertTrue(status.getChecks().get("scheduler.running").isPassed());
        assertEquals("Scheduled jobs: 1", status.getChecks().get("scheduler.jobs").getMessage());
        assertTrue(status.getChecks().containsKey("system.memory"));
        assertFalse(status.getChecks().containsKey("workflows.success_rate"));
        assertNotNull(status.getTimestamp());
    }
    
    @Test
    void testStoppedSchedulerIsUnhealthy() {
        HealthChecker.HealthStatus status = new HealthChecker(engine, scheduler).check();
        
        assertFalse(status.isHealthy());
        assertFalse(status.getChecks().get("scheduler.running").isPassed());
        assertTrue(status.failedChecks().contains("scheduler.running: Scheduler is not running"));
    }
    
    @Test
    void testEngineWithoutScheduler() {
        HealthChecker.HealthStatus status = new HealthChecker(engine, null).check();
        
        assertFalse(status.getChecks().containsKey("scheduler.running"));
        assertTrue(status.getChecks().get("engine.running").isPassed());
    }
    
    @Test
    void testLowSuccessRateFails() throws Exception {
        engine.execute(Workflow.builder("bad").task(Task.builder("a").noRetry()
            .handler(ctx -> {
                throw new IllegalStateException("broken");
            }).build()).build());
        
        HealthChecker.HealthStatus status = new HealthChecker(engine, null).check();
        
        assertFalse(status.isHealthy());
        assertFalse(status.getChecks().get("workflows.success_rate").isPassed());
    }
    
    @Test
    void testShutDownEngineIsUnhealthy() throws Exception {
        engine.shutdown().get(5, TimeUnit.SECONDS);
        
        HealthChecker.HealthStatus status = new HealthChecker(engine, null).check();
        
        assertFalse(status.isHealthy());
        assertEquals("Engine is not running", status.getChecks().get("engine.running").getMessage());
    }
}
