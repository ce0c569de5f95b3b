package com.enterprise.workflow.core;

import com.enterprise.workflow.exception.TaskNotFoundException;
import com.enterprise.workflow.exception.WorkflowException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowTest {
    
    @Test
    void testTopologicalOrder() throws Exception {
        Workflow workflow = Workflow.builder("chain")
            .task(Task.builder("c").dependsOn("b").build())
            .task(Task.builder("b").dependsOn("a").build())
            .task(Task.builder("a").build())
            .build();
        
        assertEquals(List.of("a", "b", "c"), workflow.getTaskOrder());
        assertEquals(3, workflow.size());
        assertEquals(WorkflowStatus.CREATED, workflow.getStatus());
    }
    
    @Test
    void testDiamondOrder() throws Exception {
        Workflow workflow = Workflow.builder("diamond")
            .task(Task.builder("d").dependsOn("b").dependsOn("c").build())
            .task(Task.builder("b").dependsOn("a").build())
            .task(Task.builder("c").dependsOn("a").build())
            .task(Task.builder("a").build())
            .build();
        List<String> order = workflow.getTaskOrder();
        
        assertEquals(4, order.size());
        assertTrue(order.indexOf("a") < order.indexOf("b"));
        assertTrue(order.indexOf("a") < order.indexOf("c"));
        assertTrue(order.indexOf("b") < order.indexOf("d"));
        assertTrue(order.indexOf("c") < order.indexOf("d"));
    }
    
    @Test
    void testEmptyWorkflowRejected() {
        WorkflowException e = assertThrows(WorkflowException.class, () -> Workflow.builder("empty").build());
        assertEquals(WorkflowException.Kind.EMPTY_WORKFLOW, e.getKind());
    }
    
    @Test
    void testCycleRejected() {
        WorkflowException e = assertThrows(WorkflowException.class, () -> Workflow.builder("loop")
            .task(Task.builder("a").dependsOn("b").build())
            .task(Task.builder("b").dependsOn("a").build())
            .build());
        
        assertEquals(WorkflowException.Kind.CIRCULAR_DEPENDENCY, e.getKind());
        assertEquals("Circular dependency detected: a -> b -> a", e.getMessage());
    }
    
    @Test
    void testAddTaskAcceptsCycleUntilValidated() {
        Workflow workflow = new Workflow(WorkflowConfig.defaults("loop"));
        workflow.addTask(Task.builder("a").dependsOn("b").build());
        workflow.addTask(Task.builder("b").dependsOn("a").build());
        
        assertEquals(2, workflow.getTaskOrder().size());
        assertEquals(List.of("a", "b", "a"), workflow.findCycle());
        assertThrows(WorkflowException.class, workflow::validate);
    }
    
    @Test
    void testSelfDependencyIsACycle() {
        Workflow workflow = new Workflow(WorkflowConfig.defaults("self"));
        workflow.addTask(Task.builder("a").dependsOn("a").build());
        
        assertEquals(List.of("a", "a"), workflow.findCycle());
    }
    
    @Test
    void testDuplicateTaskName() {
        Workflow workflow = new Workflow(WorkflowConfig.defaults("dup"));
        workflow.addTask(Task.builder("a").build());
        
        assertThrows(IllegalArgumentException.class, () -> workflow.addTask(Task.builder("a").build()));
    }
    
    @Test
    void testRunnableTasks() throws Exception {
        Workflow workflow = Workflow.builder("flow")
            .task(Task.builder("a").build())
            .task(Task.builder("b").dependsOn("a").build())
            .task(Task.builder("c").build())
            .build();
        
        assertEquals(List.of("a", "c"), workflow.getRunnableTaskNames());
        
        workflow.storeResult(TaskResult.success(UUID.randomUUID(), "a", null));
        
        assertEquals(TaskStatus.COMPLETED, workflow.getTask("a").orElseThrow().getStatus());
        assertEquals(List.of("b", "c"), workflow.getRunnableTaskNames());
    }
    
    @Test
    void testFailedDependencyIsNotMet() throws Exception {
        Workflow workflow = Workflow.builder("flow")
            .task(Task.builder("a").build())
            .task(Task.builder("b").dependsOn("a").build())
            .build();
        
        workflow.storeResult(TaskResult.failure(UUID.randomUUID(), "a", "broken"));
        
        assertFalse(workflow.dependenciesMet("b"));
        assertEquals("a", workflow.firstUnmetDependency("b").orElseThrow());
        assertTrue(workflow.getRunnableTaskNames().isEmpty());
    }
    
    @Test
    void testMissingDependencyIsNeverMet() throws Exception {
        Workflow workflow = Workflow.builder("flow")
            .task(Task.builder("b").dependsOn("ghost").build())
            .build();
        
        assertFalse(workflow.dependenciesMet("b"));
        assertTrue(workflow.getRunnableTaskNames().isEmpty());
        assertEquals("ghost", workflow.firstUnmetDependency("b").orElseThrow());
    }
    
    @Test
    void testPriorityOrdering() throws Exception {
        Workflow workflow = Workflow.builder("prio")
            .task(Task.builder("x").priority(1).build())
            .task(Task.builder("y").priority(5).build())
            .task(Task.builder("z").build())
            .build();
        
        assertEquals(List.of("y", "x", "z"), workflow.getRunnableTaskNames());
    }
    
    @Test
    void testHasFailed() throws Exception {
        Workflow strict = Workflow.builder("strict")
            .task(Task.builder("a").build())
            .build();
        Workflow lenient = Workflow.builder("lenient")
            .continueOnFailure(true)
            .task(Task.builder("a").build())
            .build();
        
        strict.storeResult(TaskResult.of(UUID.randomUUID(), "a", TaskStatus.TIMED_OUT, "slow"));
        lenient.storeResult(TaskResult.failure(UUID.randomUUID(), "a", "broken"));
        
        assertTrue(strict.hasFailed());
        assertFalse(lenient.hasFailed());
        assertTrue(lenient.hasFailedTasks());
        assertEquals(List.of("a"), lenient.failedTaskNames());
    }
    
    @Test
    void testProgressAndCompletion() throws Exception {
        Workflow workflow = Workflow.builder("progress")
            .task(Task.builder("a").build())
            .task(Task.builder("b").build())
            .task(Task.builder("c").dependsOn("a").build())
            .task(Task.builder("d").build())
            .build();
        
        assertEquals(0.0, workflow.progress());
        assertFalse(workflow.isComplete());
        
        workflow.storeResult(TaskResult.success(UUID.randomUUID(), "a", null));
        workflow.markSkipped("c", "not needed");
        
        assertEquals(0.5, workflow.progress());
        assertEquals(2L, workflow.statusCounts().get(TaskStatus.PENDING));
        
        workflow.storeResult(TaskResult.failure(UUID.randomUUID(), "b", "broken"));
        workflow.storeResult(TaskResult.success(UUID.randomUUID(), "d", null));
        
        assertTrue(workflow.isComplete());
        assertEquals(0.75, workflow.progress());
        assertEquals(List.of("a", "b", "c", "d"), List.copyOf(workflow.results().keySet()));
    }
    
    @Test
    void testMarkSkippedKeepsTerminalResult() throws Exception {
        Workflow workflow = Workflow.builder("skip")
            .task(Task.builder("a").build())
            .build();
        workflow.storeResult(TaskResult.success(UUID.randomUUID(), "a", null));
        
        workflow.markSkipped("a", "late");
        
        assertEquals(TaskStatus.COMPLETED, workflow.getResult("a").orElseThrow().getStatus());
    }
    
    @Test
    void testMarkSkippedUnknownTask() throws Exception {
        Workflow workflow = Workflow.builder("skip")
            .task(Task.builder("a").build())
            .build();
        
        assertThrows(TaskNotFoundException.class, () -> workflow.markSkipped("ghost", "gone"));
    }
    
    @Test
    void testStatusTimestamps() throws Exception {
        Workflow workflow = Workflow.builder("times")
            .task(Task.builder("a").build())
            .build();
        
        assertNull(workflow.getStartedAt());
        workflow.setStatus(WorkflowStatus.RUNNING);
        assertNotNull(workflow.getStartedAt());
        assertNull(workflow.getCompletedAt());
        workflow.setStatus(WorkflowStatus.COMPLETED);
        assertNotNull(workflow.getCompletedAt());
    }
    
    @Test
    void testInvalidBuilderSettings() {
        assertThrows(IllegalArgumentException.class,
            () -> Workflow.builder("w").maxConcurrentTasks(0).task(Task.builder("a").build()).build());
        assertThrows(IllegalArgumentException.class,
            () -> Workflow.builder(" ").task(Task.builder("a").build()).build());
    }
}
