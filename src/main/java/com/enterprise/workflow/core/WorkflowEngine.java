package com.enterprise.workflow.core;

import com.enterprise.workflow.exception.WorkflowException;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Runs workflows to completion and tracks the runs in flight
 */
public interface WorkflowEngine {
    
    /**
     * Execute a workflow with a fresh context and block until it ends.
     * Task failures are recorded in the result, not thrown.
     *
     * @throws WorkflowException if the workflow is empty, cyclic or was already executed
     */
    ExecutionResult execute(Workflow workflow) throws WorkflowException;
    
    /**
     * Execute a workflow with a host-prepared context, for example one carrying parameters
     */
    ExecutionResult execute(Workflow workflow, WorkflowContext context) throws WorkflowException;
    
    /**
     * Register the run immediately and execute it on the engine's pool.
     * The future completes exceptionally with a {@link WorkflowException} on rejection.
     */
    CompletableFuture<ExecutionResult> executeAsync(Workflow workflow);
    
    CompletableFuture<ExecutionResult> executeAsync(Workflow workflow, WorkflowContext context);
    
    /**
     * Ids of registered runs, running or paused
     */
    List<UUID> runningWorkflows();
    
    Optional<WorkflowStatus> getWorkflowStatus(UUID workflowId);
    
    /**
     * Request cancellation of a run. Pending tasks are not dispatched any more;
     * in-flight tasks see {@link TaskContext#isCancellationRequested()}.
     *
     * @return false if no such run is registered
     */
    boolean cancel(UUID workflowId);
    
    /**
     * Stop dispatching new tasks of a RUNNING run
     */
    boolean pause(UUID workflowId);
    
    /**
     * Resume dispatching for a PAUSED run
     */
    boolean resume(UUID workflowId);
    
    EngineStatistics getStatistics();
    
    boolean isRunning();
    
    /**
     * Cancel registered runs and release the handler pool
     */
    CompletableFuture<Void> shutdown();
}
