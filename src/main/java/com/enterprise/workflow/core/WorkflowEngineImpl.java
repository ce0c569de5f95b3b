package com.enterprise.workflow.core;

import com.enterprise.workflow.config.ExecutionConfig;
import com.enterprise.workflow.exception.TaskException;
import com.enterprise.workflow.exception.WorkflowException;
import com.enterprise.workflow.monitoring.MetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main implementation of the WorkflowEngine.
 * <p>
 * Each run is driven by one coordinating thread that dispatches runnable tasks
 * to the {@link AsyncTaskExecutor}, bounded by a per-run semaphore, and stores
 * their results as they complete.
 */
public class WorkflowEngineImpl implements WorkflowEngine {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowEngineImpl.class);

    private final ExecutionConfig config;
    private final AsyncTaskExecutor executor;
    private final MetricsCollector metricsCollector;
    private final Map<UUID, ActiveRun> activeRuns = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final AtomicLong totalWorkflowsExecuted = new AtomicLong(0);
    private final AtomicLong totalWorkflowsCompleted = new AtomicLong(0);
    private final AtomicLong totalWorkflowsFailed = new AtomicLong(0);
    private final AtomicLong totalWorkflowsCancelled = new AtomicLong(0);
    private final AtomicLong totalTaskRetries = new AtomicLong(0);
    private final Instant startedAt;

    public WorkflowEngineImpl(ExecutionConfig config) {
        this(config, new AsyncTaskExecutor(config.getExecutorConfig().getKeepAliveTime()), new MetricsCollector());
    }

    public WorkflowEngineImpl(ExecutionConfig config, AsyncTaskExecutor executor, MetricsCollector metricsCollector) {
        if (config.getMaxConcurrentTasks() <= 0) {
            throw new IllegalArgumentException("maxConcurrentTasks must be positive: " + config.getMaxConcurrentTasks());
        }
        if (config.getPollInterval() == null || config.getPollInterval().isNegative()
                || config.getPollInterval().isZero()) {
            throw new IllegalArgumentException("pollInterval must be positive: " + config.getPollInterval());
        }
        this.config = config;
        this.executor = executor;
        this.metricsCollector = metricsCollector;
        this.startedAt = Instant.now();

        logger.info("WorkflowEngine created with maxConcurrentTasks={}, taskTimeout={}s, workflowTimeout={}s",
                   config.getMaxConcurrentTasks(), config.getTaskTimeout().getSeconds(),
                   config.getWorkflowTimeout().getSeconds());
    }

    @Override
    public ExecutionResult execute(Workflow workflow) throws WorkflowException {
        return execute(workflow, new WorkflowContext(workflow.getId(), workflow.getName()));
    }

    @Override
    public ExecutionResult execute(Workflow workflow, WorkflowContext context) throws WorkflowException {
        ActiveRun run = register(workflow, context);
        return runToCompletion(run);
    }

    @Override
    public CompletableFuture<ExecutionResult> executeAsync(Workflow workflow) {
        return executeAsync(workflow, new WorkflowContext(workflow.getId(), workflow.getName()));
    }

    @Override
    public CompletableFuture<ExecutionResult> executeAsync(Workflow workflow, WorkflowContext context) {
        ActiveRun run;
        try {
            run = register(workflow, context);
        } catch (WorkflowException e) {
            return CompletableFuture.failedFuture(e);
        }

        try {
            return executor.submit(() -> runToCompletion(run));
        } catch (RejectedExecutionException e) {
            activeRuns.remove(workflow.getId());
            return CompletableFuture.failedFuture(
                WorkflowException.executionFailed("engine rejected workflow " + workflow.getName(), e));
        }
    }

    private ActiveRun register(Workflow workflow, WorkflowContext context) throws WorkflowException {
        if (!running.get()) {
            throw new IllegalStateException("WorkflowEngine is not running");
        }
        workflow.validate();
        if (workflow.getStatus() != WorkflowStatus.CREATED && workflow.getStatus() != WorkflowStatus.QUEUED) {
            throw WorkflowException.executionFailed(
                "workflow " + workflow.getName() + " was already executed (" + workflow.getStatus() + ")", null);
        }

        Duration timeout = min(workflow.getConfig().getTimeout(), config.getWorkflowTimeout());
        ActiveRun run = new ActiveRun(workflow, context, Instant.now().plus(timeout));
        if (activeRuns.putIfAbsent(workflow.getId(), run) != null) {
            throw WorkflowException.executionFailed("workflow " + workflow.getId() + " is already running", null);
        }

        workflow.setStatus(WorkflowStatus.RUNNING);
        totalWorkflowsExecuted.incrementAndGet();
        metricsCollector.recordWorkflowStarted(workflow);
        logger.info("Starting workflow {} ({}) with {} tasks", workflow.getName(), workflow.getId(), workflow.size());
        return run;
    }

    private ExecutionResult runToCompletion(ActiveRun run) {
        Workflow workflow = run.workflow;
        Instant runStartedAt = workflow.getStartedAt() != null ? workflow.getStartedAt() : Instant.now();

        WorkflowStatus finalStatus;
        String error;
        try {
            Outcome outcome = coordinate(run);
            if (outcome == Outcome.CANCELLED) {
                finalStatus = WorkflowStatus.CANCELLED;
                error = "Workflow cancelled";
                totalWorkflowsCancelled.incrementAndGet();
            } else if (outcome == Outcome.TIMED_OUT) {
                finalStatus = WorkflowStatus.FAILED;
                error = WorkflowException.timeout().getMessage();
                totalWorkflowsFailed.incrementAndGet();
            } else if (workflow.hasFailed()) {
                finalStatus = WorkflowStatus.FAILED;
                error = "One or more tasks failed: " + String.join(", ", workflow.failedTaskNames());
                totalWorkflowsFailed.incrementAndGet();
            } else {
                finalStatus = WorkflowStatus.COMPLETED;
                error = null;
                totalWorkflowsCompleted.incrementAndGet();
            }
        } finally {
            activeRuns.remove(workflow.getId());
            if (run.interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        workflow.setStatus(finalStatus);
        Instant endedAt = Instant.now();
        ExecutionResult result = new ExecutionResult(workflow.getId(), workflow.getName(), finalStatus,
                workflow.results(), runStartedAt, endedAt,
                Duration.between(runStartedAt, endedAt).toMillis(), error);
        metricsCollector.recordWorkflowFinished(result);

        if (finalStatus == WorkflowStatus.COMPLETED) {
            logger.info("Workflow {} completed in {}ms", workflow.getName(), result.getDurationMs());
        } else {
            logger.warn("Workflow {} ended {} after {}ms: {}", workflow.getName(), finalStatus,
                       result.getDurationMs(), error);
        }
        return result;
    }

    private Outcome coordinate(ActiveRun run) {
        Workflow workflow = run.workflow;
        WorkflowConfig workflowConfig = workflow.getConfig();
        int limit = workflowConfig.isParallelExecution()
                ? Math.min(workflowConfig.getMaxConcurrentTasks(), config.getMaxConcurrentTasks())
                : 1;
        Semaphore permits = new Semaphore(limit);
        BlockingQueue<TaskResult> completions = new LinkedBlockingQueue<>();
        int inFlight = 0;
        Outcome outcome = Outcome.FINISHED;

        while (!workflow.isComplete()) {
            WorkflowStatus requested = run.status.get();
            if (requested == WorkflowStatus.CANCELLED) {
                outcome = Outcome.CANCELLED;
                break;
            }
            // a task clipped by the deadline fails just after it, so check the deadline first
            if (Instant.now().isAfter(run.deadline)) {
                outcome = Outcome.TIMED_OUT;
                break;
            }
            if (shouldStopOnFailure(workflow)) {
                break;
            }
            if (requested == WorkflowStatus.PAUSED) {
                if (workflow.getStatus() != WorkflowStatus.PAUSED) {
                    workflow.setStatus(WorkflowStatus.PAUSED);
                    logger.info("Workflow {} paused", workflow.getName());
                }
                inFlight -= awaitCompletions(run, completions);
                continue;
            }
            if (workflow.getStatus() == WorkflowStatus.PAUSED) {
                workflow.setStatus(WorkflowStatus.RUNNING);
                logger.info("Workflow {} resumed", workflow.getName());
            }

            List<String> runnable = workflow.getRunnableTaskNames();
            for (String name : runnable) {
                if (!permits.tryAcquire()) {
                    break;
                }
                dispatch(run, workflow.getTask(name).orElseThrow(), permits, completions);
                inFlight++;
            }

            if (inFlight == 0) {
                skipBlockedTasks(run);
                continue;
            }
            inFlight -= awaitCompletions(run, completions);
        }

        if (outcome != Outcome.FINISHED) {
            run.context.requestCancellation();
        }
        while (inFlight > 0) {
            inFlight -= awaitCompletions(run, completions);
        }
        if (outcome != Outcome.FINISHED) {
            cancelPendingTasks(run, outcome == Outcome.CANCELLED
                    ? "Workflow cancelled" : WorkflowException.timeout().getMessage());
        }
        return outcome;
    }

    private boolean shouldStopOnFailure(Workflow workflow) {
        return workflow.hasFailed() && !config.isContinueOnFailure();
    }

    private void dispatch(ActiveRun run, Task task, Semaphore permits, BlockingQueue<TaskResult> completions) {
        TaskContext context = buildContext(run, task);
        task.setStatus(TaskStatus.QUEUED);
        logger.debug("Dispatching task {} of workflow {}", task.getName(), run.workflow.getName());

        try {
            executor.submit(() -> executeWithRetry(run, task, context))
                .whenComplete((result, throwable) -> {
                    permits.release();
                    completions.add(throwable == null ? result : abortedResult(task, throwable));
                });
        } catch (RejectedExecutionException e) {
            logger.error("Dispatch of task {} rejected", task.getName(), e);
            permits.release();
            completions.add(abortedResult(task, e));
        }
    }

    private TaskContext buildContext(ActiveRun run, Task task) {
        TaskContext context = run.context.createTaskContext(task.getName());
        for (String dependency : task.getDependencies()) {
            run.workflow.getResult(dependency)
                .map(TaskResult::getOutput)
                .ifPresent(output -> context.setInput(dependency, output.deepCopy()));
        }
        return context;
    }

    /**
     * Run a task, retrying failed or timed out attempts after the task's fixed delay
     */
    private TaskResult executeWithRetry(ActiveRun run, Task task, TaskContext context) {
        task.setStatus(TaskStatus.RUNNING);
        TaskResult result = executor.runAttempt(task, context, timeoutFor(task, run));

        while (result.getStatus().isFailure() && task.canRetry() && config.isRetryOnFailure() && !run.isStopping()) {
            task.incrementRetry();
            totalTaskRetries.incrementAndGet();
            metricsCollector.recordTaskRetry(task);

            Duration delay = task.getConfig().getRetryDelay();
            logger.warn("Task {} {}: {}; retry {}/{} in {}ms", task.getName(), result.getStatus(),
                       result.getError(), task.getRetryCount(), task.getConfig().getMaxRetries(), delay.toMillis());
            task.setStatus(TaskStatus.RETRYING);
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Retry of task {} interrupted", task.getName());
                break;
            }
            task.setStatus(TaskStatus.RUNNING);
            result = executor.runAttempt(task, context, timeoutFor(task, run));
        }
        return result.withRetryCount(task.getRetryCount());
    }

    private Duration timeoutFor(Task task, ActiveRun run) {
        Duration timeout = min(task.getConfig().getTimeout(), config.getTaskTimeout());
        // rounded up so an attempt clipped by the deadline ends after it
        long remainingMs = (Duration.between(Instant.now(), run.deadline).toNanos() + 999_999) / 1_000_000;
        return min(timeout, Duration.ofMillis(Math.max(1, remainingMs)));
    }

    private int awaitCompletions(ActiveRun run, BlockingQueue<TaskResult> completions) {
        int received = 0;
        try {
            TaskResult result = completions.poll(config.getPollInterval().toMillis(), TimeUnit.MILLISECONDS);
            while (result != null) {
                storeResult(run, result);
                received++;
                result = completions.poll();
            }
        } catch (InterruptedException e) {
            // re-asserted once the run has drained
            run.interrupted = true;
            logger.warn("Coordinator of workflow {} interrupted; cancelling", run.workflow.getName());
            cancel(run.workflow.getId());
        }
        return received;
    }

    private void storeResult(ActiveRun run, TaskResult result) {
        run.workflow.storeResult(result);
        if (result.getStatus() == TaskStatus.COMPLETED && result.getOutput() != null) {
            run.context.storeTaskOutput(result.getTaskName(), result.getOutput().deepCopy());
        }
        metricsCollector.recordTaskResult(result);

        if (result.isSuccess()) {
            logger.debug("Task {} completed in {}ms", result.getTaskName(), result.getDurationMs());
        } else {
            logger.warn("Task {} ended {} after {} retries: {}", result.getTaskName(), result.getStatus(),
                       result.getRetryCount(), result.getError());
        }
    }

    /**
     * Nothing is in flight and nothing is runnable: the remaining PENDING tasks
     * wait on a dependency that will never complete, so skip them.
     */
    private void skipBlockedTasks(ActiveRun run) {
        Workflow workflow = run.workflow;
        for (Task task : workflow.tasksInOrder()) {
            if (task.getStatus() != TaskStatus.PENDING) {
                continue;
            }
            String dependency = workflow.firstUnmetDependency(task.getName()).orElse("unknown");
            String reason = TaskException.dependencyFailed(dependency).getMessage();
            logger.warn("Skipping task {} of workflow {}: {}", task.getName(), workflow.getName(), reason);
            storeResult(run, TaskResult.of(task.getId(), task.getName(), TaskStatus.SKIPPED, reason)
                .withRetryCount(task.getRetryCount()));
        }
    }

    private void cancelPendingTasks(ActiveRun run, String reason) {
        for (Task task : run.workflow.tasksInOrder()) {
            if (!task.getStatus().isTerminal()) {
                storeResult(run, TaskResult.of(task.getId(), task.getName(), TaskStatus.CANCELLED, reason)
                    .withRetryCount(task.getRetryCount()));
            }
        }
    }

    private TaskResult abortedResult(Task task, Throwable throwable) {
        Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                ? throwable.getCause() : throwable;
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return TaskResult.failure(task.getId(), task.getName(), TaskException.executionFailed(detail).getMessage())
                .withRetryCount(task.getRetryCount());
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    @Override
    public List<UUID> runningWorkflows() {
        return new ArrayList<>(activeRuns.keySet());
    }

    @Override
    public Optional<WorkflowStatus> getWorkflowStatus(UUID workflowId) {
        ActiveRun run = activeRuns.get(workflowId);
        return run != null ? Optional.of(run.status.get()) : Optional.empty();
    }

    @Override
    public boolean cancel(UUID workflowId) {
        ActiveRun run = activeRuns.get(workflowId);
        if (run == null) {
            return false;
        }
        while (true) {
            WorkflowStatus current = run.status.get();
            if (current.isTerminal()) {
                return false;
            }
            if (run.status.compareAndSet(current, WorkflowStatus.CANCELLED)) {
                run.context.requestCancellation();
                logger.info("Cancellation requested for workflow {}", run.workflow.getName());
                return true;
            }
        }
    }

    @Override
    public boolean pause(UUID workflowId) {
        ActiveRun run = activeRuns.get(workflowId);
        return run != null && run.status.compareAndSet(WorkflowStatus.RUNNING, WorkflowStatus.PAUSED);
    }

    @Override
    public boolean resume(UUID workflowId) {
        ActiveRun run = activeRuns.get(workflowId);
        return run != null && run.status.compareAndSet(WorkflowStatus.PAUSED, WorkflowStatus.RUNNING);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public CompletableFuture<Void> shutdown() {
        if (!running.compareAndSet(true, false)) {
            return CompletableFuture.completedFuture(null);
        }
        logger.info("Shutting down WorkflowEngine with {} active runs", activeRuns.size());
        activeRuns.keySet().forEach(this::cancel);
        return executor.shutdown(config.getExecutorConfig().getShutdownTimeout())
            .thenRun(() -> logger.info("WorkflowEngine shut down"));
    }

    @Override
    public EngineStatistics getStatistics() {
        AsyncTaskExecutor.ExecutorStatistics executorStats = executor.getStatistics();

        return new EngineStatistics() {
            @Override
            public long getTotalWorkflowsExecuted() {
                return totalWorkflowsExecuted.get();
            }

            @Override
            public long getTotalWorkflowsCompleted() {
                return totalWorkflowsCompleted.get();
            }

            @Override
            public long getTotalWorkflowsFailed() {
                return totalWorkflowsFailed.get();
            }

            @Override
            public long getTotalWorkflowsCancelled() {
                return totalWorkflowsCancelled.get();
            }

            @Override
            public int getRunningWorkflows() {
                return activeRuns.size();
            }

            @Override
            public long getTotalTaskAttempts() {
                return executorStats.getTotalAttempts();
            }

            @Override
            public long getTotalTasksCompleted() {
                return executorStats.getTotalCompleted();
            }

            @Override
            public long getTotalTasksFailed() {
                return executorStats.getTotalFailed();
            }

            @Override
            public long getTotalTaskRetries() {
                return totalTaskRetries.get();
            }

            @Override
            public double getAverageTaskExecutionTimeMs() {
                return executorStats.getAverageExecutionTimeMs();
            }

            @Override
            public long getUptimeMs() {
                return Instant.now().toEpochMilli() - startedAt.toEpochMilli();
            }

            @Override
            public Instant getStartedAt() {
                return startedAt;
            }

            @Override
            public int getActiveThreadCount() {
                return executorStats.getActiveThreadCount();
            }
        };
    }

    private enum Outcome {
        FINISHED,
        CANCELLED,
        TIMED_OUT
    }

    /**
     * Registry entry of a run in flight
     */
    private static final class ActiveRun {
        private final Workflow workflow;
        private final WorkflowContext context;
        private final Instant deadline;
        private final AtomicReference<WorkflowStatus> status = new AtomicReference<>(WorkflowStatus.RUNNING);
        private boolean interrupted;

        private ActiveRun(Workflow workflow, WorkflowContext context, Instant deadline) {
            this.workflow = workflow;
            this.context = context;
            this.deadline = deadline;
        }

        private boolean isStopping() {
            return status.get() == WorkflowStatus.CANCELLED || Instant.now().isAfter(deadline);
        }
    }
}
