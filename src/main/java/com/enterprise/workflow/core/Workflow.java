package com.enterprise.workflow.core;

import com.enterprise.workflow.exception.TaskNotFoundException;
import com.enterprise.workflow.exception.WorkflowException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * A named set of tasks connected by dependencies.
 * <p>
 * The workflow keeps a topological order of its tasks, recomputed on every
 * {@link #addTask(Task)}, and the results stored by the engine while it runs.
 * Task statuses and results are written by the run's coordinating thread only.
 */
public class Workflow {
    
    private static final Logger logger = LoggerFactory.getLogger(Workflow.class);
    
    private final UUID id;
    private final WorkflowConfig config;
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private volatile List<String> taskOrder = List.of();
    private final Map<String, TaskResult> results = new ConcurrentHashMap<>();
    private volatile WorkflowStatus status = WorkflowStatus.CREATED;
    private final Instant createdAt;
    private volatile Instant startedAt;
    private volatile Instant completedAt;
    
    public Workflow(WorkflowConfig config) {
        this.id = UUID.randomUUID();
        this.config = config;
        this.createdAt = Instant.now();
    }
    
    public static Builder builder(String name) {
        return new Builder(name);
    }
    
    public UUID getId() { return id; }
    
    public String getName() { return config.getName(); }
    
    public WorkflowConfig getConfig() { return config; }
    
    public WorkflowStatus getStatus() { return status; }
    
    public Instant getCreatedAt() { return createdAt; }
    
    public Instant getStartedAt() { return startedAt; }
    
    public Instant getCompletedAt() { return completedAt; }
    
    /**
     * Add a task and recompute the execution order.
     *
     * @throws IllegalArgumentException if a task with the same name exists
     */
    public void addTask(Task task) {
        if (tasks.containsKey(task.getName())) {
            throw new IllegalArgumentException("Duplicate task name: " + task.getName());
        }
        tasks.put(task.getName(), task);
        computeOrder();
    }
    
    public Optional<Task> getTask(String name) {
        return Optional.ofNullable(tasks.get(name));
    }
    
    public int size() {
        return tasks.size();
    }
    
    public boolean isEmpty() {
        return tasks.isEmpty();
    }
    
    /**
     * Task names in topological order
     */
    public List<String> getTaskOrder() {
        return taskOrder;
    }
    
    public List<Task> tasksInOrder() {
        return taskOrder.stream().map(tasks::get).collect(Collectors.toList());
    }
    
    private void computeOrder() {
        List<String> order = new ArrayList<>(tasks.size());
        Set<String> visited = new HashSet<>();
        Set<String> inProgress = new HashSet<>();
        for (String name : tasks.keySet()) {
            visit(name, visited, inProgress, order);
        }
        taskOrder = Collections.unmodifiableList(order);
    }
    
    private void visit(String name, Set<String> visited, Set<String> inProgress, List<String> order) {
        if (visited.contains(name)) {
            return;
        }
        if (inProgress.contains(name)) {
            logger.warn("Circular dependency detected at task '{}' in workflow '{}'", name, getName());
            return;
        }
        inProgress.add(name);
        for (String dependency : tasks.get(name).getDependencies()) {
            if (tasks.containsKey(dependency)) {
                visit(dependency, visited, inProgress, order);
            }
        }
        inProgress.remove(name);
        visited.add(name);
        order.add(name);
    }
    
    /**
     * Names along one dependency cycle, first name repeated at the end, or empty when acyclic
     */
    public List<String> findCycle() {
        Set<String> done = new HashSet<>();
        List<String> path = new ArrayList<>();
        for (String name : tasks.keySet()) {
            List<String> cycle = findCycle(name, done, path);
            if (!cycle.isEmpty()) {
                return cycle;
            }
        }
        return List.of();
    }
    
    private List<String> findCycle(String name, Set<String> done, List<String> path) {
        if (done.contains(name)) {
            return List.of();
        }
        int index = path.indexOf(name);
        if (index >= 0) {
            List<String> cycle = new ArrayList<>(path.subList(index, path.size()));
            cycle.add(name);
            return cycle;
        }
        path.add(name);
        for (String dependency : tasks.get(name).getDependencies()) {
            if (tasks.containsKey(dependency)) {
                List<String> cycle = findCycle(dependency, done, path);
                if (!cycle.isEmpty()) {
                    return cycle;
                }
            }
        }
        path.remove(path.size() - 1);
        done.add(name);
        return List.of();
    }
    
    /**
     * Throw if the workflow cannot be executed
     */
    public void validate() throws WorkflowException {
        if (tasks.isEmpty()) {
            throw WorkflowException.emptyWorkflow();
        }
        List<String> cycle = findCycle();
        if (!cycle.isEmpty()) {
            throw WorkflowException.circularDependency(String.join(" -> ", cycle));
        }
    }
    
    /**
     * Whether every dependency of the named task has a stored COMPLETED result.
     * A dependency naming no task of this workflow is never met.
     */
    public boolean dependenciesMet(String name) {
        Task task = tasks.get(name);
        if (task == null) {
            return false;
        }
        for (String dependency : task.getDependencies()) {
            TaskResult result = results.get(dependency);
            if (result == null || result.getStatus() != TaskStatus.COMPLETED) {
                return false;
            }
        }
        return true;
    }
    
    /**
     * PENDING tasks whose dependencies are met, highest priority first, then in topological order
     */
    public List<String> getRunnableTaskNames() {
        List<String> runnable = new ArrayList<>();
        for (String name : taskOrder) {
            if (tasks.get(name).getStatus() == TaskStatus.PENDING && dependenciesMet(name)) {
                runnable.add(name);
            }
        }
        runnable.sort(Comparator.comparingInt((String name) -> tasks.get(name).getConfig().getPriority()).reversed());
        return runnable;
    }
    
    /**
     * First dependency of the named task that has not COMPLETED, if any
     */
    public Optional<String> firstUnmetDependency(String name) {
        Task task = tasks.get(name);
        if (task == null) {
            return Optional.empty();
        }
        return task.getDependencies().stream()
                .filter(dependency -> {
                    TaskResult result = results.get(dependency);
                    return result == null || result.getStatus() != TaskStatus.COMPLETED;
                })
                .findFirst();
    }
    
    /**
     * Store a result and sync the task's status to it
     */
    public void storeResult(TaskResult result) {
        results.put(result.getTaskName(), result);
        Task task = tasks.get(result.getTaskName());
        if (task != null) {
            task.setStatus(result.getStatus());
        }
    }
    
    /**
     * Mark a non-terminal task SKIPPED so its dependents stop waiting on it
     */
    public void markSkipped(String name, String reason) throws TaskNotFoundException {
        Task task = tasks.get(name);
        if (task == null) {
            throw new TaskNotFoundException(name);
        }
        if (!task.getStatus().isTerminal()) {
            TaskResult skipped = TaskResult.of(task.getId(), name, TaskStatus.SKIPPED, reason)
                    .withRetryCount(task.getRetryCount());
            storeResult(skipped);
        }
    }
    
    public Optional<TaskResult> getResult(String name) {
        return Optional.ofNullable(results.get(name));
    }
    
    /**
     * Stored results in topological order
     */
    public Map<String, TaskResult> results() {
        Map<String, TaskResult> ordered = new LinkedHashMap<>();
        for (String name : taskOrder) {
            TaskResult result = results.get(name);
            if (result != null) {
                ordered.put(name, result);
            }
        }
        return ordered;
    }
    
    public boolean isComplete() {
        return tasks.values().stream().allMatch(task -> task.getStatus().isTerminal());
    }
    
    /**
     * Whether a task FAILED or TIMED_OUT and the workflow does not continue on failure
     */
    public boolean hasFailed() {
        return !config.isContinueOnFailure() && hasFailedTasks();
    }
    
    public boolean hasFailedTasks() {
        return tasks.values().stream().anyMatch(task -> task.getStatus().isFailure());
    }
    
    public List<String> failedTaskNames() {
        return taskOrder.stream()
                .filter(name -> tasks.get(name).getStatus().isFailure())
                .collect(Collectors.toList());
    }
    
    /**
     * Fraction of tasks that COMPLETED or were SKIPPED, 1.0 for an empty workflow
     */
    public double progress() {
        if (tasks.isEmpty()) {
            return 1.0;
        }
        long done = tasks.values().stream()
                .filter(task -> task.getStatus() == TaskStatus.COMPLETED || task.getStatus() == TaskStatus.SKIPPED)
                .count();
        return (double) done / tasks.size();
    }
    
    public Map<TaskStatus, Long> statusCounts() {
        Map<TaskStatus, Long> counts = new HashMap<>();
        tasks.values().forEach(task -> counts.merge(task.getStatus(), 1L, Long::sum));
        return counts;
    }
    
    public void setStatus(WorkflowStatus status) {
        this.status = status;
        if (status == WorkflowStatus.RUNNING && startedAt == null) {
            startedAt = Instant.now();
        }
        if (status.isTerminal()) {
            completedAt = Instant.now();
        }
    }
    
    @Override
    public String toString() {
        return "Workflow{" +
                "id=" + id +
                ", name='" + getName() + '\'' +
                ", status=" + status +
                ", tasks=" + tasks.size() +
                '}';
    }
    
    /**
     * Fluent builder for {@link Workflow}
     */
    public static class Builder {
        private final String name;
        private String description;
        private String version = WorkflowConfig.DEFAULT_VERSION;
        private Duration timeout = WorkflowConfig.DEFAULT_TIMEOUT;
        private boolean parallelExecution = true;
        private int maxConcurrentTasks = WorkflowConfig.DEFAULT_MAX_CONCURRENT_TASKS;
        private boolean enableCheckpoints = true;
        private boolean continueOnFailure = false;
        private final List<String> tags = new ArrayList<>();
        private JsonNode metadata;
        private final List<Task> tasks = new ArrayList<>();
        
        private Builder(String name) {
            this.name = name;
        }
        
        public Builder description(String description) {
            this.description = description;
            return this;
        }
        
        public Builder version(String version) {
            this.version = version;
            return this;
        }
        
        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }
        
        public Builder parallel(boolean parallelExecution) {
            this.parallelExecution = parallelExecution;
            return this;
        }
        
        public Builder maxConcurrentTasks(int maxConcurrentTasks) {
            this.maxConcurrentTasks = maxConcurrentTasks;
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
        
        public Builder tag(String tag) {
            this.tags.add(tag);
            return this;
        }
        
        public Builder metadata(JsonNode metadata) {
            this.metadata = metadata;
            return this;
        }
        
        public Builder task(Task task) {
            this.tasks.add(task);
            return this;
        }
        
        /**
         * Build the workflow.
         *
         * @throws WorkflowException if no task was added or the dependencies form a cycle
         * @throws IllegalArgumentException on an invalid setting or a duplicate task name
         */
        public Workflow build() throws WorkflowException {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Workflow name cannot be blank");
            }
            if (maxConcurrentTasks <= 0) {
                throw new IllegalArgumentException("Max concurrent tasks must be positive");
            }
            if (timeout == null || timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("Timeout must be positive");
            }
            WorkflowConfig config = new WorkflowConfig(name, description, version, timeout,
                    parallelExecution, maxConcurrentTasks, enableCheckpoints, continueOnFailure,
                    tags, metadata);
            Workflow workflow = new Workflow(config);
            for (Task task : tasks) {
                workflow.addTask(task);
            }
            workflow.validate();
            return workflow;
        }
    }
}
