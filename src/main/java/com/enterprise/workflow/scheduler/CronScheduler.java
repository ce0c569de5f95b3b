package com.enterprise.workflow.scheduler;

import com.enterprise.workflow.exception.JobNotFoundException;
import com.enterprise.workflow.exception.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Registry of cron-scheduled workflow jobs.
 * <p>
 * The scheduler only tracks when each job is due; a host, or a
 * {@link ScheduledWorkflowRunner}, polls {@link #getDueJobs()}, runs the
 * workflows and reports back through {@link #recordExecution(UUID)}.
 */
public class CronScheduler {
    
    private static final Logger logger = LoggerFactory.getLogger(CronScheduler.class);
    
    private final Map<UUID, ScheduledJob> jobs = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Clock clock;
    
    public CronScheduler() {
        this(Clock.systemUTC());
    }
    
    public CronScheduler(Clock clock) {
        this.clock = clock;
    }
    
    /**
     * Schedule a workflow
     *
     * @throws SchedulerException if the schedule is invalid or a job with the same name exists
     */
    public UUID schedule(String name, UUID workflowId, ScheduleConfig config) throws SchedulerException {
        ScheduledJob job = new ScheduledJob(name, workflowId, config, clock.instant());
        
        lock.writeLock().lock();
        try {
            boolean duplicate = jobs.values().stream().anyMatch(existing -> existing.getName().equals(name));
            if (duplicate) {
                throw SchedulerException.conflict("a job named '" + name + "' is already scheduled");
            }
            jobs.put(job.getId(), job);
        } finally {
            lock.writeLock().unlock();
        }
        
        logger.info("Scheduled job {} ({}) with expression '{}', next run {}",
                   name, job.getId(), config.getCron(), job.getNextRun());
        return job.getId();
    }
    
    /**
     * Schedule a workflow with a cron expression and otherwise default settings
     */
    public UUID scheduleCron(String name, UUID workflowId, String cron) throws SchedulerException {
        return schedule(name, workflowId, ScheduleConfig.cron(cron));
    }
    
    public Optional<ScheduledJob> unschedule(UUID jobId) {
        ScheduledJob removed;
        lock.writeLock().lock();
        try {
            removed = jobs.remove(jobId);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            logger.info("Unscheduled job {} ({})", removed.getName(), jobId);
        }
        return Optional.ofNullable(removed);
    }
    
    public Optional<ScheduledJob> getJob(UUID jobId) {
        lock.readLock().lock();
        try {
            ScheduledJob job = jobs.get(jobId);
            return job != null ? Optional.of(job.copy()) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public List<ScheduledJob> listJobs() {
        lock.readLock().lock();
        try {
            return jobs.values().stream()
                .sorted(Comparator.comparing(ScheduledJob::getCreatedAt))
                .map(ScheduledJob::copy)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Jobs that are enabled and whose next run is not in the future
     */
    public List<ScheduledJob> getDueJobs() {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            return jobs.values().stream()
                .filter(job -> job.shouldRun(now))
                .sorted(Comparator.comparing(ScheduledJob::getNextRun))
                .map(ScheduledJob::copy)
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public boolean pause(UUID jobId) {
        lock.writeLock().lock();
        try {
            ScheduledJob job = jobs.get(jobId);
            if (job == null) {
                return false;
            }
            job.setEnabled(false);
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Paused job {}", jobId);
        return true;
    }
    
    /**
     * Enable a job and recompute its next run from now
     */
    public boolean resume(UUID jobId) {
        lock.writeLock().lock();
        try {
            ScheduledJob job = jobs.get(jobId);
            if (job == null) {
                return false;
            }
            job.setEnabled(true);
            job.computeNextRun(clock.instant());
        } finally {
            lock.writeLock().unlock();
        }
        logger.info("Resumed job {}", jobId);
        return true;
    }
    
    /**
     * Record that a job's workflow was triggered now
     *
     * @throws JobNotFoundException if no such job is scheduled
     */
    public void recordExecution(UUID jobId) throws JobNotFoundException {
        lock.writeLock().lock();
        try {
            ScheduledJob job = jobs.get(jobId);
            if (job == null) {
                throw new JobNotFoundException(jobId);
            }
            job.recordRun(clock.instant());
            logger.debug("Recorded run {} of job {}, next run {}", job.getRunCount(), job.getName(), job.getNextRun());
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    public void start() {
        if (running.compareAndSet(false, true)) {
            logger.info("CronScheduler started");
        }
    }
    
    public void stop() {
        if (running.compareAndSet(true, false)) {
            logger.info("CronScheduler stopped");
        }
    }
    
    public boolean isRunning() {
        return running.get();
    }
    
    public Clock getClock() {
        return clock;
    }
}
