package com.enterprise.workflow.scheduler;

import com.enterprise.workflow.exception.SchedulerException;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * A workflow scheduled on a cron expression.
 * <p>
 * Not thread-safe; {@link CronScheduler} guards live jobs and hands out copies.
 */
public class ScheduledJob {
    
    /**
     * How far ahead {@link #computeNextRun(Instant)} looks for a matching minute
     */
    static final Duration LOOKAHEAD = Duration.ofHours(24);
    
    private final UUID id;
    private final String name;
    private final UUID workflowId;
    private ScheduleConfig config;
    private final CronExpression cron;
    private final ZoneId zone;
    private int runCount;
    private Instant lastRun;
    private Instant nextRun;
    private final Instant createdAt;
    
    /**
     * Create a job and compute its first run from {@code now}
     *
     * @throws SchedulerException if the cron expression or the timezone is invalid
     */
    public ScheduledJob(String name, UUID workflowId, ScheduleConfig config, Instant now) throws SchedulerException {
        this.id = UUID.randomUUID();
        this.name = name;
        this.workflowId = workflowId;
        this.config = config;
        this.cron = CronExpression.parse(config.getCron());
        try {
            this.zone = ZoneId.of(config.getTimezone());
        } catch (DateTimeException e) {
            throw new SchedulerException(SchedulerException.Kind.INVALID_CRON,
                    "Invalid timezone: " + config.getTimezone());
        }
        this.createdAt = now;
        computeNextRun(now);
    }
    
    private ScheduledJob(ScheduledJob other) {
        this.id = other.id;
        this.name = other.name;
        this.workflowId = other.workflowId;
        this.config = other.config;
        this.cron = other.cron;
        this.zone = other.zone;
        this.runCount = other.runCount;
        this.lastRun = other.lastRun;
        this.nextRun = other.nextRun;
        this.createdAt = other.createdAt;
    }
    
    /**
     * Detached snapshot of this job
     */
    public ScheduledJob copy() {
        return new ScheduledJob(this);
    }
    
    /**
     * Find the first matching minute after the later of {@code now} and the last run,
     * not before the start date, within the next 24 hours. Clears the next run when
     * none is found, the match falls after the end date or max runs is reached.
     */
    public void computeNextRun(Instant now) {
        Instant base = lastRun != null && lastRun.isAfter(now) ? lastRun : now;
        Instant candidate = base.truncatedTo(ChronoUnit.MINUTES).plus(1, ChronoUnit.MINUTES);
        Instant startDate = config.getStartDate();
        if (startDate != null && candidate.isBefore(startDate)) {
            Instant truncated = startDate.truncatedTo(ChronoUnit.MINUTES);
            candidate = truncated.equals(startDate) ? startDate : truncated.plus(1, ChronoUnit.MINUTES);
        }
        
        nextRun = null;
        if (config.getMaxRuns() != null && runCount >= config.getMaxRuns()) {
            return;
        }
        
        long minutes = LOOKAHEAD.toMinutes();
        for (long i = 0; i < minutes; i++) {
            Instant check = candidate.plus(i, ChronoUnit.MINUTES);
            if (cron.matches(ZonedDateTime.ofInstant(check, zone))) {
                if (config.getEndDate() == null || !check.isAfter(config.getEndDate())) {
                    nextRun = check;
                }
                return;
            }
        }
    }
    
    /**
     * Count a run at {@code now} and advance the next run
     */
    public void recordRun(Instant now) {
        runCount++;
        lastRun = now;
        computeNextRun(now);
    }
    
    public boolean shouldRun(Instant now) {
        return config.isEnabled() && nextRun != null && !now.isBefore(nextRun);
    }
    
    void setEnabled(boolean enabled) {
        this.config = config.withEnabled(enabled);
    }
    
    public UUID getId() { return id; }
    
    public String getName() { return name; }
    
    public UUID getWorkflowId() { return workflowId; }
    
    public ScheduleConfig getConfig() { return config; }
    
    public CronExpression getCron() { return cron; }
    
    public ZoneId getZone() { return zone; }
    
    public int getRunCount() { return runCount; }
    
    public Instant getLastRun() { return lastRun; }
    
    public Instant getNextRun() { return nextRun; }
    
    public Instant getCreatedAt() { return createdAt; }
    
    @Override
    public String toString() {
        return "ScheduledJob{" +
                "id=" + id +
                ", name='" + name + '\'' +
                ", cron='" + cron + '\'' +
                ", runCount=" + runCount +
                ", nextRun=" + nextRun +
                '}';
    }
}
