package com.enterprise.workflow.scheduler;

import java.time.Instant;
import java.util.Objects;

/**
 * Schedule of a job: cron expression, zone and run window
 */
public final class ScheduleConfig {
    
    public static final String DEFAULT_CRON = "0 * * * *";
    public static final String DEFAULT_TIMEZONE = "UTC";
    
    private final String cron;
    private final String timezone;
    private final boolean enabled;
    private final Instant startDate;
    private final Instant endDate;
    private final Integer maxRuns;
    private final boolean catchUp;
    
    private ScheduleConfig(String cron, String timezone, boolean enabled, Instant startDate,
                           Instant endDate, Integer maxRuns, boolean catchUp) {
        this.cron = Objects.requireNonNull(cron, "Cron expression cannot be null");
        this.timezone = Objects.requireNonNull(timezone, "Timezone cannot be null");
        this.enabled = enabled;
        this.startDate = startDate;
        this.endDate = endDate;
        this.maxRuns = maxRuns;
        this.catchUp = catchUp;
    }
    
    public static ScheduleConfig defaults() {
        return builder().build();
    }
    
    public static ScheduleConfig cron(String cron) {
        return builder().cron(cron).build();
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    public String getCron() { return cron; }
    
    /**
     * Zone id the cron fields are evaluated in
     */
    public String getTimezone() { return timezone; }
    
    public boolean isEnabled() { return enabled; }
    
    /**
     * No run is scheduled before this instant, if set
     */
    public Instant getStartDate() { return startDate; }
    
    /**
     * No run is scheduled after this instant, if set
     */
    public Instant getEndDate() { return endDate; }
    
    public Integer getMaxRuns() { return maxRuns; }
    
    /**
     * Stored only; missed runs are never replayed
     */
    public boolean isCatchUp() { return catchUp; }
    
    public ScheduleConfig withEnabled(boolean enabled) {
        return new ScheduleConfig(cron, timezone, enabled, startDate, endDate, maxRuns, catchUp);
    }
    
    @Override
    public String toString() {
        return "ScheduleConfig{" +
                "cron='" + cron + '\'' +
                ", timezone='" + timezone + '\'' +
                ", enabled=" + enabled +
                ", maxRuns=" + maxRuns +
                '}';
    }
    
    public static class Builder {
        private String cron = DEFAULT_CRON;
        private String timezone = DEFAULT_TIMEZONE;
        private boolean enabled = true;
        private Instant startDate;
        private Instant endDate;
        private Integer maxRuns;
        private boolean catchUp = false;
        
        public Builder cron(String cron) {
            this.cron = cron;
            return this;
        }
        
        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }
        
        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }
        
        public Builder startDate(Instant startDate) {
            this.startDate = startDate;
            return this;
        }
        
        public Builder endDate(Instant endDate) {
            this.endDate = endDate;
            return this;
        }
        
        public Builder maxRuns(Integer maxRuns) {
            this.maxRuns = maxRuns;
            return this;
        }
        
        public Builder catchUp(boolean catchUp) {
            this.catchUp = catchUp;
            return this;
        }
        
        public ScheduleConfig build() {
            return new ScheduleConfig(cron, timezone, enabled, startDate, endDate, maxRuns, catchUp);
        }
    }
}
