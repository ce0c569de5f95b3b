package com.enterprise.workflow.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates workflow engine configuration
 */
public class ConfigValidator {
    
    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(ExecutionConfig config) {
        List<ValidationError> errors = new ArrayList<>();
        
        validateEngineSettings(config, errors);
        
        if (config.getExecutorConfig() == null) {
            errors.add(new ValidationError("executor", "Executor configuration is required"));
        } else {
            validateExecutorConfig(config.getExecutorConfig(), errors);
        }
        
        if (config.getSchedulerConfig() == null) {
            errors.add(new ValidationError("scheduler", "Scheduler configuration is required"));
        } else {
            requirePositive(config.getSchedulerConfig().getTickInterval(), "scheduler.tickInterval",
                    "Tick interval", errors);
        }
        
        if (config.getMonitoringConfig() == null) {
            errors.add(new ValidationError("monitoring", "Monitoring configuration is required"));
        }
        
        return errors;
    }
    
    private void validateEngineSettings(ExecutionConfig config, List<ValidationError> errors) {
        if (config.getMaxConcurrentTasks() <= 0) {
            errors.add(new ValidationError("maxConcurrentTasks",
                "Max concurrent tasks must be greater than 0"));
        }
        
        requirePositive(config.getTaskTimeout(), "taskTimeout", "Task timeout", errors);
        requirePositive(config.getWorkflowTimeout(), "workflowTimeout", "Workflow timeout", errors);
        requirePositive(config.getPollInterval(), "pollInterval", "Poll interval", errors);
    }
    
    private void validateExecutorConfig(ExecutionConfig.ExecutorConfig config, List<ValidationError> errors) {
        if (config.getKeepAliveTime() == null || config.getKeepAliveTime().isNegative()) {
            errors.add(new ValidationError("executor.keepAliveTime",
                "Keep alive time cannot be negative"));
        }
        
        if (config.getShutdownTimeout() == null || config.getShutdownTimeout().isNegative()) {
            errors.add(new ValidationError("executor.shutdownTimeout",
                "Shutdown timeout cannot be negative"));
        }
    }
    
    private void requirePositive(Duration value, String field, String label, List<ValidationError> errors) {
        if (value == null || value.isNegative() || value.isZero()) {
            errors.add(new ValidationError(field, label + " must be greater than 0"));
        }
    }
    
    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;
        
        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }
        
        public String getField() { return field; }
        public String getMessage() { return message; }
        
        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
