package com.enterprise.orchestration.config;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates orchestrator configuration
 */
public class ConfigValidator {

    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(OrchestratorConfig config) {
        List<ValidationError> errors = new ArrayList<>();

        validateExecutorConfig(config.getExecutorConfig(), errors);
        validateSchedulerConfig(config.getSchedulerConfig(), errors);
        validateGatewayConfig(config.getGatewayConfig(), errors);
        validateJournalConfig(config.getJournalConfig(), errors);

        return errors;
    }

    private void validateExecutorConfig(OrchestratorConfig.ExecutorConfig config, List<ValidationError> errors) {
        if (config.getCorePoolSize() <= 0) {
            errors.add(new ValidationError("executor.corePoolSize",
                "Core pool size must be greater than 0"));
        }

        if (config.getMaximumPoolSize() <= 0) {
            errors.add(new ValidationError("executor.maximumPoolSize",
                "Maximum pool size must be greater than 0"));
        }

        if (config.getCorePoolSize() > config.getMaximumPoolSize()) {
            errors.add(new ValidationError("executor.poolSize",
                "Core pool size cannot be greater than maximum pool size"));
        }

        if (config.getKeepAliveTime().isNegative()) {
            errors.add(new ValidationError("executor.keepAliveTime",
                "Keep alive time cannot be negative"));
        }

        if (config.getQueueCapacity() <= 0) {
            errors.add(new ValidationError("executor.queueCapacity",
                "Queue capacity must be greater than 0"));
        }

        if (config.getShutdownTimeout().isNegative()) {
            errors.add(new ValidationError("executor.shutdownTimeout",
                "Shutdown timeout cannot be negative"));
        }
    }

    private void validateSchedulerConfig(OrchestratorConfig.SchedulerConfig config, List<ValidationError> errors) {
        if (config.getTickInterval().isZero() || config.getTickInterval().isNegative()) {
            errors.add(new ValidationError("scheduler.tickInterval",
                "Tick interval must be positive"));
        }

        if (config.getHeartbeatInterval().isZero() || config.getHeartbeatInterval().isNegative()) {
            errors.add(new ValidationError("scheduler.heartbeatInterval",
                "Heartbeat interval must be positive"));
        }

        if (config.getMaxDispatchesPerTick() <= 0) {
            errors.add(new ValidationError("scheduler.maxDispatchesPerTick",
                "Max dispatches per tick must be greater than 0"));
        }

        if (config.getNoAgentWarningInterval() <= 0) {
            errors.add(new ValidationError("scheduler.noAgentWarningInterval",
                "No-agent warning interval must be greater than 0"));
        }
    }

    private void validateGatewayConfig(OrchestratorConfig.GatewayConfig config, List<ValidationError> errors) {
        if (config.getBaseUrl() == null || config.getBaseUrl().trim().isEmpty()) {
            errors.add(new ValidationError("gateway.baseUrl",
                "Base URL is required"));
        } else {
            try {
                URI uri = URI.create(config.getBaseUrl());
                if (uri.getScheme() == null || uri.getHost() == null) {
                    errors.add(new ValidationError("gateway.baseUrl",
                        "Base URL must be absolute: " + config.getBaseUrl()));
                }
            } catch (IllegalArgumentException e) {
                errors.add(new ValidationError("gateway.baseUrl",
                    "Base URL is malformed: " + e.getMessage()));
            }
        }

        if (config.getCallPath() == null || !config.getCallPath().startsWith("/")) {
            errors.add(new ValidationError("gateway.callPath",
                "Call path must start with '/'"));
        }

        if (config.getRequestTimeout().isZero() || config.getRequestTimeout().isNegative()) {
            errors.add(new ValidationError("gateway.requestTimeout",
                "Request timeout must be positive"));
        }

        if (config.getConnectTimeout().isZero() || config.getConnectTimeout().isNegative()) {
            errors.add(new ValidationError("gateway.connectTimeout",
                "Connect timeout must be positive"));
        }
    }

    private void validateJournalConfig(OrchestratorConfig.JournalConfig config, List<ValidationError> errors) {
        if (config.isEnabled() && (config.getDbPath() == null || config.getDbPath().trim().isEmpty())) {
            errors.add(new ValidationError("journal.dbPath",
                "Database path is required when the journal is enabled"));
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
