package com.enterprise.orchestration.monitoring;

import com.enterprise.orchestration.agent.AgentStatusReport;
import com.enterprise.orchestration.core.Orchestrator;
import com.enterprise.orchestration.core.OrchestratorStatistics;
import com.enterprise.orchestration.core.QueueStatusReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Health checker for the orchestrator
 */
public class HealthChecker {

    private static final Logger logger = LoggerFactory.getLogger(HealthChecker.class);

    static final int DEFAULT_QUEUE_THRESHOLD = 10000;

    private final Orchestrator orchestrator;
    private final int queueThreshold;

    public HealthChecker(Orchestrator orchestrator, int queueThreshold) {
        this.orchestrator = orchestrator;
        this.queueThreshold = queueThreshold;
    }

    public HealthChecker(Orchestrator orchestrator) {
        this(orchestrator, DEFAULT_QUEUE_THRESHOLD);
    }

    /**
     * Perform a comprehensive health check
     */
    public CompletableFuture<HealthStatus> performHealthCheck() {
        return CompletableFuture.supplyAsync(() -> {
            HealthStatus.Builder builder = HealthStatus.builder();

            checkOrchestratorStatus(builder);
            checkQueueHealth(builder);
            checkAgents(builder);
            checkSystemResources(builder);

            HealthStatus status = builder.build();
            if (!status.isHealthy()) {
                logger.warn("Health check failed: {}", status.getFailedChecks());
            }
            return status;
        });
    }

    private void checkOrchestratorStatus(HealthStatus.Builder builder) {
        try {
            boolean isRunning = orchestrator.isRunning();
            builder.addCheck("orchestrator.running", isRunning,
                isRunning ? "Orchestrator is running" : "Orchestrator is not running");

            if (isRunning) {
                OrchestratorStatistics stats = orchestrator.getStatistics();
                builder.addCheck("orchestrator.uptime", stats.getUptimeMs() >= 0,
                    String.format("Orchestrator uptime: %dms", stats.getUptimeMs()));
            }
        } catch (Exception e) {
            builder.addCheck("orchestrator.status", false, "Error checking orchestrator status: " + e.getMessage());
        }
    }

    private void checkQueueHealth(HealthStatus.Builder builder) {
        try {
            QueueStatusReport queue = orchestrator.getTaskQueueStatus();
            boolean queueHealthy = queue.getQueued() < queueThreshold;
            builder.addCheck("queue.healthy", queueHealthy,
                String.format("Queue size %d (%d parked) is %s", queue.getQueued(), queue.getParked(),
                    queueHealthy ? "healthy" : "too large"));
        } catch (Exception e) {
            builder.addCheck("queue.status", false, "Error checking queue status: " + e.getMessage());
        }
    }

    private void checkAgents(HealthStatus.Builder builder) {
        try {
            AgentStatusReport agents = orchestrator.getAgentStatus();
            int reachable = agents.getTotalAgents() - agents.getOfflineAgents();
            builder.addCheck("agents.reachable", reachable > 0,
                String.format("Agents: %d available, %d busy, %d offline",
                    agents.getAvailableAgents(), agents.getBusyAgents(), agents.getOfflineAgents()));
        } catch (Exception e) {
            builder.addCheck("agents.status", false, "Error checking agents: " + e.getMessage());
        }
    }

    private void checkSystemResources(HealthStatus.Builder builder) {
        try {
            Runtime runtime = Runtime.getRuntime();
            long totalMemory = runtime.totalMemory();
            long freeMemory = runtime.freeMemory();
            long usedMemory = totalMemory - freeMemory;
            double memoryUsagePercent = (double) usedMemory / totalMemory * 100;

            boolean memoryHealthy = memoryUsagePercent < 90;
            builder.addCheck("system.memory", memoryHealthy,
                String.format("Memory usage: %.2f%% (%d/%d MB)",
                    memoryUsagePercent, usedMemory / 1024 / 1024, totalMemory / 1024 / 1024));
        } catch (Exception e) {
            builder.addCheck("system.resources", false, "Error checking system resources: " + e.getMessage());
        }
    }

    /**
     * Health status result
     */
    public static class HealthStatus {
        private final boolean healthy;
        private final Map<String, CheckResult> checks;
        private final Instant timestamp;

        private HealthStatus(boolean healthy, Map<String, CheckResult> checks, Instant timestamp) {
            this.healthy = healthy;
            this.checks = checks;
            this.timestamp = timestamp;
        }

        public boolean isHealthy() { return healthy; }
        public Map<String, CheckResult> getChecks() { return checks; }
        public Instant getTimestamp() { return timestamp; }

        public java.util.List<String> getFailedChecks() {
            return checks.entrySet().stream()
                .filter(entry -> !entry.getValue().isPassed())
                .map(entry -> entry.getKey() + ": " + entry.getValue().getMessage())
                .sorted()
                .collect(java.util.stream.Collectors.toList());
        }

        public static class CheckResult {
            private final boolean passed;
            private final String message;

            public CheckResult(boolean passed, String message) {
                this.passed = passed;
                this.message = message;
            }

            public boolean isPassed() { return passed; }
            public String getMessage() { return message; }
        }

        public static class Builder {
            private final Map<String, CheckResult> checks = new ConcurrentHashMap<>();

            public Builder addCheck(String name, boolean passed, String message) {
                checks.put(name, new CheckResult(passed, message));
                return this;
            }

            public HealthStatus build() {
                boolean healthy = checks.values().stream().allMatch(CheckResult::isPassed);
                return new HealthStatus(healthy, checks, Instant.now());
            }
        }

        public static Builder builder() {
            return new Builder();
        }
    }
}
