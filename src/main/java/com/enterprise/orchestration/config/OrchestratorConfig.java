package com.enterprise.orchestration.config;

import java.time.Duration;

/**
 * Configuration for the workflow orchestrator
 */
public class OrchestratorConfig {

    private final ExecutorConfig executorConfig;
    private final SchedulerConfig schedulerConfig;
    private final GatewayConfig gatewayConfig;
    private final JournalConfig journalConfig;
    private final MonitoringConfig monitoringConfig;

    public OrchestratorConfig(ExecutorConfig executorConfig, SchedulerConfig schedulerConfig,
                              GatewayConfig gatewayConfig, JournalConfig journalConfig,
                              MonitoringConfig monitoringConfig) {
        this.executorConfig = executorConfig;
        this.schedulerConfig = schedulerConfig;
        this.gatewayConfig = gatewayConfig;
        this.journalConfig = journalConfig;
        this.monitoringConfig = monitoringConfig;
    }

    public ExecutorConfig getExecutorConfig() { return executorConfig; }
    public SchedulerConfig getSchedulerConfig() { return schedulerConfig; }
    public GatewayConfig getGatewayConfig() { return gatewayConfig; }
    public JournalConfig getJournalConfig() { return journalConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }

    @Override
    public String toString() {
        return String.format("OrchestratorConfig{tick=%s, gateway=%s, journal=%s}",
            schedulerConfig.getTickInterval(), gatewayConfig.getBaseUrl(),
            journalConfig.isEnabled() ? journalConfig.getDbPath() : "disabled");
    }

    /**
     * Worker pool running dispatched gateway calls
     */
    public static class ExecutorConfig {
        private final int corePoolSize;
        private final int maximumPoolSize;
        private final Duration keepAliveTime;
        private final int queueCapacity;
        private final Duration shutdownTimeout;

        public ExecutorConfig(int corePoolSize, int maximumPoolSize, Duration keepAliveTime,
                            int queueCapacity, Duration shutdownTimeout) {
            this.corePoolSize = corePoolSize;
            this.maximumPoolSize = maximumPoolSize;
            this.keepAliveTime = keepAliveTime;
            this.queueCapacity = queueCapacity;
            this.shutdownTimeout = shutdownTimeout;
        }

        public int getCorePoolSize() { return corePoolSize; }
        public int getMaximumPoolSize() { return maximumPoolSize; }
        public Duration getKeepAliveTime() { return keepAliveTime; }
        public int getQueueCapacity() { return queueCapacity; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
    }

    /**
     * Scheduler loop timing
     */
    public static class SchedulerConfig {
        private final Duration tickInterval;
        private final Duration heartbeatInterval;
        private final int maxDispatchesPerTick;
        private final int noAgentWarningInterval;

        public SchedulerConfig(Duration tickInterval, Duration heartbeatInterval,
                               int maxDispatchesPerTick, int noAgentWarningInterval) {
            this.tickInterval = tickInterval;
            this.heartbeatInterval = heartbeatInterval;
            this.maxDispatchesPerTick = maxDispatchesPerTick;
            this.noAgentWarningInterval = noAgentWarningInterval;
        }

        public Duration getTickInterval() { return tickInterval; }
        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public int getMaxDispatchesPerTick() { return maxDispatchesPerTick; }
        public int getNoAgentWarningInterval() { return noAgentWarningInterval; }
    }

    /**
     * Remote task executor endpoint
     */
    public static class GatewayConfig {
        private final String baseUrl;
        private final String callPath;
        private final Duration requestTimeout;
        private final Duration connectTimeout;

        public GatewayConfig(String baseUrl, String callPath, Duration requestTimeout, Duration connectTimeout) {
            this.baseUrl = baseUrl;
            this.callPath = callPath;
            this.requestTimeout = requestTimeout;
            this.connectTimeout = connectTimeout;
        }

        public String getBaseUrl() { return baseUrl; }
        public String getCallPath() { return callPath; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public Duration getConnectTimeout() { return connectTimeout; }
    }

    /**
     * Durable task journal
     */
    public static class JournalConfig {
        private final boolean enabled;
        private final String dbPath;

        public JournalConfig(boolean enabled, String dbPath) {
            this.enabled = enabled;
            this.dbPath = dbPath;
        }

        public boolean isEnabled() { return enabled; }
        public String getDbPath() { return dbPath; }
    }

    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;
        private final boolean enableHealthChecks;

        public MonitoringConfig(boolean enableMetrics, boolean enableHealthChecks) {
            this.enableMetrics = enableMetrics;
            this.enableHealthChecks = enableHealthChecks;
        }

        public boolean isEnableMetrics() { return enableMetrics; }
        public boolean isEnableHealthChecks() { return enableHealthChecks; }
    }

    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private ExecutorConfig executorConfig = Defaults.defaultExecutorConfig();
        private SchedulerConfig schedulerConfig = Defaults.defaultSchedulerConfig();
        private GatewayConfig gatewayConfig = Defaults.defaultGatewayConfig();
        private JournalConfig journalConfig = Defaults.defaultJournalConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();

        public Builder executorConfig(ExecutorConfig executorConfig) {
            this.executorConfig = executorConfig;
            return this;
        }

        public Builder schedulerConfig(SchedulerConfig schedulerConfig) {
            this.schedulerConfig = schedulerConfig;
            return this;
        }

        public Builder gatewayConfig(GatewayConfig gatewayConfig) {
            this.gatewayConfig = gatewayConfig;
            return this;
        }

        public Builder journalConfig(JournalConfig journalConfig) {
            this.journalConfig = journalConfig;
            return this;
        }

        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }

        public OrchestratorConfig build() {
            return new OrchestratorConfig(executorConfig, schedulerConfig, gatewayConfig,
                                          journalConfig, monitoringConfig);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default configurations
     */
    public static class Defaults {
        public static ExecutorConfig defaultExecutorConfig() {
            return new ExecutorConfig(
                4, 16, Duration.ofMinutes(1), 1000, Duration.ofSeconds(30)
            );
        }

        public static SchedulerConfig defaultSchedulerConfig() {
            return new SchedulerConfig(
                Duration.ofSeconds(1), Duration.ofSeconds(1), 16, 30
            );
        }

        public static GatewayConfig defaultGatewayConfig() {
            return new GatewayConfig(
                "http://127.0.0.1:5000", "/call", Duration.ofSeconds(60), Duration.ofSeconds(10)
            );
        }

        public static JournalConfig defaultJournalConfig() {
            String tmpDir = System.getProperty("java.io.tmpdir");
            String uniqueName = java.util.UUID.randomUUID().toString();
            String path = tmpDir.endsWith("/") ? (tmpDir + "orchestrator-journal-" + uniqueName + ".db")
                                               : (tmpDir + "/orchestrator-journal-" + uniqueName + ".db");
            return new JournalConfig(false, path);
        }

        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(true, true);
        }
    }
}
