package com.enterprise.orchestration;

import com.enterprise.orchestration.agent.AgentRegistry;
import com.enterprise.orchestration.agent.DefaultAgents;
import com.enterprise.orchestration.config.ConfigValidator;
import com.enterprise.orchestration.config.OrchestratorConfig;
import com.enterprise.orchestration.core.AsyncTaskExecutor;
import com.enterprise.orchestration.core.Orchestrator;
import com.enterprise.orchestration.core.OrchestratorImpl;
import com.enterprise.orchestration.gateway.HttpTaskExecutorGateway;
import com.enterprise.orchestration.gateway.TaskExecutorGateway;
import com.enterprise.orchestration.monitoring.MetricsCollector;
import com.enterprise.orchestration.queue.TaskQueue;
import com.enterprise.orchestration.store.MapDBTaskJournal;
import com.enterprise.orchestration.store.TaskJournal;
import com.enterprise.orchestration.store.TaskStore;
import com.enterprise.orchestration.workflow.WorkflowHistory;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Factory for creating and configuring the orchestrator
 */
public class OrchestratorFactory {

    private static final Logger logger = LoggerFactory.getLogger(OrchestratorFactory.class);

    /**
     * Create an orchestrator with default configuration, the HTTP gateway and the default agents
     */
    public static Orchestrator createDefault() {
        return create(OrchestratorConfig.builder().build());
    }

    /**
     * Create an orchestrator that calls the task executor service over HTTP
     */
    public static Orchestrator create(OrchestratorConfig config) {
        validate(config);
        OrchestratorConfig.GatewayConfig gatewayConfig = config.getGatewayConfig();
        TaskExecutorGateway gateway = new HttpTaskExecutorGateway(
            gatewayConfig.getBaseUrl(),
            gatewayConfig.getCallPath(),
            gatewayConfig.getRequestTimeout(),
            gatewayConfig.getConnectTimeout()
        );
        return create(config, gateway);
    }

    /**
     * Create an orchestrator with a custom gateway
     */
    public static Orchestrator create(OrchestratorConfig config, TaskExecutorGateway gateway) {
        return create(config, gateway, new SimpleMeterRegistry());
    }

    /**
     * Create an orchestrator with a custom gateway, publishing metrics to the given registry
     */
    public static Orchestrator create(OrchestratorConfig config, TaskExecutorGateway gateway,
                                      MeterRegistry meterRegistry) {
        validate(config);
        logger.info("Creating Orchestrator with configuration: {}", config);

        TaskJournal journal = null;
        try {
            journal = createJournal(config.getJournalConfig());
            TaskStore taskStore = new TaskStore(journal);
            WorkflowHistory history = new WorkflowHistory(journal);
            TaskQueue taskQueue = new TaskQueue();

            AgentRegistry agentRegistry = new AgentRegistry();
            DefaultAgents.roster().forEach(agentRegistry::register);

            AsyncTaskExecutor executor = createExecutor(config.getExecutorConfig(), gateway,
                config.getGatewayConfig().getRequestTimeout().toMillis());

            MetricsCollector metricsCollector = config.getMonitoringConfig().isEnableMetrics()
                ? new MetricsCollector(meterRegistry)
                : null;

            Orchestrator orchestrator = new OrchestratorImpl(
                taskStore,
                taskQueue,
                agentRegistry,
                history,
                executor,
                config.getSchedulerConfig(),
                config.getExecutorConfig().getShutdownTimeout(),
                metricsCollector,
                config.getMonitoringConfig().isEnableHealthChecks()
            );

            logger.info("Orchestrator created successfully");
            return orchestrator;

        } catch (Exception e) {
            logger.error("Failed to create Orchestrator", e);
            if (journal != null) {
                journal.close();
            }
            throw new RuntimeException("Failed to create Orchestrator", e);
        }
    }

    private static void validate(OrchestratorConfig config) {
        ConfigValidator validator = new ConfigValidator();
        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }
    }

    private static TaskJournal createJournal(OrchestratorConfig.JournalConfig config) {
        if (!config.isEnabled()) {
            return null;
        }
        return new MapDBTaskJournal(config.getDbPath());
    }

    private static AsyncTaskExecutor createExecutor(OrchestratorConfig.ExecutorConfig config,
                                                    TaskExecutorGateway gateway, long timeoutMs) {
        BlockingQueue<Runnable> workQueue = new LinkedBlockingQueue<>(config.getQueueCapacity());

        return new AsyncTaskExecutor(
            gateway,
            timeoutMs,
            config.getCorePoolSize(),
            config.getMaximumPoolSize(),
            config.getKeepAliveTime().toMillis(),
            TimeUnit.MILLISECONDS,
            workQueue
        );
    }
}
