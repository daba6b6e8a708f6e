package com.enterprise.orchestration.core;

import java.time.Instant;
import java.util.Map;

/**
 * Statistics about the orchestrator
 */
public interface OrchestratorStatistics {

    /**
     * Total number of workflows created
     */
    long getTotalWorkflowsCreated();

    /**
     * Total number of tasks handed to an agent
     */
    long getTotalTasksDispatched();

    /**
     * Total number of tasks completed successfully
     */
    long getTotalTasksCompleted();

    /**
     * Total number of tasks failed
     */
    long getTotalTasksFailed();

    /**
     * Average gateway call time in milliseconds
     */
    double getAverageExecutionTimeMs();

    /**
     * Orchestrator uptime in milliseconds, zero before start
     */
    long getUptimeMs();

    /**
     * When the orchestrator was started, null before start
     */
    Instant getStartedAt();

    Map<TaskStatus, Long> getTaskCountsByStatus();

    int getQueueSize();

    int getActiveThreadCount();
}
