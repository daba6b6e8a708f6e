package com.enterprise.orchestration.core;

import com.enterprise.orchestration.agent.AgentDescriptor;
import com.enterprise.orchestration.agent.AgentStatusReport;
import com.enterprise.orchestration.exception.TaskNotFoundException;
import com.enterprise.orchestration.exception.UnknownWorkflowTypeException;
import com.enterprise.orchestration.exception.WorkflowNotFoundException;
import com.enterprise.orchestration.monitoring.HealthChecker;
import com.enterprise.orchestration.workflow.Workflow;
import com.enterprise.orchestration.workflow.WorkflowStatusReport;
import com.enterprise.orchestration.workflow.WorkflowTemplate;
import com.enterprise.orchestration.workflow.WorkflowType;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Main interface of the workflow orchestrator.
 * Accepts workflow requests, schedules their tasks onto agents and reports progress.
 */
public interface Orchestrator {

    /**
     * Create a workflow and enqueue its tasks
     *
     * @return the new workflow id
     * @throws UnknownWorkflowTypeException if the type is not registered; nothing is created
     */
    String createWorkflow(String workflowType, Map<String, Object> parameters, int priority)
        throws UnknownWorkflowTypeException;

    /**
     * Create a workflow of a built-in type
     */
    String createWorkflow(WorkflowType workflowType, Map<String, Object> parameters, int priority);

    /**
     * Derived status, task snapshots and progress of a workflow
     */
    WorkflowStatusReport getWorkflowStatus(String workflowId) throws WorkflowNotFoundException;

    /**
     * Every workflow created so far, oldest first
     */
    List<Workflow> getWorkflowHistory();

    TaskSnapshot getTask(String taskId) throws TaskNotFoundException;

    AgentStatusReport getAgentStatus();

    QueueStatusReport getTaskQueueStatus();

    void registerAgent(AgentDescriptor agent);

    void setAgentOnline(String agentId);

    /**
     * @throws IllegalStateException if the agent is executing a task
     */
    void setAgentOffline(String agentId);

    void registerWorkflowTemplate(WorkflowTemplate template);

    /**
     * Start the scheduler loop
     */
    void start();

    /**
     * Stop the scheduler loop and wait for dispatched tasks to finish
     */
    CompletableFuture<Void> stop();

    boolean isRunning();

    OrchestratorStatistics getStatistics();

    CompletableFuture<HealthChecker.HealthStatus> checkHealth();
}
