package com.enterprise.orchestration.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Immutable, serializable view of a task at one instant.
 * Returned by status queries and written to the task journal.
 */
public class TaskSnapshot {

    private final String taskId;
    private final String workflowId;
    private final TaskType taskType;
    private final int priority;
    private final TaskStatus status;
    private final Map<String, Object> parameters;
    private final String assignedAgent;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final Map<String, Object> result;
    private final String errorMessage;
    private final String blockedReason;
    private final List<String> waitingOn;
    private final List<String> pendingParameters;
    private final int dispatchAttempts;

    @JsonCreator
    public TaskSnapshot(@JsonProperty("taskId") String taskId,
                        @JsonProperty("workflowId") String workflowId,
                        @JsonProperty("taskType") TaskType taskType,
                        @JsonProperty("priority") int priority,
                        @JsonProperty("status") TaskStatus status,
                        @JsonProperty("parameters") Map<String, Object> parameters,
                        @JsonProperty("assignedAgent") String assignedAgent,
                        @JsonProperty("createdAt") Instant createdAt,
                        @JsonProperty("startedAt") Instant startedAt,
                        @JsonProperty("completedAt") Instant completedAt,
                        @JsonProperty("result") Map<String, Object> result,
                        @JsonProperty("errorMessage") String errorMessage,
                        @JsonProperty("blockedReason") String blockedReason,
                        @JsonProperty("waitingOn") List<String> waitingOn,
                        @JsonProperty("pendingParameters") List<String> pendingParameters,
                        @JsonProperty("dispatchAttempts") int dispatchAttempts) {
        this.taskId = taskId;
        this.workflowId = workflowId;
        this.taskType = taskType;
        this.priority = priority;
        this.status = status;
        this.parameters = parameters != null ? Collections.unmodifiableMap(parameters) : Map.of();
        this.assignedAgent = assignedAgent;
        this.createdAt = createdAt;
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.result = result;
        this.errorMessage = errorMessage;
        this.blockedReason = blockedReason;
        this.waitingOn = waitingOn != null ? List.copyOf(waitingOn) : List.of();
        this.pendingParameters = pendingParameters != null ? List.copyOf(pendingParameters) : List.of();
        this.dispatchAttempts = dispatchAttempts;
    }

    public String getTaskId() { return taskId; }
    public String getWorkflowId() { return workflowId; }
    public TaskType getTaskType() { return taskType; }
    public int getPriority() { return priority; }
    public TaskStatus getStatus() { return status; }
    public Map<String, Object> getParameters() { return parameters; }
    public String getAssignedAgent() { return assignedAgent; }
    public Instant getCreatedAt() { return createdAt; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public Map<String, Object> getResult() { return result; }
    public String getErrorMessage() { return errorMessage; }
    public String getBlockedReason() { return blockedReason; }

    /**
     * Upstream task ids this task is still waiting on
     */
    public List<String> getWaitingOn() { return waitingOn; }

    /**
     * Parameters that will be filled in from upstream results
     */
    public List<String> getPendingParameters() { return pendingParameters; }

    public int getDispatchAttempts() { return dispatchAttempts; }

    @Override
    public String toString() {
        return "TaskSnapshot{" +
                "taskId='" + taskId + '\'' +
                ", taskType=" + taskType +
                ", status=" + status +
                ", assignedAgent='" + assignedAgent + '\'' +
                '}';
    }
}
