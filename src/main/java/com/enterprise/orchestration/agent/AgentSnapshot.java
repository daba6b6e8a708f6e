package com.enterprise.orchestration.agent;

import com.enterprise.orchestration.core.TaskType;

import java.time.Instant;
import java.util.Set;

/**
 * Point-in-time view of a registered agent
 */
public class AgentSnapshot {
    
    private final String agentId;
    private final String name;
    private final Set<TaskType> capabilities;
    private final AgentStatus status;
    private final String currentTask;
    private final double performanceScore;
    private final Instant lastHeartbeat;
    
    public AgentSnapshot(String agentId, String name, Set<TaskType> capabilities, AgentStatus status,
                         String currentTask, double performanceScore, Instant lastHeartbeat) {
        this.agentId = agentId;
        this.name = name;
        this.capabilities = capabilities;
        this.status = status;
        this.currentTask = currentTask;
        this.performanceScore = performanceScore;
        this.lastHeartbeat = lastHeartbeat;
    }
    
    public String getAgentId() { return agentId; }
    public String getName() { return name; }
    public Set<TaskType> getCapabilities() { return capabilities; }
    public AgentStatus getStatus() { return status; }
    public String getCurrentTask() { return currentTask; }
    public double getPerformanceScore() { return performanceScore; }
    public Instant getLastHeartbeat() { return lastHeartbeat; }
    
    @Override
    public String toString() {
        return "AgentSnapshot{" +
                "agentId='" + agentId + '\'' +
                ", status=" + status +
                ", currentTask='" + currentTask + '\'' +
                '}';
    }
}
