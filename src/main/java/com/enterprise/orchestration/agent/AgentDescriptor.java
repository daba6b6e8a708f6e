package com.enterprise.orchestration.agent;

import com.enterprise.orchestration.core.TaskType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of a worker agent, supplied at registration
 */
public class AgentDescriptor {
    
    private final String agentId;
    private final String name;
    private final Set<TaskType> capabilities;
    private final double performanceScore;
    
    public AgentDescriptor(String agentId, String name, Set<TaskType> capabilities, double performanceScore) {
        this.agentId = Objects.requireNonNull(agentId, "Agent ID cannot be null");
        this.name = name != null ? name : agentId;
        if (capabilities == null || capabilities.isEmpty()) {
            throw new IllegalArgumentException("Agent " + agentId + " must declare at least one capability");
        }
        this.capabilities = Collections.unmodifiableSet(EnumSet.copyOf(capabilities));
        this.performanceScore = performanceScore;
    }
    
    public AgentDescriptor(String agentId, String name, Set<TaskType> capabilities) {
        this(agentId, name, capabilities, 1.0);
    }
    
    public String getAgentId() { return agentId; }
    public String getName() { return name; }
    public Set<TaskType> getCapabilities() { return capabilities; }
    public double getPerformanceScore() { return performanceScore; }
    
    public boolean canExecute(TaskType taskType) {
        return capabilities.contains(taskType);
    }
    
    @Override
    public String toString() {
        return "AgentDescriptor{" +
                "agentId='" + agentId + '\'' +
                ", name='" + name + '\'' +
                ", capabilities=" + capabilities +
                ", performanceScore=" + performanceScore +
                '}';
    }
}
