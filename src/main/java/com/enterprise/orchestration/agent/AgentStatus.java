package com.enterprise.orchestration.agent;

/**
 * Availability of a worker agent
 */
public enum AgentStatus {
    AVAILABLE,
    BUSY,       // Holds exactly one assigned task
    OFFLINE
}
