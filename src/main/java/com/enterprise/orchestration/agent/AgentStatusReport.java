package com.enterprise.orchestration.agent;

import java.util.List;

/**
 * Read-only snapshot of the whole agent roster with per-status counts
 */
public class AgentStatusReport {
    
    private final List<AgentSnapshot> agents;
    private final int totalAgents;
    private final int availableAgents;
    private final int busyAgents;
    private final int offlineAgents;
    
    public AgentStatusReport(List<AgentSnapshot> agents) {
        this.agents = List.copyOf(agents);
        this.totalAgents = agents.size();
        this.availableAgents = count(AgentStatus.AVAILABLE);
        this.busyAgents = count(AgentStatus.BUSY);
        this.offlineAgents = count(AgentStatus.OFFLINE);
    }
    
    private int count(AgentStatus status) {
        return (int) agents.stream().filter(a -> a.getStatus() == status).count();
    }
    
    public List<AgentSnapshot> getAgents() { return agents; }
    public int getTotalAgents() { return totalAgents; }
    public int getAvailableAgents() { return availableAgents; }
    public int getBusyAgents() { return busyAgents; }
    public int getOfflineAgents() { return offlineAgents; }
}
