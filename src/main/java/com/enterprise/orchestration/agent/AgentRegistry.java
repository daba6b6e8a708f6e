package com.enterprise.orchestration.agent;

import com.enterprise.orchestration.core.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * Holds the worker agents and performs capability + score based selection.
 * All agent state changes happen under a single write lock, so an agent can
 * never be reserved for two tasks at once.
 */
public class AgentRegistry {

    private static final Logger logger = LoggerFactory.getLogger(AgentRegistry.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    // Iteration order is registration order, which breaks score ties
    private final Map<String, RegisteredAgent> agents = new LinkedHashMap<>();

    /**
     * Register a new agent as available
     */
    public void register(AgentDescriptor descriptor) {
        lock.writeLock().lock();
        try {
            if (agents.containsKey(descriptor.getAgentId())) {
                throw new IllegalArgumentException("Agent already registered: " + descriptor.getAgentId());
            }
            agents.put(descriptor.getAgentId(), new RegisteredAgent(descriptor, Instant.now()));
            logger.info("Registered agent {} with capabilities {}", descriptor.getAgentId(), descriptor.getCapabilities());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Select the best available agent for the task type and reserve it for the task.
     * Highest performance score wins; equal scores go to the earliest registered agent.
     *
     * @return the reserved agent id, or empty if no capable agent is available
     */
    public Optional<String> selectAndReserve(TaskType taskType, String taskId) {
        lock.writeLock().lock();
        try {
            RegisteredAgent best = null;
            for (RegisteredAgent candidate : agents.values()) {
                if (candidate.status != AgentStatus.AVAILABLE || !candidate.descriptor.canExecute(taskType)) {
                    continue;
                }
                if (best == null || candidate.performanceScore > best.performanceScore) {
                    best = candidate;
                }
            }

            if (best == null) {
                return Optional.empty();
            }

            best.status = AgentStatus.BUSY;
            best.currentTask = taskId;
            logger.debug("Reserved agent {} for task {}", best.descriptor.getAgentId(), taskId);
            return Optional.of(best.descriptor.getAgentId());
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Release an agent from the given task. A release for a task the agent no
     * longer holds is ignored.
     */
    public void release(String agentId, String taskId) {
        lock.writeLock().lock();
        try {
            RegisteredAgent agent = agents.get(agentId);
            if (agent == null) {
                logger.warn("Release requested for unknown agent {}", agentId);
                return;
            }
            if (agent.currentTask == null || !agent.currentTask.equals(taskId)) {
                logger.warn("Agent {} does not hold task {} (current: {})", agentId, taskId, agent.currentTask);
                return;
            }
            agent.currentTask = null;
            agent.status = AgentStatus.AVAILABLE;
            logger.debug("Released agent {} from task {}", agentId, taskId);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Take an idle agent offline, or bring an offline agent back
     */
    public void setOnline(String agentId, boolean online) {
        lock.writeLock().lock();
        try {
            RegisteredAgent agent = agents.get(agentId);
            if (agent == null) {
                throw new IllegalArgumentException("Unknown agent: " + agentId);
            }
            if (agent.status == AgentStatus.BUSY) {
                throw new IllegalStateException("Agent " + agentId + " is busy with task " + agent.currentTask);
            }
            agent.status = online ? AgentStatus.AVAILABLE : AgentStatus.OFFLINE;
            logger.info("Agent {} is now {}", agentId, agent.status);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void refreshHeartbeats() {
        lock.writeLock().lock();
        try {
            Instant now = Instant.now();
            agents.values().forEach(agent -> agent.lastHeartbeat = now);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Whether any registered agent, in any state, declares the capability
     */
    public boolean hasCapability(TaskType taskType) {
        lock.readLock().lock();
        try {
            return agents.values().stream().anyMatch(a -> a.descriptor.canExecute(taskType));
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<AgentSnapshot> getAgent(String agentId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(agents.get(agentId)).map(RegisteredAgent::snapshot);
        } finally {
            lock.readLock().unlock();
        }
    }

    public AgentStatusReport getStatusReport() {
        lock.readLock().lock();
        try {
            List<AgentSnapshot> snapshots = agents.values().stream()
                .map(RegisteredAgent::snapshot)
                .collect(Collectors.toList());
            return new AgentStatusReport(snapshots);
        } finally {
            lock.readLock().unlock();
        }
    }

    public int countByStatus(AgentStatus status) {
        lock.readLock().lock();
        try {
            return (int) agents.values().stream().filter(a -> a.status == status).count();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return agents.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Mutable registry-side state; only touched under the registry lock
     */
    private static class RegisteredAgent {
        private final AgentDescriptor descriptor;
        private final double performanceScore;
        private AgentStatus status = AgentStatus.AVAILABLE;
        private String currentTask;
        private Instant lastHeartbeat;

        RegisteredAgent(AgentDescriptor descriptor, Instant registeredAt) {
            this.descriptor = descriptor;
            this.performanceScore = descriptor.getPerformanceScore();
            this.lastHeartbeat = registeredAt;
        }

        AgentSnapshot snapshot() {
            return new AgentSnapshot(descriptor.getAgentId(), descriptor.getName(), descriptor.getCapabilities(),
                status, currentTask, performanceScore, lastHeartbeat);
        }
    }
}
