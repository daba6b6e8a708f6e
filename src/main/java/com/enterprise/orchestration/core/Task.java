package com.enterprise.orchestration.core;

import com.enterprise.orchestration.dependency.ParameterBinding;
import com.enterprise.orchestration.dependency.TaskDependency;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A unit of orchestrated work assigned to exactly one agent at a time.
 * Identity, type, priority and dependencies are fixed at creation; status,
 * assignment and parameters change under the task's own monitor.
 */
public class Task {

    private final String id;
    private final String workflowId;
    private final TaskType type;
    private final int priority;
    private final Instant createdAt;
    private final List<TaskDependency> dependencies;

    private final Map<String, Object> parameters;
    private final Set<String> resolvedUpstreams = new LinkedHashSet<>();
    private TaskStatus status = TaskStatus.PENDING;
    private String assignedAgent;
    private Instant startedAt;
    private Instant completedAt;
    private Map<String, Object> result;
    private String errorMessage;
    private String blockedReason;
    private int dispatchAttempts;

    private Task(Builder builder) {
        this.id = builder.id;
        this.workflowId = builder.workflowId;
        this.type = builder.type;
        this.priority = builder.priority;
        this.createdAt = builder.createdAt;
        this.dependencies = List.copyOf(builder.dependencies);
        this.parameters = new LinkedHashMap<>(builder.parameters);
    }

    public String getId() { return id; }

    public String getWorkflowId() { return workflowId; }

    public TaskType getType() { return type; }

    public int getPriority() { return priority; }

    public Instant getCreatedAt() { return createdAt; }

    public List<TaskDependency> getDependencies() { return dependencies; }

    public synchronized TaskStatus getStatus() { return status; }

    public synchronized String getAssignedAgent() { return assignedAgent; }

    public synchronized Instant getStartedAt() { return startedAt; }

    public synchronized Instant getCompletedAt() { return completedAt; }

    public synchronized String getErrorMessage() { return errorMessage; }

    public synchronized String getBlockedReason() { return blockedReason; }

    public synchronized int getDispatchAttempts() { return dispatchAttempts; }

    /**
     * Copy of the current parameter map
     */
    public synchronized Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Result payload, present once the task has completed
     */
    public synchronized Optional<Map<String, Object>> getResult() {
        return Optional.ofNullable(result);
    }

    /**
     * Whether this task still waits on the given upstream task
     */
    public synchronized boolean isWaitingOn(String upstreamTaskId) {
        return !resolvedUpstreams.contains(upstreamTaskId)
            && dependencies.stream().anyMatch(d -> d.getUpstreamTaskId().equals(upstreamTaskId));
    }

    public synchronized boolean hasUnresolvedDependencies() {
        return resolvedUpstreams.size() < dependencies.size();
    }

    /**
     * Pending with every dependency resolved
     */
    public synchronized boolean isReady() {
        return status == TaskStatus.PENDING && !hasUnresolvedDependencies();
    }

    /**
     * Apply the bindings of the dependency on {@code upstreamTaskId} using its result.
     * Already-resolved dependencies are left untouched.
     *
     * @return true if the dependency became resolved by this call
     */
    public synchronized boolean resolveDependency(String upstreamTaskId, Map<String, Object> upstreamResult) {
        if (status != TaskStatus.PENDING || resolvedUpstreams.contains(upstreamTaskId)) {
            return false;
        }
        Optional<TaskDependency> dependency = dependencies.stream()
            .filter(d -> d.getUpstreamTaskId().equals(upstreamTaskId))
            .findFirst();
        if (dependency.isEmpty()) {
            return false;
        }

        Map<String, Object> values = new HashMap<>();
        for (ParameterBinding binding : dependency.get().getBindings()) {
            Optional<Object> value = binding.extract(upstreamResult);
            if (value.isEmpty()) {
                blockedReason = String.format("Upstream task %s result has none of the fields %s",
                    upstreamTaskId, binding.getResultFields());
                return false;
            }
            values.put(binding.getTargetParameter(), value.get());
        }

        parameters.putAll(values);
        resolvedUpstreams.add(upstreamTaskId);
        return true;
    }

    /**
     * Record why this pending task can never become ready
     */
    public synchronized void block(String reason) {
        if (status == TaskStatus.PENDING) {
            this.blockedReason = reason;
        }
    }

    public synchronized int recordDispatchAttempt() {
        return ++dispatchAttempts;
    }

    /**
     * PENDING -> RUNNING
     */
    public synchronized void start(String agentId, Instant now) {
        if (status != TaskStatus.PENDING) {
            throw new IllegalStateException("Task " + id + " cannot start from status " + status);
        }
        if (hasUnresolvedDependencies()) {
            throw new IllegalStateException("Task " + id + " has unresolved dependencies");
        }
        this.status = TaskStatus.RUNNING;
        this.assignedAgent = agentId;
        this.startedAt = now;
    }

    /**
     * RUNNING -> COMPLETED
     */
    public synchronized void complete(Map<String, Object> resultData, Instant now) {
        requireRunning(TaskStatus.COMPLETED);
        this.status = TaskStatus.COMPLETED;
        this.result = resultData != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(resultData))
            : Collections.emptyMap();
        this.completedAt = now;
    }

    /**
     * RUNNING -> FAILED
     */
    public synchronized void fail(String error, Instant now) {
        requireRunning(TaskStatus.FAILED);
        this.status = TaskStatus.FAILED;
        this.errorMessage = error;
        this.completedAt = now;
    }

    private void requireRunning(TaskStatus target) {
        if (status != TaskStatus.RUNNING) {
            throw new IllegalStateException("Task " + id + " cannot move from " + status + " to " + target);
        }
    }

    /**
     * Consistent point-in-time view of this task
     */
    public synchronized TaskSnapshot snapshot() {
        List<String> waitingOn = new ArrayList<>();
        List<String> pendingParameters = new ArrayList<>();
        for (TaskDependency dependency : dependencies) {
            if (!resolvedUpstreams.contains(dependency.getUpstreamTaskId())) {
                waitingOn.add(dependency.getUpstreamTaskId());
                dependency.getBindings().forEach(b -> pendingParameters.add(b.getTargetParameter()));
            }
        }
        return new TaskSnapshot(id, workflowId, type, priority, status,
            new LinkedHashMap<>(parameters), assignedAgent, createdAt, startedAt, completedAt,
            result, errorMessage, blockedReason, waitingOn, pendingParameters, dispatchAttempts);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", type=" + type + ", priority=" + priority + '}';
    }

    /**
     * Builder for creating Task instances
     */
    public static class Builder {
        private String id;
        private String workflowId;
        private TaskType type;
        private int priority = 0;
        private Instant createdAt = Instant.now();
        private Map<String, Object> parameters = new LinkedHashMap<>();
        private final List<TaskDependency> dependencies = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder workflowId(String workflowId) {
            this.workflowId = workflowId;
            return this;
        }

        public Builder type(TaskType type) {
            this.type = type;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters != null ? parameters : new LinkedHashMap<>();
            return this;
        }

        public Builder dependency(TaskDependency dependency) {
            this.dependencies.add(dependency);
            return this;
        }

        public Builder dependencies(List<TaskDependency> dependencies) {
            this.dependencies.addAll(dependencies);
            return this;
        }

        public Task build() {
            if (id == null) {
                throw new IllegalArgumentException("Task id is required");
            }
            if (type == null) {
                throw new IllegalArgumentException("Task type is required");
            }
            return new Task(this);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
