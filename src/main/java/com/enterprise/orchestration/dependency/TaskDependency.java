package com.enterprise.orchestration.dependency;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A typed edge from an upstream task to the task declaring it.
 * Without bindings the edge only orders execution; with bindings it also
 * carries result fields into the dependent task's parameters.
 */
public class TaskDependency {
    
    private final String upstreamTaskId;
    private final List<ParameterBinding> bindings;
    
    @JsonCreator
    public TaskDependency(@JsonProperty("upstreamTaskId") String upstreamTaskId,
                          @JsonProperty("bindings") List<ParameterBinding> bindings) {
        this.upstreamTaskId = Objects.requireNonNull(upstreamTaskId, "Upstream task ID cannot be null");
        this.bindings = bindings != null ? List.copyOf(bindings) : List.of();
    }
    
    /**
     * Ordering-only edge
     */
    public static TaskDependency after(String upstreamTaskId) {
        return new TaskDependency(upstreamTaskId, List.of());
    }
    
    public static TaskDependency on(String upstreamTaskId, ParameterBinding... bindings) {
        return new TaskDependency(upstreamTaskId, Arrays.asList(bindings));
    }
    
    public String getUpstreamTaskId() {
        return upstreamTaskId;
    }
    
    public List<ParameterBinding> getBindings() {
        return bindings;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        TaskDependency that = (TaskDependency) o;
        return upstreamTaskId.equals(that.upstreamTaskId) && bindings.equals(that.bindings);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(upstreamTaskId, bindings);
    }
    
    @Override
    public String toString() {
        return "TaskDependency{upstream=" + upstreamTaskId + ", bindings=" + bindings + '}';
    }
}
