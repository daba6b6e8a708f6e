package com.enterprise.orchestration.workflow;

import com.enterprise.orchestration.core.TaskType;
import com.enterprise.orchestration.dependency.ParameterBinding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One step of an expanded workflow, before it becomes a {@code Task}.
 * Dependencies point at earlier steps by their position in the expansion.
 */
public class TaskSpec {

    private final TaskType type;
    private final Map<String, Object> parameters;
    private final List<Edge> edges = new ArrayList<>();

    private TaskSpec(TaskType type, Map<String, Object> parameters) {
        this.type = type;
        this.parameters = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
    }

    public static TaskSpec of(TaskType type, Map<String, Object> parameters) {
        return new TaskSpec(type, parameters);
    }

    public static TaskSpec of(TaskType type) {
        return new TaskSpec(type, null);
    }

    /**
     * Run only after the step at {@code upstreamIndex} completes
     */
    public TaskSpec after(int upstreamIndex) {
        edges.add(new Edge(upstreamIndex, List.of()));
        return this;
    }

    /**
     * Run after the step at {@code upstreamIndex} and take the bound values from its result
     */
    public TaskSpec bind(int upstreamIndex, ParameterBinding... bindings) {
        edges.add(new Edge(upstreamIndex, Arrays.asList(bindings)));
        return this;
    }

    public TaskType getType() { return type; }
    public Map<String, Object> getParameters() { return Collections.unmodifiableMap(parameters); }
    public List<Edge> getEdges() { return Collections.unmodifiableList(edges); }

    public static class Edge {
        private final int upstreamIndex;
        private final List<ParameterBinding> bindings;

        Edge(int upstreamIndex, List<ParameterBinding> bindings) {
            this.upstreamIndex = upstreamIndex;
            this.bindings = List.copyOf(bindings);
        }

        public int getUpstreamIndex() { return upstreamIndex; }
        public List<ParameterBinding> getBindings() { return bindings; }
    }
}
