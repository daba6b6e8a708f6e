package com.enterprise.orchestration.workflow;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A named, ordered collection of tasks created together from one request.
 * Never mutated after creation; its status is derived from its tasks.
 */
public class Workflow {
    
    private final String workflowId;
    private final String workflowType;
    private final List<String> taskIds;
    private final Instant createdAt;
    private final Map<String, Object> parameters;
    
    @JsonCreator
    public Workflow(@JsonProperty("workflowId") String workflowId,
                    @JsonProperty("workflowType") String workflowType,
                    @JsonProperty("taskIds") List<String> taskIds,
                    @JsonProperty("createdAt") Instant createdAt,
                    @JsonProperty("parameters") Map<String, Object> parameters) {
        this.workflowId = Objects.requireNonNull(workflowId, "Workflow ID cannot be null");
        this.workflowType = Objects.requireNonNull(workflowType, "Workflow type cannot be null");
        this.taskIds = List.copyOf(taskIds);
        this.createdAt = createdAt;
        this.parameters = parameters != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
            : Map.of();
    }
    
    public String getWorkflowId() { return workflowId; }
    public String getWorkflowType() { return workflowType; }
    public List<String> getTaskIds() { return taskIds; }
    public Instant getCreatedAt() { return createdAt; }
    public Map<String, Object> getParameters() { return parameters; }
    
    @Override
    public String toString() {
        return "Workflow{" +
                "workflowId='" + workflowId + '\'' +
                ", workflowType='" + workflowType + '\'' +
                ", tasks=" + taskIds.size() +
                '}';
    }
}
