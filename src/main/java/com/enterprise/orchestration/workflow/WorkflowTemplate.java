package com.enterprise.orchestration.workflow;

import java.util.List;
import java.util.Map;

/**
 * Expands a workflow request into its ordered task steps.
 */
public interface WorkflowTemplate {

    /**
     * Workflow type name this template answers to
     */
    String getName();

    /**
     * Expand request parameters into steps. Must not touch any shared state.
     *
     * @throws IllegalArgumentException if the parameters cannot form a workflow
     */
    List<TaskSpec> expand(Map<String, Object> parameters);
}
