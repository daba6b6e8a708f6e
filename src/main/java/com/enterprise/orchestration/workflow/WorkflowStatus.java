package com.enterprise.orchestration.workflow;

/**
 * Status of a workflow, derived from its tasks and never stored
 */
public enum WorkflowStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
