package com.enterprise.orchestration.exception;

/**
 * Exception thrown when a requested workflow is not found
 */
public class WorkflowNotFoundException extends OrchestrationException {
    
    private final String workflowId;
    
    public WorkflowNotFoundException(String workflowId) {
        super("Workflow not found: " + workflowId);
        this.workflowId = workflowId;
    }
    
    public String getWorkflowId() {
        return workflowId;
    }
}
