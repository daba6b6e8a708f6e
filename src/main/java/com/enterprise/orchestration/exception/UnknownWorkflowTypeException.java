package com.enterprise.orchestration.exception;

/**
 * Exception thrown when a workflow is requested with a type no template is registered for
 */
public class UnknownWorkflowTypeException extends OrchestrationException {
    
    private final String workflowType;
    
    public UnknownWorkflowTypeException(String workflowType) {
        super("Unknown workflow type: " + workflowType);
        this.workflowType = workflowType;
    }
    
    public String getWorkflowType() {
        return workflowType;
    }
}
