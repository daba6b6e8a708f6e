package com.enterprise.orchestration.exception;

/**
 * Thrown by a gateway when a remote operation could not be carried out
 * (transport error, unreadable response).
 */
public class ExecutionFailedException extends OrchestrationException {
    
    private final String operationName;
    
    public ExecutionFailedException(String operationName, String message) {
        super(message);
        this.operationName = operationName;
    }
    
    public ExecutionFailedException(String operationName, String message, Throwable cause) {
        super(message, cause);
        this.operationName = operationName;
    }
    
    public String getOperationName() {
        return operationName;
    }
}
