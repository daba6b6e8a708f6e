package com.enterprise.orchestration.core;

/**
 * Represents the status of a task in the orchestrator.
 * Transitions are monotonic: PENDING -> RUNNING -> (COMPLETED | FAILED).
 */
public enum TaskStatus {
    PENDING,        // Task is waiting for its dependencies or for an agent
    RUNNING,        // Task has been dispatched to an agent
    COMPLETED,      // Task completed successfully
    FAILED;         // Task failed and won't be retried
    
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
