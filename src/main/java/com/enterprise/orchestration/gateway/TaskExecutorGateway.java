package com.enterprise.orchestration.gateway;

import com.enterprise.orchestration.core.TaskResult;
import com.enterprise.orchestration.core.TaskType;
import com.enterprise.orchestration.exception.ExecutionFailedException;

import java.util.Map;

/**
 * Boundary to the remote task executor service.
 * Implementations block for the duration of the remote call and must be thread-safe.
 */
public interface TaskExecutorGateway {
    
    /**
     * Execute the operation mapped to {@code taskType} with the given arguments
     *
     * @return a successful result carrying the remote payload, or a failed result
     *         carrying the remote error message
     * @throws ExecutionFailedException if the call could not be completed
     */
    TaskResult execute(TaskType taskType, Map<String, Object> arguments) throws ExecutionFailedException;
}
