package com.enterprise.orchestration.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Outcome of one remote operation call. A successful result carries the
 * operation's result fields; a failed one carries the error reported by the
 * operation or the reason the call could not be made.
 */
public final class TaskResult {

    private final String operationName;
    private final boolean success;
    private final Map<String, Object> data;
    private final String errorMessage;
    private final Throwable cause;
    private final long durationMs;

    private TaskResult(String operationName, boolean success, Map<String, Object> data,
                       String errorMessage, Throwable cause, long durationMs) {
        this.operationName = operationName;
        this.success = success;
        this.data = data;
        this.errorMessage = errorMessage;
        this.cause = cause;
        this.durationMs = durationMs;
    }

    public static TaskResult success(String operationName, Map<String, Object> data, long durationMs) {
        Map<String, Object> fields = data != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(data))
            : Collections.emptyMap();
        return new TaskResult(operationName, true, fields, null, null, durationMs);
    }

    public static TaskResult failure(String operationName, String errorMessage, Throwable cause, long durationMs) {
        return new TaskResult(operationName, false, null, errorMessage, cause, durationMs);
    }

    /**
     * Same outcome with the duration replaced, used once the caller has timed
     * the call itself.
     */
    public TaskResult withDuration(long durationMs) {
        return new TaskResult(operationName, success, data, errorMessage, cause, durationMs);
    }

    public String getOperationName() { return operationName; }

    public boolean isSuccess() { return success; }

    /**
     * Result fields of a successful call; empty for a failed one
     */
    public Optional<Map<String, Object>> getData() { return Optional.ofNullable(data); }

    public String getErrorMessage() { return errorMessage; }

    public Optional<Throwable> getCause() { return Optional.ofNullable(cause); }

    public long getDurationMs() { return durationMs; }

    @Override
    public String toString() {
        return success
            ? String.format("TaskResult{%s succeeded in %dms}", operationName, durationMs)
            : String.format("TaskResult{%s failed in %dms: %s}", operationName, durationMs, errorMessage);
    }
}
