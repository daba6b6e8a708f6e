package com.enterprise.orchestration.gateway;

import com.enterprise.orchestration.core.TaskResult;
import com.enterprise.orchestration.core.TaskType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * In-memory gateway for tests. Answers each task type with a scripted result
 * (success with an empty payload by default) and records every call in order.
 */
public class ScriptedGateway implements TaskExecutorGateway {

    private final Map<TaskType, Function<Map<String, Object>, TaskResult>> responses = new ConcurrentHashMap<>();
    private final List<Call> calls = Collections.synchronizedList(new ArrayList<>());
    private volatile CountDownLatch gate;

    public ScriptedGateway succeedWith(TaskType type, Map<String, Object> payload) {
        responses.put(type, args -> TaskResult.success(type.getOperationName(), payload, 1));
        return this;
    }

    public ScriptedGateway failWith(TaskType type, String error) {
        responses.put(type, args -> TaskResult.failure(type.getOperationName(), error, null, 1));
        return this;
    }

    public ScriptedGateway respond(TaskType type, Function<Map<String, Object>, TaskResult> response) {
        responses.put(type, response);
        return this;
    }

    /**
     * Hold every call until {@link #open()} is invoked
     */
    public ScriptedGateway closeGate() {
        gate = new CountDownLatch(1);
        return this;
    }

    public void open() {
        CountDownLatch current = gate;
        if (current != null) {
            current.countDown();
        }
    }

    @Override
    public TaskResult execute(TaskType taskType, Map<String, Object> arguments) {
        calls.add(new Call(taskType, arguments));
        CountDownLatch current = gate;
        if (current != null) {
            try {
                current.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        return responses.getOrDefault(taskType, args -> TaskResult.success(taskType.getOperationName(), Map.of(), 1)).apply(arguments);
    }

    public List<Call> getCalls() {
        synchronized (calls) {
            return new ArrayList<>(calls);
        }
    }

    public static class Call {
        private final TaskType taskType;
        private final Map<String, Object> arguments;

        Call(TaskType taskType, Map<String, Object> arguments) {
            this.taskType = taskType;
            this.arguments = arguments;
        }

        public TaskType getTaskType() { return taskType; }
        public Map<String, Object> getArguments() { return arguments; }
    }
}
