package com.enterprise.orchestration.core;

import com.enterprise.orchestration.exception.ExecutionFailedException;
import com.enterprise.orchestration.gateway.ScriptedGateway;
import com.enterprise.orchestration.gateway.TaskExecutorGateway;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

class AsyncTaskExecutorTest {

    private AsyncTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown(5, TimeUnit.SECONDS);
        }
    }

    private AsyncTaskExecutor newExecutor(TaskExecutorGateway gateway, long timeoutMs) {
        return new AsyncTaskExecutor(gateway, timeoutMs, 2, 4, 1000, TimeUnit.MILLISECONDS,
                                     new LinkedBlockingQueue<>(10));
    }

    private Task task(TaskType type, Map<String, Object> params) {
        return Task.builder().id("t-" + type.getTag()).type(type).parameters(params).build();
    }

    @Test
    void testSuccessfulExecution() throws Exception {
        ScriptedGateway gateway = new ScriptedGateway().succeedWith(TaskType.CREATE_PR, Map.of("pr_id", 5));
        executor = newExecutor(gateway, 5000);

        TaskResult result = executor.execute(task(TaskType.CREATE_PR, Map.of("title", "t"))).get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals(5, result.getData().orElseThrow().get("pr_id"));
        assertEquals(TaskType.CREATE_PR, gateway.getCalls().get(0).getTaskType());
        assertEquals("t", gateway.getCalls().get(0).getArguments().get("title"));
        assertEquals(1, executor.getStatistics().getTotalTasksCompleted());
    }

    @Test
    void testRemoteFailureIsReturnedAsIs() throws Exception {
        executor = newExecutor(new ScriptedGateway().failWith(TaskType.PUSH_BRANCH, "rejected"), 5000);

        TaskResult result = executor.execute(task(TaskType.PUSH_BRANCH, Map.of())).get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertEquals("rejected", result.getErrorMessage());
        assertEquals(1, executor.getStatistics().getTotalTasksFailed());
    }

    @Test
    void testGatewayExceptionBecomesFailedResult() throws Exception {
        TaskExecutorGateway gateway = (type, args) -> {
            throw new ExecutionFailedException(type.getOperationName(), "connection refused");
        };
        executor = newExecutor(gateway, 5000);

        TaskResult result = executor.execute(task(TaskType.CREATE_BRANCH, Map.of())).get(5, TimeUnit.SECONDS);

        assertFalse(result.isSuccess());
        assertEquals("connection refused", result.getErrorMessage());
        assertTrue(result.getCause().orElseThrow() instanceof ExecutionFailedException);
        assertEquals("create_branch", result.getOperationName());
        assertTrue(result.getData().isEmpty());
    }

    @Test
    void testTimeoutBecomesFailedResult() throws Exception {
        ScriptedGateway gateway = new ScriptedGateway().closeGate();
        executor = newExecutor(gateway, 100);

        try {
            TaskResult result = executor.execute(task(TaskType.LIST_PRS, Map.of())).get(5, TimeUnit.SECONDS);

            assertFalse(result.isSuccess());
            assertTrue(result.getErrorMessage().contains("timed out"));
        } finally {
            gateway.open();
        }
    }

    @Test
    void testDurationIsMeasuredByExecutor() throws Exception {
        // the gateway reports 1ms but takes far longer
        ScriptedGateway gateway = new ScriptedGateway().respond(TaskType.MERGE_PR, args -> {
            try {
                Thread.sleep(150);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return TaskResult.success(TaskType.MERGE_PR.getOperationName(), Map.of("merged", true), 1);
        });
        executor = newExecutor(gateway, 5000);

        TaskResult result = executor.execute(task(TaskType.MERGE_PR, Map.of())).get(5, TimeUnit.SECONDS);

        assertTrue(result.isSuccess());
        assertEquals("merge_pull_request", result.getOperationName());
        assertEquals(true, result.getData().orElseThrow().get("merged"));
        assertTrue(result.getDurationMs() >= 150, "duration was " + result.getDurationMs());
    }

    @Test
    void testShutdown() {
        executor = newExecutor(new ScriptedGateway(), 1000);
        assertTrue(executor.isRunning());

        executor.shutdown(1, TimeUnit.SECONDS);

        assertFalse(executor.isRunning());
    }
}
