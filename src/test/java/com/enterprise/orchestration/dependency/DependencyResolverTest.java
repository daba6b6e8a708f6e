package com.enterprise.orchestration.dependency;

import com.enterprise.orchestration.core.Task;
import com.enterprise.orchestration.core.TaskStatus;
import com.enterprise.orchestration.core.TaskType;
import com.enterprise.orchestration.queue.TaskQueue;
import com.enterprise.orchestration.store.TaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.Map;

class DependencyResolverTest {

    private TaskStore store;
    private TaskQueue queue;
    private DependencyResolver resolver;

    private Task pr;
    private Task report;

    @BeforeEach
    void setUp() {
        store = new TaskStore();
        queue = new TaskQueue();
        resolver = new DependencyResolver(store, queue);

        pr = Task.builder().id("wf_create_pr").workflowId("wf").type(TaskType.CREATE_PR).priority(1).build();
        report = Task.builder()
            .id("wf_generate_report")
            .workflowId("wf")
            .type(TaskType.GENERATE_REPORT)
            .priority(2)
            .dependency(TaskDependency.on(pr.getId(), ParameterBinding.of("pr_number", "pr_id", "pr_number")))
            .build();
        store.add(pr);
        store.add(report);
    }

    private void complete(Task task, Map<String, Object> result) {
        task.start("agent", Instant.now());
        task.complete(result, Instant.now());
    }

    private void parkReport() {
        queue.enqueue(report.getId(), report.getPriority());
        TaskQueue.QueueEntry entry = queue.poll().orElseThrow();
        assertTrue(queue.parkIfNotReady(entry, report::isReady));
    }

    @Test
    void testResolveFillsParameterAndUnparks() {
        parkReport();
        complete(pr, Map.of("pr_id", 42));

        assertEquals(1, resolver.resolve(pr));

        assertEquals(42, report.getParameters().get("pr_number"));
        assertTrue(report.isReady());
        assertFalse(queue.isParked(report.getId()));
        assertEquals(report.getId(), queue.poll().orElseThrow().getTaskId());
    }

    @Test
    void testResolveIsIdempotent() {
        complete(pr, Map.of("pr_number", 7));

        assertEquals(1, resolver.resolve(pr));
        Map<String, Object> once = report.getParameters();
        assertEquals(0, resolver.resolve(pr));

        assertEquals(once, report.getParameters());
    }

    @Test
    void testNothingResolvedFromUnfinishedTask() {
        assertEquals(0, resolver.resolve(pr));
        assertFalse(report.isReady());
    }

    @Test
    void testMissingFieldBlocksDependent() {
        Task after = Task.builder()
            .id("wf_save_report")
            .workflowId("wf")
            .type(TaskType.SAVE_REPORT)
            .dependency(TaskDependency.after(report.getId()))
            .build();
        store.add(after);
        complete(pr, Map.of("url", "https://example/pr"));

        assertEquals(0, resolver.resolve(pr));

        assertEquals(TaskStatus.PENDING, report.getStatus());
        assertNotNull(report.getBlockedReason());
        assertNotNull(after.getBlockedReason());
        assertFalse(report.isReady());
    }

    @Test
    void testFailureBlocksTransitiveDependents() {
        Task save = Task.builder()
            .id("wf_save_report")
            .workflowId("wf")
            .type(TaskType.SAVE_REPORT)
            .dependency(TaskDependency.after(report.getId()))
            .build();
        store.add(save);
        pr.start("agent", Instant.now());
        pr.fail("HTTP 500", Instant.now());

        assertEquals(2, resolver.blockDependents(pr));

        assertTrue(report.getBlockedReason().contains("HTTP 500"));
        assertTrue(save.getBlockedReason().contains(report.getId()));
        assertEquals(TaskStatus.PENDING, report.getStatus());
        assertEquals(TaskStatus.PENDING, save.getStatus());
    }
}
