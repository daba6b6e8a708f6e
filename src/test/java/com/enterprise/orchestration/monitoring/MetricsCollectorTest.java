package com.enterprise.orchestration.monitoring;

import com.enterprise.orchestration.core.Task;
import com.enterprise.orchestration.core.TaskType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;

class MetricsCollectorTest {

    private SimpleMeterRegistry registry;
    private MetricsCollector collector;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        collector = new MetricsCollector(registry);
    }

    private Task task(String id, TaskType type) {
        return Task.builder().id(id).workflowId("wf").type(type).build();
    }

    @Test
    void testTaskOutcomesAreCounted() {
        Task pr = task("wf_create_pr", TaskType.CREATE_PR);
        Task report = task("wf_generate_report", TaskType.GENERATE_REPORT);

        collector.recordTaskDispatched(pr);
        collector.recordTaskCompleted(pr, 120);
        collector.recordTaskDispatched(report);
        collector.recordTaskFailed(report, 30);

        assertEquals(2.0, registry.get("orchestrator.tasks.dispatched").counter().count());
        assertEquals(1.0, registry.get("orchestrator.tasks.completed").counter().count());
        assertEquals(1.0, registry.get("orchestrator.tasks.failed").counter().count());
        assertEquals(2, registry.get("orchestrator.task.execution.time").timer().count());
        assertEquals(1.0, registry.get("orchestrator.task.type")
            .tag("type", "create_pr").tag("outcome", "completed").counter().count());
        assertEquals(1.0, registry.get("orchestrator.task.type")
            .tag("type", "generate_report").tag("outcome", "failed").counter().count());
    }

    @Test
    void testWorkflowsCountedByType() {
        collector.recordWorkflowCreated("create_pr");
        collector.recordWorkflowCreated("create_pr");
        collector.recordWorkflowCreated("branch_and_pr");

        assertEquals(3.0, registry.get("orchestrator.workflows.created").counter().count());
        assertEquals(2.0, registry.get("orchestrator.workflow.type").tag("type", "create_pr").counter().count());
    }

    @Test
    void testGaugesFollowUpdates() {
        collector.updateQueueSize(7);
        collector.updateParkedTasks(3);
        collector.updateBusyAgents(2);
        collector.recordNoAgentDeferral(task("t", TaskType.PUSH_BRANCH));

        assertEquals(7.0, registry.get("orchestrator.queue.size").gauge().value());
        assertEquals(3.0, registry.get("orchestrator.queue.parked").gauge().value());
        assertEquals(2.0, registry.get("orchestrator.agents.busy").gauge().value());

        Map<String, Object> metrics = collector.getMetrics();
        assertEquals(1.0, metrics.get("tasks.deferred"));
        assertEquals(7L, metrics.get("queue.size"));
    }
}
