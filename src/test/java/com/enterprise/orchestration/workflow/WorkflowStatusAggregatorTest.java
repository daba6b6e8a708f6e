package com.enterprise.orchestration.workflow;

import com.enterprise.orchestration.agent.AgentRegistry;
import com.enterprise.orchestration.agent.DefaultAgents;
import com.enterprise.orchestration.core.Task;
import com.enterprise.orchestration.dependency.DependencyResolver;
import com.enterprise.orchestration.exception.WorkflowNotFoundException;
import com.enterprise.orchestration.queue.TaskQueue;
import com.enterprise.orchestration.store.TaskStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

class WorkflowStatusAggregatorTest {

    private TaskStore store;
    private TaskQueue queue;
    private WorkflowFactory factory;
    private WorkflowStatusAggregator aggregator;

    @BeforeEach
    void setUp() {
        store = new TaskStore();
        queue = new TaskQueue();
        WorkflowHistory history = new WorkflowHistory();
        AgentRegistry registry = new AgentRegistry();
        DefaultAgents.roster().forEach(registry::register);
        factory = new WorkflowFactory(store, queue, registry, history);
        aggregator = new WorkflowStatusAggregator(history, store);
    }

    private Task task(Workflow workflow, int index) {
        return store.get(workflow.getTaskIds().get(index)).orElseThrow();
    }

    @Test
    void testNewWorkflowIsRunning() throws Exception {
        Workflow workflow = factory.createWorkflow("branch_and_pr", Map.of(), 1);

        WorkflowStatusReport report = aggregator.getWorkflowStatus(workflow.getWorkflowId());

        assertEquals(WorkflowStatus.RUNNING, report.getStatus());
        assertEquals("0/2 tasks completed", report.getProgress());
        assertEquals(2, report.getTasks().size());
        assertEquals("branch_and_pr", report.getWorkflowType());
    }

    @Test
    void testAllCompleted() throws Exception {
        Workflow workflow = factory.createWorkflow("create_pr", Map.of(), 1);
        Task pr = task(workflow, 0);
        pr.start("pr_agent", Instant.now());
        pr.complete(Map.of("pr_id", 1), Instant.now());

        WorkflowStatusReport report = aggregator.getWorkflowStatus(workflow.getWorkflowId());

        assertEquals(WorkflowStatus.COMPLETED, report.getStatus());
        assertEquals("1/1 tasks completed", report.getProgress());
    }

    @Test
    void testAnyFailureFailsWorkflow() throws Exception {
        Workflow workflow = factory.createWorkflow("pr_with_report", Map.of(), 1);
        Task pr = task(workflow, 0);
        pr.start("pr_agent", Instant.now());
        pr.fail("HTTP 422", Instant.now());
        new DependencyResolver(store, queue).blockDependents(pr);

        WorkflowStatusReport report = aggregator.getWorkflowStatus(workflow.getWorkflowId());

        assertEquals(WorkflowStatus.FAILED, report.getStatus());
        assertEquals("0/2 tasks completed", report.getProgress());
        assertEquals(List.of(task(workflow, 1).getId()), report.getBlockedTaskIds());
    }

    @Test
    void testProgressIsRecomputed() throws Exception {
        Workflow workflow = factory.createWorkflow("create_branch", Map.of(), 1);
        String id = workflow.getWorkflowId();
        assertEquals("0/2 tasks completed", aggregator.getWorkflowStatus(id).getProgress());

        Task create = task(workflow, 0);
        create.start("branch_agent", Instant.now());
        create.complete(Map.of(), Instant.now());

        assertEquals("1/2 tasks completed", aggregator.getWorkflowStatus(id).getProgress());
        assertEquals(WorkflowStatus.RUNNING, aggregator.getWorkflowStatus(id).getStatus());
    }

    @Test
    void testUnknownWorkflow() {
        WorkflowNotFoundException e = assertThrows(WorkflowNotFoundException.class,
            () -> aggregator.getWorkflowStatus("workflow_deadbeef"));
        assertEquals("workflow_deadbeef", e.getWorkflowId());
    }

    @Test
    void testDeriveRules() {
        assertEquals(WorkflowStatus.FAILED, WorkflowStatusAggregator.derive(true, 2, 2));
        assertEquals(WorkflowStatus.COMPLETED, WorkflowStatusAggregator.derive(false, 3, 3));
        assertEquals(WorkflowStatus.RUNNING, WorkflowStatusAggregator.derive(false, 1, 3));
    }
}
