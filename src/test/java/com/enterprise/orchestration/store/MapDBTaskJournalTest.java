package com.enterprise.orchestration.store;

import com.enterprise.orchestration.core.Task;
import com.enterprise.orchestration.core.TaskSnapshot;
import com.enterprise.orchestration.core.TaskStatus;
import com.enterprise.orchestration.core.TaskType;
import com.enterprise.orchestration.dependency.ParameterBinding;
import com.enterprise.orchestration.dependency.TaskDependency;
import com.enterprise.orchestration.workflow.Workflow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

class MapDBTaskJournalTest {

    @TempDir
    Path tempDir;

    private String dbPath;
    private MapDBTaskJournal journal;

    @BeforeEach
    void setUp() {
        dbPath = tempDir.resolve("journal.db").toString();
        journal = new MapDBTaskJournal(dbPath);
    }

    @AfterEach
    void tearDown() {
        journal.close();
    }

    @Test
    void testLatestSnapshotWins() {
        Task task = Task.builder()
            .id("wf_create_pr")
            .workflowId("wf")
            .type(TaskType.CREATE_PR)
            .priority(1)
            .parameters(Map.of("title", "Add x"))
            .build();
        journal.recordTask(task.snapshot());

        task.start("pr_agent", Instant.now());
        task.complete(Map.of("pr_id", 9), Instant.now());
        journal.recordTask(task.snapshot());

        TaskSnapshot stored = journal.findTask("wf_create_pr").orElseThrow();
        assertEquals(TaskStatus.COMPLETED, stored.getStatus());
        assertEquals("pr_agent", stored.getAssignedAgent());
        assertEquals(9, stored.getResult().get("pr_id"));
        assertEquals("Add x", stored.getParameters().get("title"));
        assertNotNull(stored.getCompletedAt());
        assertEquals(1, journal.loadTasks().size());
    }

    @Test
    void testPendingDependencyIsRecorded() {
        Task report = Task.builder()
            .id("wf_generate_report")
            .workflowId("wf")
            .type(TaskType.GENERATE_REPORT)
            .dependency(TaskDependency.on("wf_create_pr", ParameterBinding.of("pr_number", "pr_id")))
            .build();
        journal.recordTask(report.snapshot());

        TaskSnapshot stored = journal.findTask(report.getId()).orElseThrow();
        assertEquals(List.of("wf_create_pr"), stored.getWaitingOn());
        assertEquals(List.of("pr_number"), stored.getPendingParameters());
    }

    @Test
    void testWorkflowsSurviveReopen() {
        Instant createdAt = Instant.parse("2024-05-01T10:15:30Z");
        journal.recordWorkflow(new Workflow("workflow_0a1b2c3d", "create_pr",
            List.of("workflow_0a1b2c3d_create_pr"), createdAt, Map.of("title", "t")));
        journal.close();

        journal = new MapDBTaskJournal(dbPath);
        List<Workflow> workflows = journal.loadWorkflows();

        assertEquals(1, workflows.size());
        Workflow workflow = workflows.get(0);
        assertEquals("workflow_0a1b2c3d", workflow.getWorkflowId());
        assertEquals(createdAt, workflow.getCreatedAt());
        assertEquals(List.of("workflow_0a1b2c3d_create_pr"), workflow.getTaskIds());
    }

    @Test
    void testUnknownTask() {
        assertTrue(journal.findTask("missing").isEmpty());
        assertTrue(journal.loadTasks().isEmpty());
    }

    @Test
    void testStoreWritesThrough() {
        TaskStore store = new TaskStore(journal);
        Task task = Task.builder().id("t1").workflowId("wf").type(TaskType.MERGE_PR).build();

        store.add(task);
        assertEquals(TaskStatus.PENDING, journal.findTask("t1").orElseThrow().getStatus());

        task.start("pr_agent", Instant.now());
        store.record(task);
        assertEquals(TaskStatus.RUNNING, journal.findTask("t1").orElseThrow().getStatus());
    }
}
