package com.enterprise.orchestration.workflow;

import com.enterprise.orchestration.core.TaskSnapshot;
import com.enterprise.orchestration.core.TaskStatus;
import com.enterprise.orchestration.exception.WorkflowNotFoundException;
import com.enterprise.orchestration.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Derives workflow status and progress from the current state of its tasks.
 * Nothing is cached; every call reads the store afresh.
 */
public class WorkflowStatusAggregator {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowStatusAggregator.class);

    private final WorkflowHistory history;
    private final TaskStore taskStore;

    public WorkflowStatusAggregator(WorkflowHistory history, TaskStore taskStore) {
        this.history = history;
        this.taskStore = taskStore;
    }

    public WorkflowStatusReport getWorkflowStatus(String workflowId) throws WorkflowNotFoundException {
        Workflow workflow = history.require(workflowId);

        List<TaskSnapshot> snapshots = new ArrayList<>();
        for (String taskId : workflow.getTaskIds()) {
            taskStore.get(taskId).ifPresentOrElse(
                task -> snapshots.add(task.snapshot()),
                () -> logger.error("Workflow {} references unknown task {}", workflowId, taskId));
        }

        int completed = 0;
        boolean anyFailed = false;
        List<String> blocked = new ArrayList<>();
        for (TaskSnapshot snapshot : snapshots) {
            if (snapshot.getStatus() == TaskStatus.COMPLETED) {
                completed++;
            } else if (snapshot.getStatus() == TaskStatus.FAILED) {
                anyFailed = true;
            } else if (snapshot.getStatus() == TaskStatus.PENDING && snapshot.getBlockedReason() != null) {
                blocked.add(snapshot.getTaskId());
            }
        }

        int total = workflow.getTaskIds().size();
        WorkflowStatus status = derive(anyFailed, completed, total);

        return new WorkflowStatusReport(workflowId, workflow.getWorkflowType(), status,
                                        snapshots, completed, total, blocked);
    }

    static WorkflowStatus derive(boolean anyFailed, int completed, int total) {
        if (anyFailed) {
            return WorkflowStatus.FAILED;
        }
        if (total > 0 && completed == total) {
            return WorkflowStatus.COMPLETED;
        }
        return WorkflowStatus.RUNNING;
    }
}
