package com.enterprise.orchestration.workflow;

import com.enterprise.orchestration.core.TaskSnapshot;

import java.util.List;

/**
 * Point-in-time view of a workflow and its tasks
 */
public class WorkflowStatusReport {

    private final String workflowId;
    private final String workflowType;
    private final WorkflowStatus status;
    private final List<TaskSnapshot> tasks;
    private final int completedTasks;
    private final int totalTasks;
    private final List<String> blockedTaskIds;

    public WorkflowStatusReport(String workflowId, String workflowType, WorkflowStatus status,
                                List<TaskSnapshot> tasks, int completedTasks, int totalTasks,
                                List<String> blockedTaskIds) {
        this.workflowId = workflowId;
        this.workflowType = workflowType;
        this.status = status;
        this.tasks = List.copyOf(tasks);
        this.completedTasks = completedTasks;
        this.totalTasks = totalTasks;
        this.blockedTaskIds = List.copyOf(blockedTaskIds);
    }

    public String getWorkflowId() { return workflowId; }
    public String getWorkflowType() { return workflowType; }
    public WorkflowStatus getStatus() { return status; }
    public List<TaskSnapshot> getTasks() { return tasks; }
    public int getCompletedTasks() { return completedTasks; }
    public int getTotalTasks() { return totalTasks; }

    /**
     * Pending tasks that can no longer become ready
     */
    public List<String> getBlockedTaskIds() { return blockedTaskIds; }

    public String getProgress() {
        return completedTasks + "/" + totalTasks + " tasks completed";
    }

    @Override
    public String toString() {
        return "WorkflowStatusReport{" +
                "workflowId='" + workflowId + '\'' +
                ", status=" + status +
                ", progress='" + getProgress() + '\'' +
                '}';
    }
}
