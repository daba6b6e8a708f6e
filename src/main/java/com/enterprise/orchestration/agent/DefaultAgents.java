package com.enterprise.orchestration.agent;

import com.enterprise.orchestration.core.TaskType;

import java.util.EnumSet;
import java.util.List;

/**
 * The standard roster: one agent per concern
 */
public final class DefaultAgents {
    
    public static final String PR_AGENT = "pr_agent";
    public static final String REPORT_AGENT = "report_agent";
    public static final String BRANCH_AGENT = "branch_agent";
    
    private DefaultAgents() {
    }
    
    public static List<AgentDescriptor> roster() {
        return List.of(
            new AgentDescriptor(PR_AGENT, "Pull Request Agent",
                EnumSet.of(TaskType.CREATE_PR, TaskType.MERGE_PR, TaskType.LIST_PRS)),
            new AgentDescriptor(REPORT_AGENT, "Report Agent",
                EnumSet.of(TaskType.GENERATE_REPORT, TaskType.CREATE_LOCAL_URL, TaskType.SAVE_REPORT)),
            new AgentDescriptor(BRANCH_AGENT, "Branch Agent",
                EnumSet.of(TaskType.CREATE_BRANCH, TaskType.CREATE_BRANCH_FROM_BASE, TaskType.CHECKOUT_BRANCH,
                           TaskType.PUSH_BRANCH, TaskType.DELETE_BRANCH, TaskType.LIST_BRANCHES))
        );
    }
}
