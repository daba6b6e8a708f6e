package com.enterprise.orchestration.core;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of task types an agent can be capable of.
 * Each type maps to the operation name understood by the task executor service.
 */
public enum TaskType {
    CREATE_PR("create_pr", "create_pull_request"),
    MERGE_PR("merge_pr", "merge_pull_request"),
    LIST_PRS("list_prs", "list_pull_requests"),
    GENERATE_REPORT("generate_report", "generate_report"),
    CREATE_LOCAL_URL("create_local_url", "create_local_url"),
    SAVE_REPORT("save_report", "save_report"),
    CREATE_BRANCH("create_branch", "create_branch"),
    CREATE_BRANCH_FROM_BASE("create_branch_from_base", "create_branch_from_base"),
    CHECKOUT_BRANCH("checkout_branch", "checkout_branch"),
    PUSH_BRANCH("push_branch", "push_branch"),
    DELETE_BRANCH("delete_branch", "delete_branch"),
    LIST_BRANCHES("list_branches", "list_branches");
    
    private final String tag;
    private final String operationName;
    
    TaskType(String tag, String operationName) {
        this.tag = tag;
        this.operationName = operationName;
    }
    
    /**
     * Short tag used in task ids and request payloads
     */
    public String getTag() {
        return tag;
    }
    
    /**
     * Operation name sent to the task executor service
     */
    public String getOperationName() {
        return operationName;
    }
    
    public static Optional<TaskType> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(type -> type.tag.equalsIgnoreCase(tag) || type.name().equalsIgnoreCase(tag))
            .findFirst();
    }
}
