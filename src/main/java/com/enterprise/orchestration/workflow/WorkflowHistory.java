package com.enterprise.orchestration.workflow;

import com.enterprise.orchestration.exception.WorkflowNotFoundException;
import com.enterprise.orchestration.store.TaskJournal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Append-only list of every workflow created in this process, in creation order
 */
public class WorkflowHistory {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowHistory.class);

    private final List<Workflow> workflows = new CopyOnWriteArrayList<>();
    private final Map<String, Workflow> byId = new ConcurrentHashMap<>();
    private final TaskJournal journal;

    public WorkflowHistory(TaskJournal journal) {
        this.journal = journal;
    }

    public WorkflowHistory() {
        this(null);
    }

    public void add(Workflow workflow) {
        if (byId.putIfAbsent(workflow.getWorkflowId(), workflow) != null) {
            throw new IllegalArgumentException("Duplicate workflow id: " + workflow.getWorkflowId());
        }
        workflows.add(workflow);
        if (journal != null) {
            journal.recordWorkflow(workflow);
        }
        logger.debug("Workflow {} appended to history", workflow.getWorkflowId());
    }

    public boolean contains(String workflowId) {
        return byId.containsKey(workflowId);
    }

    public Workflow require(String workflowId) throws WorkflowNotFoundException {
        Workflow workflow = byId.get(workflowId);
        if (workflow == null) {
            throw new WorkflowNotFoundException(workflowId);
        }
        return workflow;
    }

    public List<Workflow> getAll() {
        return new ArrayList<>(workflows);
    }

    public int size() {
        return workflows.size();
    }
}
