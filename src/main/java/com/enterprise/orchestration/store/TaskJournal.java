package com.enterprise.orchestration.store;

import com.enterprise.orchestration.core.TaskSnapshot;
import com.enterprise.orchestration.workflow.Workflow;

import java.util.List;
import java.util.Optional;

/**
 * Durable audit trail of task and workflow state.
 * The latest snapshot of each task overwrites the previous one.
 */
public interface TaskJournal {
    
    /**
     * Persist the current state of a task
     */
    void recordTask(TaskSnapshot snapshot);
    
    /**
     * Persist a newly created workflow
     */
    void recordWorkflow(Workflow workflow);
    
    /**
     * Latest persisted snapshot of a task
     */
    Optional<TaskSnapshot> findTask(String taskId);
    
    /**
     * All persisted task snapshots
     */
    List<TaskSnapshot> loadTasks();
    
    /**
     * All persisted workflows
     */
    List<Workflow> loadWorkflows();
    
    /**
     * Closes the journal and releases resources
     */
    void close();
}
