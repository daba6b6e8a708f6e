package com.enterprise.orchestration.store;

import com.enterprise.orchestration.core.Task;
import com.enterprise.orchestration.core.TaskStatus;
import com.enterprise.orchestration.exception.TaskNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Every task ever created, keyed by id. Tasks are never removed.
 * When a journal is configured, each recorded change is written through to it.
 */
public class TaskStore {

    private static final Logger logger = LoggerFactory.getLogger(TaskStore.class);

    private final Map<String, Task> tasks = new ConcurrentHashMap<>();
    private final TaskJournal journal;
    private final Object journalLock = new Object();

    public TaskStore(TaskJournal journal) {
        this.journal = journal;
    }

    public TaskStore() {
        this(null);
    }

    public void add(Task task) {
        Task existing = tasks.putIfAbsent(task.getId(), task);
        if (existing != null) {
            throw new IllegalArgumentException("Duplicate task id: " + task.getId());
        }
        record(task);
        logger.debug("Stored task {} ({})", task.getId(), task.getType());
    }

    public Optional<Task> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public Task require(String taskId) throws TaskNotFoundException {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    public List<Task> getAll() {
        return new ArrayList<>(tasks.values());
    }

    /**
     * Pending tasks that still wait on the given upstream task
     */
    public List<Task> getPendingDependents(String upstreamTaskId) {
        return tasks.values().stream()
            .filter(task -> task.getStatus() == TaskStatus.PENDING)
            .filter(task -> task.isWaitingOn(upstreamTaskId))
            .collect(Collectors.toList());
    }

    public Map<TaskStatus, Long> countByStatus() {
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0L);
        }
        tasks.values().forEach(task -> counts.merge(task.getStatus(), 1L, Long::sum));
        return counts;
    }

    public int size() {
        return tasks.size();
    }

    /**
     * Write the task's current state to the journal, if any. The snapshot is
     * taken under the same lock as the write, so journal writes land in the
     * order the task's states were observed.
     */
    public void record(Task task) {
        if (journal != null) {
            synchronized (journalLock) {
                journal.recordTask(task.snapshot());
            }
        }
    }

    public void close() {
        if (journal != null) {
            journal.close();
        }
    }
}
