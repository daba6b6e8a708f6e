package com.enterprise.orchestration.dependency;

import com.enterprise.orchestration.core.Task;
import com.enterprise.orchestration.core.TaskStatus;
import com.enterprise.orchestration.queue.TaskQueue;
import com.enterprise.orchestration.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Propagates task outcomes along dependency edges.
 * A completed upstream fills in bound parameters of its pending dependents and
 * releases them to the queue once nothing else is outstanding. A failed upstream
 * marks its dependents, transitively, as blocked; they stay pending.
 */
public class DependencyResolver {

    private static final Logger logger = LoggerFactory.getLogger(DependencyResolver.class);

    private final TaskStore taskStore;
    private final TaskQueue taskQueue;

    public DependencyResolver(TaskStore taskStore, TaskQueue taskQueue) {
        this.taskStore = taskStore;
        this.taskQueue = taskQueue;
    }

    /**
     * Resolve every pending dependency on a completed task. Safe to call repeatedly.
     *
     * @return number of dependencies newly resolved by this call
     */
    public int resolve(Task completedTask) {
        if (completedTask.getStatus() != TaskStatus.COMPLETED) {
            logger.debug("Task {} is {}, nothing to resolve", completedTask.getId(), completedTask.getStatus());
            return 0;
        }

        Map<String, Object> result = completedTask.getResult().orElse(Map.of());
        int resolved = 0;

        for (Task dependent : taskStore.getPendingDependents(completedTask.getId())) {
            if (dependent.resolveDependency(completedTask.getId(), result)) {
                resolved++;
                taskStore.record(dependent);
                logger.info("Resolved dependency of task {} on {}", dependent.getId(), completedTask.getId());

                if (!dependent.hasUnresolvedDependencies()) {
                    taskQueue.unpark(dependent.getId());
                }
            } else if (dependent.getBlockedReason() != null) {
                logger.warn("Task {} cannot be resolved: {}", dependent.getId(), dependent.getBlockedReason());
                taskStore.record(dependent);
                blockDependents(dependent, "Upstream task " + dependent.getId() + " is blocked");
            }
        }

        return resolved;
    }

    /**
     * Mark every pending task downstream of a failed task as blocked
     *
     * @return number of tasks marked
     */
    public int blockDependents(Task failedTask) {
        String reason = String.format("Upstream task %s failed: %s", failedTask.getId(), failedTask.getErrorMessage());
        return blockDependents(failedTask, reason);
    }

    private int blockDependents(Task root, String reason) {
        Set<String> visited = new HashSet<>();
        Deque<Task> frontier = new ArrayDeque<>();
        frontier.push(root);
        int blocked = 0;

        while (!frontier.isEmpty()) {
            Task upstream = frontier.pop();
            for (Task dependent : taskStore.getPendingDependents(upstream.getId())) {
                if (!visited.add(dependent.getId())) {
                    continue;
                }
                String dependentReason = upstream == root
                    ? reason
                    : "Upstream task " + upstream.getId() + " is blocked";
                dependent.block(dependentReason);
                taskStore.record(dependent);
                blocked++;
                logger.warn("Task {} is blocked: {}", dependent.getId(), dependentReason);
                frontier.push(dependent);
            }
        }

        return blocked;
    }
}
