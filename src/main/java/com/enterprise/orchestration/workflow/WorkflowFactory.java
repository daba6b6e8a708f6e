package com.enterprise.orchestration.workflow;

import com.enterprise.orchestration.agent.AgentRegistry;
import com.enterprise.orchestration.core.Task;
import com.enterprise.orchestration.dependency.TaskDependency;
import com.enterprise.orchestration.exception.UnknownWorkflowTypeException;
import com.enterprise.orchestration.queue.TaskQueue;
import com.enterprise.orchestration.store.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Turns workflow requests into tasks. A request is expanded and checked in full
 * before anything is stored, so a rejected request leaves no trace.
 */
public class WorkflowFactory {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowFactory.class);

    private final TaskStore taskStore;
    private final TaskQueue taskQueue;
    private final AgentRegistry agentRegistry;
    private final WorkflowHistory history;
    private final Map<String, WorkflowTemplate> templates = new ConcurrentHashMap<>();

    public WorkflowFactory(TaskStore taskStore, TaskQueue taskQueue,
                           AgentRegistry agentRegistry, WorkflowHistory history) {
        this.taskStore = taskStore;
        this.taskQueue = taskQueue;
        this.agentRegistry = agentRegistry;
        this.history = history;

        for (WorkflowType type : WorkflowType.values()) {
            templates.put(type.getName(), type);
        }
    }

    /**
     * Register an additional workflow type, or replace an existing one
     */
    public void registerTemplate(WorkflowTemplate template) {
        WorkflowTemplate previous = templates.put(template.getName(), template);
        if (previous != null) {
            logger.info("Replaced workflow template: {}", template.getName());
        } else {
            logger.info("Registered workflow template: {}", template.getName());
        }
    }

    public boolean isKnownType(String workflowType) {
        return workflowType != null && templates.containsKey(workflowType);
    }

    public Set<String> getKnownTypes() {
        return Set.copyOf(templates.keySet());
    }

    /**
     * Expand, store and enqueue a workflow. Task {@code i} gets priority {@code basePriority + i}.
     *
     * @throws UnknownWorkflowTypeException if no template answers to {@code workflowType}
     * @throws IllegalArgumentException if the template rejects the parameters, or if the
     *         last task's priority would not fit in an {@code int}
     */
    public Workflow createWorkflow(String workflowType, Map<String, Object> parameters, int basePriority)
            throws UnknownWorkflowTypeException {
        WorkflowTemplate template = workflowType != null ? templates.get(workflowType) : null;
        if (template == null) {
            logger.warn("Rejected unknown workflow type {} (known types: {})", workflowType, getKnownTypes());
            throw new UnknownWorkflowTypeException(workflowType);
        }

        Map<String, Object> request = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
        List<TaskSpec> specs = template.expand(request);
        validate(workflowType, specs, basePriority);

        String workflowId = newWorkflowId();
        Instant now = Instant.now();
        List<Task> tasks = buildTasks(workflowId, specs, basePriority, now);

        // Every task must be in the store before any can be dispatched and resolved
        tasks.forEach(taskStore::add);
        for (Task task : tasks) {
            if (!agentRegistry.hasCapability(task.getType())) {
                logger.warn("No registered agent can execute {} (task {}); it will wait until one is registered",
                           task.getType(), task.getId());
            }
            taskQueue.enqueue(task.getId(), task.getPriority());
        }

        List<String> taskIds = new ArrayList<>();
        tasks.forEach(task -> taskIds.add(task.getId()));
        Workflow workflow = new Workflow(workflowId, workflowType, taskIds, now, request);
        history.add(workflow);

        logger.info("Created workflow {} ({}) with {} tasks", workflowId, workflowType, tasks.size());
        return workflow;
    }

    private void validate(String workflowType, List<TaskSpec> specs, int basePriority) {
        if (specs == null || specs.isEmpty()) {
            throw new IllegalArgumentException("Workflow type " + workflowType + " expanded to no tasks");
        }
        try {
            Math.addExact(basePriority, specs.size() - 1);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(String.format(
                "Base priority %d is too large for the %d tasks of %s", basePriority, specs.size(), workflowType), e);
        }
        for (int i = 0; i < specs.size(); i++) {
            TaskSpec step = specs.get(i);
            if (step.getType() == null) {
                throw new IllegalArgumentException("Step " + i + " of " + workflowType + " has no task type");
            }
            for (TaskSpec.Edge edge : step.getEdges()) {
                if (edge.getUpstreamIndex() < 0 || edge.getUpstreamIndex() >= i) {
                    throw new IllegalArgumentException(String.format(
                        "Step %d of %s depends on step %d; dependencies must point at earlier steps",
                        i, workflowType, edge.getUpstreamIndex()));
                }
            }
        }
    }

    private List<Task> buildTasks(String workflowId, List<TaskSpec> specs, int basePriority, Instant now) {
        List<String> ids = new ArrayList<>();
        Set<String> used = new HashSet<>();
        for (int i = 0; i < specs.size(); i++) {
            String id = workflowId + "_" + specs.get(i).getType().getTag();
            if (!used.add(id)) {
                id = id + "_" + i;
                used.add(id);
            }
            ids.add(id);
        }

        List<Task> tasks = new ArrayList<>();
        for (int i = 0; i < specs.size(); i++) {
            TaskSpec step = specs.get(i);
            Task.Builder builder = Task.builder()
                .id(ids.get(i))
                .workflowId(workflowId)
                .type(step.getType())
                .priority(basePriority + i)
                .createdAt(now)
                .parameters(new LinkedHashMap<>(step.getParameters()));
            for (TaskSpec.Edge edge : step.getEdges()) {
                builder.dependency(new TaskDependency(ids.get(edge.getUpstreamIndex()), edge.getBindings()));
            }
            tasks.add(builder.build());
        }
        return tasks;
    }

    private String newWorkflowId() {
        String id;
        do {
            id = "workflow_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        } while (history.contains(id));
        return id;
    }
}
