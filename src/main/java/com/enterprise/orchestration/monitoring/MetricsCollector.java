package com.enterprise.orchestration.monitoring;

import com.enterprise.orchestration.core.Task;
import com.enterprise.orchestration.core.TaskType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects and exposes metrics for the orchestrator
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> taskTypeCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> workflowTypeCounters = new ConcurrentHashMap<>();

    private final Counter workflowsCreated;
    private final Counter tasksDispatched;
    private final Counter tasksCompleted;
    private final Counter tasksFailed;
    private final Counter tasksDeferred;

    private final Timer taskExecutionTime;

    private final AtomicLong queueSize = new AtomicLong(0);
    private final AtomicLong parkedTasks = new AtomicLong(0);
    private final AtomicLong busyAgents = new AtomicLong(0);

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.workflowsCreated = Counter.builder("orchestrator.workflows.created")
            .description("Total number of workflows created")
            .register(meterRegistry);

        this.tasksDispatched = Counter.builder("orchestrator.tasks.dispatched")
            .description("Total number of tasks assigned to an agent and dispatched")
            .register(meterRegistry);

        this.tasksCompleted = Counter.builder("orchestrator.tasks.completed")
            .description("Total number of tasks completed successfully")
            .register(meterRegistry);

        this.tasksFailed = Counter.builder("orchestrator.tasks.failed")
            .description("Total number of tasks that failed")
            .register(meterRegistry);

        this.tasksDeferred = Counter.builder("orchestrator.tasks.deferred")
            .description("Dispatch attempts deferred because no agent was available")
            .register(meterRegistry);

        this.taskExecutionTime = Timer.builder("orchestrator.task.execution.time")
            .description("Remote operation time measured by the executor, from dispatch to result")
            .register(meterRegistry);

        Gauge.builder("orchestrator.queue.size", queueSize, AtomicLong::get)
            .description("Tasks waiting in the ready queue")
            .register(meterRegistry);

        Gauge.builder("orchestrator.queue.parked", parkedTasks, AtomicLong::get)
            .description("Tasks parked until their dependencies resolve")
            .register(meterRegistry);

        Gauge.builder("orchestrator.agents.busy", busyAgents, AtomicLong::get)
            .description("Agents currently executing a task")
            .register(meterRegistry);

        logger.info("MetricsCollector initialized");
    }

    public void recordWorkflowCreated(String workflowType) {
        workflowsCreated.increment();
        workflowTypeCounters.computeIfAbsent(workflowType, type ->
            Counter.builder("orchestrator.workflow.type")
                .tag("type", type)
                .description("Workflows created by type")
                .register(meterRegistry)
        ).increment();
    }

    public void recordTaskDispatched(Task task) {
        tasksDispatched.increment();
        getTaskTypeCounter(task.getType(), "dispatched").increment();
    }

    public void recordTaskCompleted(Task task, long executionTimeMs) {
        tasksCompleted.increment();
        getTaskTypeCounter(task.getType(), "completed").increment();
        taskExecutionTime.record(executionTimeMs, TimeUnit.MILLISECONDS);

        logger.debug("Recorded task completion: {} in {}ms", task.getId(), executionTimeMs);
    }

    public void recordTaskFailed(Task task, long executionTimeMs) {
        tasksFailed.increment();
        getTaskTypeCounter(task.getType(), "failed").increment();
        taskExecutionTime.record(executionTimeMs, TimeUnit.MILLISECONDS);

        logger.debug("Recorded task failure: {}", task.getId());
    }

    public void recordNoAgentDeferral(Task task) {
        tasksDeferred.increment();
        getTaskTypeCounter(task.getType(), "deferred").increment();
    }

    public void updateQueueSize(int size) {
        queueSize.set(size);
    }

    public void updateParkedTasks(int count) {
        parkedTasks.set(count);
    }

    public void updateBusyAgents(int count) {
        busyAgents.set(count);
    }

    private Counter getTaskTypeCounter(TaskType taskType, String outcome) {
        String key = taskType.getTag() + "." + outcome;
        return taskTypeCounters.computeIfAbsent(key, k ->
            Counter.builder("orchestrator.task.type")
                .tag("type", taskType.getTag())
                .tag("outcome", outcome)
                .description("Task count by type and outcome")
                .register(meterRegistry)
        );
    }

    /**
     * Get all metrics as a map
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();

        metrics.put("workflows.created", workflowsCreated.count());
        metrics.put("tasks.dispatched", tasksDispatched.count());
        metrics.put("tasks.completed", tasksCompleted.count());
        metrics.put("tasks.failed", tasksFailed.count());
        metrics.put("tasks.deferred", tasksDeferred.count());

        metrics.put("task.execution.time.mean", taskExecutionTime.mean(TimeUnit.MILLISECONDS));
        metrics.put("task.execution.time.max", taskExecutionTime.max(TimeUnit.MILLISECONDS));

        metrics.put("queue.size", queueSize.get());
        metrics.put("queue.parked", parkedTasks.get());
        metrics.put("agents.busy", busyAgents.get());

        return metrics;
    }
}
