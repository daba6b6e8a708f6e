package com.enterprise.orchestration.core;

import com.enterprise.orchestration.agent.AgentDescriptor;
import com.enterprise.orchestration.agent.AgentRegistry;
import com.enterprise.orchestration.agent.AgentStatus;
import com.enterprise.orchestration.agent.AgentStatusReport;
import com.enterprise.orchestration.config.OrchestratorConfig;
import com.enterprise.orchestration.dependency.DependencyResolver;
import com.enterprise.orchestration.exception.TaskNotFoundException;
import com.enterprise.orchestration.exception.UnknownWorkflowTypeException;
import com.enterprise.orchestration.exception.WorkflowNotFoundException;
import com.enterprise.orchestration.monitoring.HealthChecker;
import com.enterprise.orchestration.monitoring.MetricsCollector;
import com.enterprise.orchestration.queue.TaskQueue;
import com.enterprise.orchestration.store.TaskStore;
import com.enterprise.orchestration.workflow.Workflow;
import com.enterprise.orchestration.workflow.WorkflowFactory;
import com.enterprise.orchestration.workflow.WorkflowHistory;
import com.enterprise.orchestration.workflow.WorkflowStatusAggregator;
import com.enterprise.orchestration.workflow.WorkflowStatusReport;
import com.enterprise.orchestration.workflow.WorkflowTemplate;
import com.enterprise.orchestration.workflow.WorkflowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Main implementation of the Orchestrator.
 * <p>
 * One scheduler thread pops ready tasks, reserves an agent and hands the task to
 * the {@link AsyncTaskExecutor}. Completion callbacks run on worker threads; they
 * record the outcome, release the agent and propagate it along dependency edges.
 * Task state is guarded by each task's monitor, agent state by the registry lock
 * and the queue by its own lock.
 */
public class OrchestratorImpl implements Orchestrator {

    private static final Logger logger = LoggerFactory.getLogger(OrchestratorImpl.class);

    private final TaskStore taskStore;
    private final TaskQueue taskQueue;
    private final AgentRegistry agentRegistry;
    private final WorkflowHistory history;
    private final WorkflowFactory workflowFactory;
    private final WorkflowStatusAggregator statusAggregator;
    private final DependencyResolver dependencyResolver;
    private final AsyncTaskExecutor executor;
    private final OrchestratorConfig.SchedulerConfig schedulerConfig;
    private final Duration shutdownTimeout;
    private final MetricsCollector metricsCollector;
    private final HealthChecker healthChecker;

    private final Map<String, CompletableFuture<TaskResult>> runningTasks = new ConcurrentHashMap<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private final AtomicLong totalWorkflowsCreated = new AtomicLong(0);
    private final AtomicLong totalTasksDispatched = new AtomicLong(0);

    private volatile Instant startedAt;
    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> queueProcessor;
    private ScheduledFuture<?> heartbeatProcessor;

    public OrchestratorImpl(TaskStore taskStore, TaskQueue taskQueue, AgentRegistry agentRegistry,
                            WorkflowHistory history, AsyncTaskExecutor executor,
                            OrchestratorConfig.SchedulerConfig schedulerConfig, Duration shutdownTimeout,
                            MetricsCollector metricsCollector, boolean enableHealthChecks) {
        this.taskStore = taskStore;
        this.taskQueue = taskQueue;
        this.agentRegistry = agentRegistry;
        this.history = history;
        this.executor = executor;
        this.schedulerConfig = schedulerConfig;
        this.shutdownTimeout = shutdownTimeout;
        this.metricsCollector = metricsCollector;
        this.workflowFactory = new WorkflowFactory(taskStore, taskQueue, agentRegistry, history);
        this.statusAggregator = new WorkflowStatusAggregator(history, taskStore);
        this.dependencyResolver = new DependencyResolver(taskStore, taskQueue);
        this.healthChecker = enableHealthChecks ? new HealthChecker(this) : null;
    }

    @Override
    public String createWorkflow(String workflowType, Map<String, Object> parameters, int priority)
            throws UnknownWorkflowTypeException {
        if (stopped.get()) {
            throw new IllegalStateException("Orchestrator has been stopped");
        }

        Workflow workflow = workflowFactory.createWorkflow(workflowType, parameters, priority);
        totalWorkflowsCreated.incrementAndGet();
        if (metricsCollector != null) {
            metricsCollector.recordWorkflowCreated(workflowType);
            metricsCollector.updateQueueSize(taskQueue.size());
        }
        return workflow.getWorkflowId();
    }

    @Override
    public String createWorkflow(WorkflowType workflowType, Map<String, Object> parameters, int priority) {
        try {
            return createWorkflow(workflowType.getName(), parameters, priority);
        } catch (UnknownWorkflowTypeException e) {
            // built-in types are registered by the factory itself
            throw new IllegalStateException("Built-in workflow type missing: " + workflowType, e);
        }
    }

    @Override
    public WorkflowStatusReport getWorkflowStatus(String workflowId) throws WorkflowNotFoundException {
        return statusAggregator.getWorkflowStatus(workflowId);
    }

    @Override
    public List<Workflow> getWorkflowHistory() {
        return history.getAll();
    }

    @Override
    public TaskSnapshot getTask(String taskId) throws TaskNotFoundException {
        return taskStore.require(taskId).snapshot();
    }

    @Override
    public AgentStatusReport getAgentStatus() {
        return agentRegistry.getStatusReport();
    }

    @Override
    public QueueStatusReport getTaskQueueStatus() {
        Map<TaskStatus, Long> counts = taskStore.countByStatus();
        return new QueueStatusReport(
            taskQueue.size(),
            taskQueue.parkedCount(),
            counts.get(TaskStatus.PENDING),
            counts.get(TaskStatus.RUNNING),
            counts.get(TaskStatus.COMPLETED),
            counts.get(TaskStatus.FAILED),
            taskStore.size()
        );
    }

    @Override
    public void registerAgent(AgentDescriptor agent) {
        agentRegistry.register(agent);
    }

    @Override
    public void setAgentOnline(String agentId) {
        agentRegistry.setOnline(agentId, true);
    }

    @Override
    public void setAgentOffline(String agentId) {
        agentRegistry.setOnline(agentId, false);
    }

    @Override
    public void registerWorkflowTemplate(WorkflowTemplate template) {
        workflowFactory.registerTemplate(template);
    }

    @Override
    public void start() {
        if (stopped.get()) {
            throw new IllegalStateException("Orchestrator has been stopped and cannot be restarted");
        }
        if (running.compareAndSet(false, true)) {
            logger.info("Starting Orchestrator...");
            startedAt = Instant.now();

            scheduler = Executors.newScheduledThreadPool(2, r -> {
                Thread t = new Thread(r, "orchestrator-scheduler");
                t.setDaemon(true);
                return t;
            });

            queueProcessor = scheduler.scheduleWithFixedDelay(
                this::processQueue, 0, schedulerConfig.getTickInterval().toMillis(), TimeUnit.MILLISECONDS);

            heartbeatProcessor = scheduler.scheduleWithFixedDelay(
                this::refreshHeartbeats, 0, schedulerConfig.getHeartbeatInterval().toMillis(), TimeUnit.MILLISECONDS);

            logger.info("Orchestrator started with {} agents", agentRegistry.size());
        }
    }

    @Override
    public CompletableFuture<Void> stop() {
        return CompletableFuture.runAsync(() -> {
            if (!stopped.compareAndSet(false, true)) {
                return;
            }
            logger.info("Stopping Orchestrator...");
            running.set(false);

            if (queueProcessor != null) {
                queueProcessor.cancel(false);
            }
            if (heartbeatProcessor != null) {
                heartbeatProcessor.cancel(false);
            }

            if (scheduler != null) {
                scheduler.shutdown();
                try {
                    if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                        scheduler.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    scheduler.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }

            // Dispatched tasks are allowed to finish so their callbacks still run
            executor.shutdown(shutdownTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!runningTasks.isEmpty()) {
                logger.warn("{} tasks were still running at shutdown: {}", runningTasks.size(), runningTasks.keySet());
            }

            taskStore.close();
            logger.info("Orchestrator stopped");
        });
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public OrchestratorStatistics getStatistics() {
        AsyncTaskExecutor.ExecutorStatistics executorStats = executor.getStatistics();
        Instant started = startedAt;

        return new OrchestratorStatistics() {
            @Override
            public long getTotalWorkflowsCreated() {
                return totalWorkflowsCreated.get();
            }

            @Override
            public long getTotalTasksDispatched() {
                return totalTasksDispatched.get();
            }

            @Override
            public long getTotalTasksCompleted() {
                return executorStats.getTotalTasksCompleted();
            }

            @Override
            public long getTotalTasksFailed() {
                return executorStats.getTotalTasksFailed();
            }

            @Override
            public double getAverageExecutionTimeMs() {
                return executorStats.getAverageExecutionTimeMs();
            }

            @Override
            public long getUptimeMs() {
                return started != null ? Instant.now().toEpochMilli() - started.toEpochMilli() : 0;
            }

            @Override
            public Instant getStartedAt() {
                return started;
            }

            @Override
            public Map<TaskStatus, Long> getTaskCountsByStatus() {
                return taskStore.countByStatus();
            }

            @Override
            public int getQueueSize() {
                return taskQueue.size();
            }

            @Override
            public int getActiveThreadCount() {
                return executorStats.getActiveThreadCount();
            }
        };
    }

    @Override
    public CompletableFuture<HealthChecker.HealthStatus> checkHealth() {
        if (healthChecker == null) {
            return CompletableFuture.completedFuture(HealthChecker.HealthStatus.builder()
                .addCheck("health.enabled", true, "Health checks are disabled")
                .build());
        }
        return healthChecker.performHealthCheck();
    }

    /**
     * One scheduler tick. Dispatches up to {@code maxDispatchesPerTick} tasks; entries
     * with no available agent go back to the queue once the tick is over, so each
     * tick sees every queued task at most once.
     */
    void processQueue() {
        List<TaskQueue.QueueEntry> deferred = new ArrayList<>();
        try {
            int dispatched = 0;
            while (running.get() && dispatched < schedulerConfig.getMaxDispatchesPerTick()) {
                Optional<TaskQueue.QueueEntry> next = taskQueue.poll();
                if (next.isEmpty()) {
                    break;
                }
                TaskQueue.QueueEntry entry = next.get();
                try {
                    if (processEntry(entry, deferred)) {
                        dispatched++;
                    }
                } catch (Exception e) {
                    logger.error("Error dispatching task {}", entry.getTaskId(), e);
                    taskStore.get(entry.getTaskId())
                        .filter(task -> task.getStatus() == TaskStatus.PENDING)
                        .ifPresent(task -> deferred.add(entry));
                }
            }
        } catch (Exception e) {
            logger.error("Error processing queue", e);
        } finally {
            deferred.forEach(taskQueue::requeue);
            updateGauges();
        }
    }

    /**
     * @return whether the task was handed to the executor
     */
    private boolean processEntry(TaskQueue.QueueEntry entry, List<TaskQueue.QueueEntry> deferred) {
        Optional<Task> found = taskStore.get(entry.getTaskId());
        if (found.isEmpty()) {
            logger.error("Queued task {} is not in the task store; dropping entry", entry.getTaskId());
            return false;
        }
        Task task = found.get();

        if (task.getStatus() != TaskStatus.PENDING) {
            logger.debug("Skipping task {} in status {}", task.getId(), task.getStatus());
            return false;
        }

        if (taskQueue.parkIfNotReady(entry, task::isReady)) {
            logger.debug("Task {} parked until its dependencies resolve", task.getId());
            return false;
        }

        Optional<String> reserved = agentRegistry.selectAndReserve(task.getType(), task.getId());
        if (reserved.isEmpty()) {
            int attempts = task.recordDispatchAttempt();
            if (attempts == 1 || attempts % schedulerConfig.getNoAgentWarningInterval() == 0) {
                logger.warn("No available agent for task {} ({}), attempt {}", task.getId(), task.getType(), attempts);
            }
            if (metricsCollector != null) {
                metricsCollector.recordNoAgentDeferral(task);
            }
            deferred.add(entry);
            return false;
        }

        String agentId = reserved.get();
        try {
            task.start(agentId, Instant.now());
        } catch (IllegalStateException e) {
            agentRegistry.release(agentId, task.getId());
            logger.warn("Task {} could not be started: {}", task.getId(), e.getMessage());
            return false;
        }
        taskStore.record(task);
        totalTasksDispatched.incrementAndGet();
        if (metricsCollector != null) {
            metricsCollector.recordTaskDispatched(task);
        }
        logger.info("Assigned task {} ({}) to agent {}", task.getId(), task.getType(), agentId);

        dispatch(task, agentId);
        return true;
    }

    private void dispatch(Task task, String agentId) {
        CompletableFuture<TaskResult> future;
        try {
            future = executor.execute(task);
        } catch (RejectedExecutionException e) {
            handleCompletion(task, agentId, TaskResult.failure(task.getType().getOperationName(),
                "Dispatch rejected: " + e.getMessage(), e, 0));
            return;
        }

        runningTasks.put(task.getId(), future);
        future.whenComplete((result, throwable) -> {
            TaskResult outcome = throwable != null
                ? TaskResult.failure(task.getType().getOperationName(), throwable.getMessage(), throwable, 0)
                : result;
            handleCompletion(task, agentId, outcome);
        });
    }

    /**
     * Completion callback: record the outcome, release the agent, then resolve
     * or block the task's dependents.
     */
    private void handleCompletion(Task task, String agentId, TaskResult result) {
        Instant now = Instant.now();
        try {
            if (result.isSuccess()) {
                task.complete(result.getData().orElse(Map.of()), now);
                logger.info("Task {} completed by agent {}", task.getId(), agentId);
                if (metricsCollector != null) {
                    metricsCollector.recordTaskCompleted(task, result.getDurationMs());
                }
            } else {
                String error = result.getErrorMessage() != null ? result.getErrorMessage() : "Task execution failed";
                task.fail(error, now);
                logger.error("Task {} failed on agent {}: {}", task.getId(), agentId, error);
                if (metricsCollector != null) {
                    metricsCollector.recordTaskFailed(task, result.getDurationMs());
                }
            }
            taskStore.record(task);
        } catch (Exception e) {
            logger.error("Error recording outcome of task {}", task.getId(), e);
        } finally {
            agentRegistry.release(agentId, task.getId());
            runningTasks.remove(task.getId());
        }

        try {
            if (task.getStatus() == TaskStatus.COMPLETED) {
                dependencyResolver.resolve(task);
            } else if (task.getStatus() == TaskStatus.FAILED) {
                dependencyResolver.blockDependents(task);
            }
        } catch (Exception e) {
            logger.error("Error propagating outcome of task {}", task.getId(), e);
        }
    }

    private void refreshHeartbeats() {
        try {
            agentRegistry.refreshHeartbeats();
        } catch (Exception e) {
            logger.error("Error refreshing agent heartbeats", e);
        }
    }

    private void updateGauges() {
        if (metricsCollector != null) {
            metricsCollector.updateQueueSize(taskQueue.size());
            metricsCollector.updateParkedTasks(taskQueue.parkedCount());
            metricsCollector.updateBusyAgents(agentRegistry.countByStatus(AgentStatus.BUSY));
        }
    }
}
