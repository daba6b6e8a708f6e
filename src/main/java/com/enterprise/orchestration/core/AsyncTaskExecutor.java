package com.enterprise.orchestration.core;

import com.enterprise.orchestration.exception.ExecutionFailedException;
import com.enterprise.orchestration.gateway.TaskExecutorGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs gateway calls for dispatched tasks on a worker pool, bounded by a timeout,
 * so the scheduler loop never waits on a remote call.
 */
public class AsyncTaskExecutor {

    private static final Logger logger = LoggerFactory.getLogger(AsyncTaskExecutor.class);

    private final ThreadPoolExecutor executor;
    private final TaskExecutorGateway gateway;
    private final long timeoutMs;
    private final AtomicLong totalTasksExecuted = new AtomicLong(0);
    private final AtomicLong totalTasksCompleted = new AtomicLong(0);
    private final AtomicLong totalTasksFailed = new AtomicLong(0);
    private final AtomicLong totalExecutionTime = new AtomicLong(0);

    public AsyncTaskExecutor(TaskExecutorGateway gateway, long timeoutMs,
                           int corePoolSize, int maximumPoolSize,
                           long keepAliveTime, TimeUnit unit,
                           BlockingQueue<Runnable> workQueue) {
        this.gateway = gateway;
        this.timeoutMs = timeoutMs;
        this.executor = new ThreadPoolExecutor(
            corePoolSize,
            maximumPoolSize,
            keepAliveTime,
            unit,
            workQueue,
            new TaskThreadFactory(),
            new TaskRejectedExecutionHandler()
        );

        logger.info("AsyncTaskExecutor initialized with core={}, max={}, timeout={}ms",
                   corePoolSize, maximumPoolSize, timeoutMs);
    }

    /**
     * Execute a task's remote operation asynchronously. The returned future always
     * completes normally; timeouts and gateway errors become failed results.
     *
     * @throws RejectedExecutionException if the pool cannot accept more work
     */
    public CompletableFuture<TaskResult> execute(Task task) {
        totalTasksExecuted.incrementAndGet();
        TaskType taskType = task.getType();
        String operation = taskType.getOperationName();
        Map<String, Object> arguments = task.getParameters();
        long startTime = System.currentTimeMillis();

        return CompletableFuture.supplyAsync(() -> {
                logger.debug("Executing task {} as {}", task.getId(), operation);
                try {
                    return gateway.execute(taskType, arguments);
                } catch (ExecutionFailedException e) {
                    throw new CompletionException(e);
                }
            }, executor)
            .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
            .handle((result, throwable) -> {
                long executionTime = System.currentTimeMillis() - startTime;
                totalExecutionTime.addAndGet(executionTime);

                if (throwable != null) {
                    totalTasksFailed.incrementAndGet();
                    Throwable cause = throwable instanceof CompletionException && throwable.getCause() != null
                        ? throwable.getCause()
                        : throwable;
                    if (cause instanceof TimeoutException) {
                        logger.error("Task {} timed out after {}ms", task.getId(), executionTime);
                        return TaskResult.failure(operation, "Task execution timed out after " + timeoutMs + "ms", cause, executionTime);
                    }
                    logger.error("Task {} execution failed", task.getId(), cause);
                    return TaskResult.failure(operation, cause.getMessage(), cause, executionTime);
                }
                if (result == null) {
                    totalTasksFailed.incrementAndGet();
                    return TaskResult.failure(operation, "Gateway returned no result for " + operation, null, executionTime);
                }

                if (result.isSuccess()) {
                    totalTasksCompleted.incrementAndGet();
                    logger.debug("Task {} completed successfully in {}ms", task.getId(), executionTime);
                } else {
                    totalTasksFailed.incrementAndGet();
                    logger.warn("Task {} failed: {}", task.getId(), result.getErrorMessage());
                }
                return result.withDuration(executionTime);
            });
    }

    /**
     * Get executor statistics
     */
    public ExecutorStatistics getStatistics() {
        return new ExecutorStatistics() {
            @Override
            public long getTotalTasksExecuted() {
                return totalTasksExecuted.get();
            }

            @Override
            public long getTotalTasksCompleted() {
                return totalTasksCompleted.get();
            }

            @Override
            public long getTotalTasksFailed() {
                return totalTasksFailed.get();
            }

            @Override
            public double getAverageExecutionTimeMs() {
                long executed = totalTasksExecuted.get();
                return executed > 0 ? (double) totalExecutionTime.get() / executed : 0.0;
            }

            @Override
            public int getActiveThreadCount() {
                return executor.getActiveCount();
            }

            @Override
            public int getQueueSize() {
                return executor.getQueue().size();
            }
        };
    }

    /**
     * Shutdown the executor gracefully
     */
    public void shutdown(long timeout, TimeUnit unit) {
        logger.info("Shutting down AsyncTaskExecutor...");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(timeout, unit)) {
                logger.warn("Executor did not terminate gracefully, forcing shutdown");
                executor.shutdownNow();
            }
            logger.info("AsyncTaskExecutor shutdown completed");
        } catch (InterruptedException e) {
            logger.error("Interrupted during shutdown", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Check if executor is running
     */
    public boolean isRunning() {
        return !executor.isShutdown() && !executor.isTerminated();
    }

    /**
     * Thread factory for dispatch threads
     */
    private static class TaskThreadFactory implements ThreadFactory {
        private final AtomicLong threadNumber = new AtomicLong(1);
        private final String namePrefix = "task-dispatch-";

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    private static class TaskRejectedExecutionHandler implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            logger.error("Task dispatch rejected - thread pool is full and queue is full");
            throw new RejectedExecutionException("Task dispatch rejected - system overloaded");
        }
    }

    /**
     * Statistics interface for the executor
     */
    public interface ExecutorStatistics {
        long getTotalTasksExecuted();
        long getTotalTasksCompleted();
        long getTotalTasksFailed();
        double getAverageExecutionTimeMs();
        int getActiveThreadCount();
        int getQueueSize();
    }
}
