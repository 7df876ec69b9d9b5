package com.panda.stackdeployer.feature.stack.infrastructure;

import com.panda.stackdeployer.feature.stack.exception.StackOperationInProgressException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import jakarta.annotation.PreDestroy;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs stack operations in the background.
 *
 * Operations are keyed by operation id. A stack (deploy name) runs at most one operation
 * at a time: submitting another while one is in flight is rejected, and the stack is only
 * released once the running task has unwound, including its change set cleanup.
 */
@Slf4j
@Component
public class StackOperationExecutor {

    private static final int CORE_POOL_SIZE = 4;
    private static final int MAX_POOL_SIZE = 8;
    private static final long KEEP_ALIVE_TIME = 60; // seconds

    private final ExecutorService executorService;
    private final long operationTimeoutMinutes;

    // operationId -> future
    private final Map<String, CompletableFuture<Void>> operationFutures = new ConcurrentHashMap<>();

    // deployName -> operationId holding the stack
    private final Map<String, String> runningByDeployName = new ConcurrentHashMap<>();

    public StackOperationExecutor(@Value("${stack.deploy.operation-timeout-minutes:120}") long operationTimeoutMinutes) {
        this.operationTimeoutMinutes = operationTimeoutMinutes;
        this.executorService = new ThreadPoolExecutor(
                CORE_POOL_SIZE,
                MAX_POOL_SIZE,
                KEEP_ALIVE_TIME,
                TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(50),
                new ThreadFactory() {
                    private final AtomicInteger count = new AtomicInteger(0);

                    @Override
                    public Thread newThread(Runnable r) {
                        Thread t = new Thread(r);
                        t.setName("stack-operation-" + count.incrementAndGet());
                        t.setDaemon(false);
                        return t;
                    }
                },
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        log.info("StackOperationExecutor initialized with pool size: {}-{}", CORE_POOL_SIZE, MAX_POOL_SIZE);
    }

    /**
     * Submits an operation on a stack.
     *
     * @throws StackOperationInProgressException if the stack already has an operation running
     */
    public CompletableFuture<Void> execute(String operationId, String deployName, Runnable task) {
        String holder = runningByDeployName.putIfAbsent(deployName, operationId);
        if (holder != null) {
            log.warn("Rejected operation {} on {}: operation {} is still running", operationId, deployName, holder);
            throw new StackOperationInProgressException(deployName, holder);
        }

        try {
            CompletableFuture<Void> future = new CompletableFuture<>();
            operationFutures.put(operationId, future);
            AtomicBoolean started = new AtomicBoolean(false);

            Future<?> running = executorService.submit(() -> {
                started.set(true);
                Exception failure = null;
                try {
                    log.info("Operation {} on {} started in thread: {}",
                            operationId, deployName, Thread.currentThread().getName());
                    task.run();
                } catch (Exception e) {
                    failure = e;
                } finally {
                    release(operationId, deployName);
                }
                if (failure == null) {
                    future.complete(null);
                } else {
                    future.completeExceptionally(failure);
                }
            });

            future.orTimeout(operationTimeoutMinutes, TimeUnit.MINUTES)
                    .whenComplete((result, exception) -> {
                        if (exception instanceof TimeoutException) {
                            log.error("Operation {} on {} timed out after {} minutes",
                                    operationId, deployName, operationTimeoutMinutes);
                            running.cancel(true);
                        } else if (future.isCancelled()) {
                            // cancelling the future interrupts the worker thread
                            running.cancel(true);
                        }
                        // a task cancelled before it started never reaches its finally block
                        if (!started.get()) {
                            release(operationId, deployName);
                        }
                    });

            log.info("Operation {} on {} submitted to executor service", operationId, deployName);
            return future;

        } catch (RejectedExecutionException e) {
            release(operationId, deployName);
            log.error("Failed to submit operation {} on {} due to executor rejection", operationId, deployName, e);
            throw new IllegalStateException("Stack operation queue is full. Please try again later.", e);
        }
    }

    public void cancel(String operationId) {
        CompletableFuture<Void> future = operationFutures.get(operationId);
        if (future != null && !future.isDone()) {
            if (future.cancel(true)) {
                log.info("Operation {} cancelled", operationId);
            } else {
                log.warn("Failed to cancel operation {} (already completed)", operationId);
            }
        }
    }

    public boolean isRunning(String deployName) {
        return runningByDeployName.containsKey(deployName);
    }

    private void release(String operationId, String deployName) {
        operationFutures.remove(operationId);
        if (runningByDeployName.remove(deployName, operationId)) {
            log.debug("Stack {} released by operation {}", deployName, operationId);
        }
    }

    @PreDestroy
    public void shutdown() throws InterruptedException {
        executorService.shutdown();
        if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
            executorService.shutdownNow();
            log.warn("Executor service did not terminate in time, forcing shutdown");
        }
    }
}
