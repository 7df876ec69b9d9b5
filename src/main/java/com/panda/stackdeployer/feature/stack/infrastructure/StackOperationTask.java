package com.panda.stackdeployer.feature.stack.infrastructure;

import com.panda.stackdeployer.feature.stack.dto.StackOperationResult;
import com.panda.stackdeployer.feature.stack.event.StackActivityStore;
import com.panda.stackdeployer.feature.stack.event.StackEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.Callable;

/**
 * One deploy or destroy running on the {@link StackOperationExecutor}.
 * Records the final result and publishes the closing success or fail event.
 */
@Slf4j
@RequiredArgsConstructor
public class StackOperationTask implements Runnable {

    private final StackOperationResult running;
    private final Callable<StackOperationResult> operation;
    private final StackOperationResultStore resultStore;
    private final StackEventPublisher eventPublisher;
    private final StackOperationErrorHandler errorHandler;
    private final StackActivityStore activityStore;

    @Override
    public void run() {
        String operationId = running.getOperationId();
        try {
            log.info("Starting {} of {} - operationId: {}", running.getOperation(), running.getDeployName(), operationId);

            StackOperationResult outcome = operation.call();
            StackOperationResult result = complete(outcome.getStatus());
            result.setStackArn(outcome.getStackArn());
            result.setOutputs(outcome.getOutputs());
            resultStore.save(result);
            eventPublisher.publishSuccessEvent(operationId, result);

            log.info("{} of {} finished with {} - operationId: {}",
                    running.getOperation(), running.getDeployName(), result.getStatus(), operationId);

        } catch (Exception e) {
            if (e instanceof InterruptedException || Thread.currentThread().isInterrupted()) {
                log.warn("{} of {} interrupted - operationId: {}", running.getOperation(), running.getDeployName(),
                        operationId, e);
                Thread.currentThread().interrupt();
            }
            String errorCode = errorHandler.handleException(operationId, running.getDeployName(), e);
            StackOperationResult result = complete(StackOperationResult.FAILED);
            result.setErrorMessage(e.getMessage());
            result.setErrorCode(errorCode);
            resultStore.save(result);
        }
    }

    private StackOperationResult complete(String status) {
        LocalDateTime completedAt = LocalDateTime.now();
        return running.toBuilder()
                .status(status)
                .completedAt(completedAt)
                .durationSeconds(Duration.between(running.getStartedAt(), completedAt).getSeconds())
                .eventCount(activityStore.getEventCount(running.getOperationId()))
                .build();
    }
}
