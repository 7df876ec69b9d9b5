package com.panda.stackdeployer.feature.stack.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.panda.stackdeployer.feature.stack.dto.StackOperationResult;
import com.panda.stackdeployer.feature.stack.event.StackActivityStore;
import com.panda.stackdeployer.feature.stack.event.StackEventPublisher;
import com.panda.stackdeployer.feature.stack.exception.StackDeploymentException;
import com.panda.stackdeployer.feature.stack.exception.StackFailedException;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.Callable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class StackOperationTaskTest {

    @Mock
    private StackEventPublisher eventPublisher;

    @Mock
    private StackOperationErrorHandler errorHandler;

    @Mock
    private StackActivityStore activityStore;

    private StackOperationResultStore resultStore;
    private StackOperationResult running;

    @BeforeEach
    void setUp() {
        resultStore = new StackOperationResultStore();
        running = StackOperationResult.builder()
                .operationId("op_1")
                .operation("DEPLOY")
                .deployName("demo")
                .status(StackOperationResult.RUNNING)
                .startedAt(LocalDateTime.now().minusSeconds(5))
                .build();
        resultStore.save(running);
    }

    private StackOperationTask task(Callable<StackOperationResult> operation) {
        return new StackOperationTask(running, operation, resultStore, eventPublisher, errorHandler, activityStore);
    }

    @Test
    @DisplayName("Records the outcome and publishes a success event")
    void recordsSuccess() {
        when(activityStore.getEventCount("op_1")).thenReturn(7);

        task(() -> StackOperationResult.builder()
                .status(StackOperationResult.SUCCEEDED)
                .stackArn("arn:stack/demo")
                .outputs(Map.of("Url", "https://demo"))
                .build()).run();

        StackOperationResult result = resultStore.get("op_1");
        assertThat(result.getStatus()).isEqualTo(StackOperationResult.SUCCEEDED);
        assertThat(result.getStackArn()).isEqualTo("arn:stack/demo");
        assertThat(result.getOutputs()).containsEntry("Url", "https://demo");
        assertThat(result.getCompletedAt()).isNotNull();
        assertThat(result.getDurationSeconds()).isGreaterThanOrEqualTo(5L);
        assertThat(result.getEventCount()).isEqualTo(7);
        assertThat(result.isCompleted()).isTrue();
        verify(eventPublisher).publishSuccessEvent("op_1", result);
        verifyNoInteractions(errorHandler);
    }

    @Test
    @DisplayName("Records a no-op as successful")
    void recordsNoOp() {
        task(() -> StackOperationResult.builder().status(StackOperationResult.NO_OP).build()).run();

        assertThat(resultStore.get("op_1").isSuccessful()).isTrue();
        assertThat(resultStore.get("op_1").getStatus()).isEqualTo(StackOperationResult.NO_OP);
    }

    @Test
    @DisplayName("Records a failure with the error code from the handler")
    void recordsFailure() {
        StackFailedException failure = new StackFailedException("The stack named demo is in a failed state",
                "demo", "UPDATE_ROLLBACK_COMPLETE");
        when(errorHandler.handleException("op_1", "demo", failure)).thenReturn("STACK_FAILED");

        task(() -> {
            throw failure;
        }).run();

        StackOperationResult result = resultStore.get("op_1");
        assertThat(result.isFailed()).isTrue();
        assertThat(result.getErrorCode()).isEqualTo("STACK_FAILED");
        assertThat(result.getErrorMessage()).isEqualTo("The stack named demo is in a failed state");
        verify(eventPublisher, never()).publishSuccessEvent(any(), any());
    }

    @Test
    @DisplayName("Keeps the interrupt flag of a cancelled operation")
    void keepsInterruptFlag() {
        when(errorHandler.handleException(eq("op_1"), eq("demo"), any(Exception.class))).thenReturn("INTERRUPTED");

        try {
            task(() -> {
                Thread.currentThread().interrupt();
                throw new StackDeploymentException("Interrupted while waiting for stack demo", "demo", "INTERRUPTED");
            }).run();

            assertThat(Thread.currentThread().isInterrupted()).isTrue();
            assertThat(resultStore.get("op_1").isFailed()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }
}
