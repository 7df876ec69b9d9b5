package com.panda.stackdeployer.feature.stack.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.panda.stackdeployer.feature.stack.event.StackEventPublisher;
import com.panda.stackdeployer.feature.stack.exception.ChangeSetFailedException;
import com.panda.stackdeployer.feature.stack.exception.StackDestroyException;
import com.panda.stackdeployer.feature.stack.exception.TemplateTooLargeException;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.awscore.exception.AwsErrorDetails;
import software.amazon.awssdk.services.cloudformation.model.CloudFormationException;

@ExtendWith(MockitoExtension.class)
class StackOperationErrorHandlerTest {

    @Mock
    private StackEventPublisher eventPublisher;

    private StackOperationErrorHandler errorHandler;

    @BeforeEach
    void setUp() {
        errorHandler = new StackOperationErrorHandler(eventPublisher);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> publishedDetails(String expectedMessage) {
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(eventPublisher).publishErrorEvent(eq("op_1"), eq(expectedMessage), captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("Publishes template size details for an oversized template")
    void templateTooLarge() {
        TemplateTooLargeException e = new TemplateTooLargeException("too large", "demo", 60_000, 51_200);

        String errorCode = errorHandler.handleException("op_1", "demo", e);

        assertThat(errorCode).isEqualTo("TEMPLATE_TOO_LARGE");
        assertThat(publishedDetails("too large"))
                .containsEntry("errorCode", "TEMPLATE_TOO_LARGE")
                .containsEntry("templateSizeBytes", 60_000L)
                .containsEntry("thresholdBytes", 51_200L);
    }

    @Test
    @DisplayName("Publishes the change set reason")
    void changeSetFailed() {
        ChangeSetFailedException e = new ChangeSetFailedException("demo", "CDK-abc", "Template format error");

        assertThat(errorHandler.handleException("op_1", "demo", e)).isEqualTo("CHANGE_SET_FAILED");
        assertThat(publishedDetails(e.getMessage()))
                .containsEntry("changeSetName", "CDK-abc")
                .containsEntry("statusReason", "Template format error");
    }

    @Test
    @DisplayName("Publishes the observed status of a stack that could not be destroyed")
    void destroyFailed() {
        StackDestroyException e = new StackDestroyException("demo", "DELETE_FAILED (Bucket not empty)");

        assertThat(errorHandler.handleException("op_1", "demo", e)).isEqualTo("STACK_DESTROY_FAILED");
        assertThat(publishedDetails("Failed to destroy demo: DELETE_FAILED (Bucket not empty)"))
                .containsEntry("observedStatus", "DELETE_FAILED (Bucket not empty)")
                .containsEntry("deployName", "demo");
    }

    @Test
    @DisplayName("Maps CloudFormation errors to a remote API error")
    void awsError() {
        CloudFormationException e = (CloudFormationException) CloudFormationException.builder()
                .message("Rate exceeded")
                .awsErrorDetails(AwsErrorDetails.builder().errorCode("Throttling").serviceName("CloudFormation").build())
                .statusCode(400)
                .build();

        assertThat(errorHandler.handleException("op_1", "demo", e)).isEqualTo("REMOTE_API_ERROR");
        verify(eventPublisher).publishErrorEvent(eq("op_1"), contains("Operation on demo failed"),
                anyMap());
    }

    @Test
    @DisplayName("Anything else is unexpected")
    void unexpected() {
        assertThat(errorHandler.handleException("op_1", "demo", new IllegalStateException("boom")))
                .isEqualTo("UNEXPECTED_ERROR");
        assertThat(publishedDetails("Operation on demo failed: boom (IllegalStateException)"))
                .containsEntry("exceptionClass", "IllegalStateException");
    }
}
