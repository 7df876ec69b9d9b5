package com.panda.stackdeployer.feature.stack.infrastructure;

import com.panda.stackdeployer.feature.stack.event.StackEventPublisher;
import com.panda.stackdeployer.feature.stack.exception.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.awscore.exception.AwsServiceException;

import java.util.HashMap;
import java.util.Map;

/**
 * Turns the exception that ended a background stack operation into a "fail" event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StackOperationErrorHandler {

    private final StackEventPublisher eventPublisher;

    /**
     * Publishes the failure and returns the error code recorded for it.
     */
    public String handleException(String operationId, String deployName, Exception exception) {
        String errorCode = extractErrorCode(exception);
        Map<String, Object> details = new HashMap<>();
        details.put("errorCode", errorCode);
        details.put("deployName", deployName);

        if (exception instanceof TemplateTooLargeException) {
            TemplateTooLargeException e = (TemplateTooLargeException) exception;
            log.error("Template too large - operationId: {}, stack: {}, size: {} bytes, limit: {} bytes",
                    operationId, e.getStackName(), e.getTemplateSizeBytes(), e.getThresholdBytes());
            details.put("templateSizeBytes", e.getTemplateSizeBytes());
            details.put("thresholdBytes", e.getThresholdBytes());
        } else if (exception instanceof ChangeSetFailedException) {
            ChangeSetFailedException e = (ChangeSetFailedException) exception;
            log.error("Change set failed - operationId: {}, stack: {}, changeSet: {}, reason: {}",
                    operationId, e.getStackName(), e.getChangeSetName(), e.getStatusReason());
            details.put("changeSetName", e.getChangeSetName());
            details.put("statusReason", e.getStatusReason());
        } else if (exception instanceof StackDestroyException) {
            StackDestroyException e = (StackDestroyException) exception;
            log.error("Stack destroy failed - operationId: {}, stack: {}, status: {}",
                    operationId, e.getStackName(), e.getObservedStatus());
            details.put("observedStatus", e.getObservedStatus());
        } else if (exception instanceof StaleStackCleanupException) {
            StaleStackCleanupException e = (StaleStackCleanupException) exception;
            log.error("Failed stack cleanup failed - operationId: {}, stack: {}, status: {}",
                    operationId, e.getStackName(), e.getObservedStatus());
            details.put("observedStatus", e.getObservedStatus());
        } else if (exception instanceof StackFailedException) {
            StackFailedException e = (StackFailedException) exception;
            log.error("Stack failed - operationId: {}, stack: {}, status: {}",
                    operationId, e.getStackName(), e.getObservedStatus());
            details.put("observedStatus", e.getObservedStatus());
        } else if (exception instanceof StackDeploymentException) {
            StackDeploymentException e = (StackDeploymentException) exception;
            log.error("Stack operation failed - operationId: {}, stack: {}, errorCode: {}",
                    operationId, e.getStackName(), e.getErrorCode(), e);
        } else if (exception instanceof AwsServiceException) {
            AwsServiceException e = (AwsServiceException) exception;
            log.error("AWS API error - operationId: {}, service: {}, status: {}, code: {}",
                    operationId, e.awsErrorDetails() != null ? e.awsErrorDetails().serviceName() : "unknown",
                    e.statusCode(), e.awsErrorDetails() != null ? e.awsErrorDetails().errorCode() : "unknown", e);
            details.put("statusCode", e.statusCode());
        } else {
            log.error("Unexpected exception during stack operation - operationId: {}", operationId, exception);
            details.put("exceptionClass", exception.getClass().getSimpleName());
        }

        eventPublisher.publishErrorEvent(operationId, errorMessage(deployName, exception), details);
        return errorCode;
    }

    public String extractErrorCode(Exception exception) {
        if (exception instanceof StackDeploymentException) {
            StackDeploymentException de = (StackDeploymentException) exception;
            return de.getErrorCode() != null ? de.getErrorCode() : ErrorCode.UNEXPECTED_ERROR.getCode();
        }
        if (exception instanceof AwsServiceException) {
            return ErrorCode.REMOTE_API_ERROR.getCode();
        }
        return ErrorCode.UNEXPECTED_ERROR.getCode();
    }

    private static String errorMessage(String deployName, Exception exception) {
        if (exception instanceof StackDeploymentException) {
            return exception.getMessage();
        }
        return String.format("Operation on %s failed: %s (%s)",
                deployName, exception.getMessage(), exception.getClass().getSimpleName());
    }
}
