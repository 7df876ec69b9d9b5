package com.panda.stackdeployer.global.exception;

import com.panda.stackdeployer.feature.stack.exception.ErrorCode;
import com.panda.stackdeployer.feature.stack.exception.StackDeploymentException;
import com.panda.stackdeployer.feature.stack.exception.StackWaitTimeoutException;
import com.panda.stackdeployer.feature.stack.exception.TemplateTooLargeException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import software.amazon.awssdk.awscore.exception.AwsServiceException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Renders errors as a flat JSON body.
 *
 * - timestamp: when the error occurred
 * - status: HTTP status code
 * - error: error category
 * - message: detail message
 * - stackName: stack involved (if any)
 * - errorCode: see {@link ErrorCode} (if any)
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 408 Request Timeout
     */
    @ExceptionHandler(StackWaitTimeoutException.class)
    public ResponseEntity<?> handleStackWaitTimeoutException(StackWaitTimeoutException e, WebRequest request) {
        log.error("Stack wait timed out - stackName: {}, waited: {}ms, timeout: {}ms",
            e.getStackName(), e.getWaitedMillis(), e.getTimeoutMillis(), e);

        Map<String, Object> errorResponse = errorBody(HttpStatus.REQUEST_TIMEOUT, "Stack Wait Timeout", e.getMessage());
        errorResponse.put("stackName", e.getStackName());
        errorResponse.put("errorCode", ErrorCode.STACK_WAIT_TIMEOUT.getCode());
        errorResponse.put("waitedMillis", e.getWaitedMillis());
        errorResponse.put("timeoutMillis", e.getTimeoutMillis());

        return ResponseEntity.status(HttpStatus.REQUEST_TIMEOUT).body(errorResponse);
    }

    /**
     * 413 Payload Too Large
     */
    @ExceptionHandler(TemplateTooLargeException.class)
    public ResponseEntity<?> handleTemplateTooLargeException(TemplateTooLargeException e, WebRequest request) {
        log.error("Template too large - stackName: {}, size: {} bytes", e.getStackName(), e.getTemplateSizeBytes());

        Map<String, Object> errorResponse = errorBody(HttpStatus.PAYLOAD_TOO_LARGE, "Template Too Large", e.getMessage());
        errorResponse.put("stackName", e.getStackName());
        errorResponse.put("errorCode", ErrorCode.TEMPLATE_TOO_LARGE.getCode());
        errorResponse.put("templateSizeBytes", e.getTemplateSizeBytes());
        errorResponse.put("thresholdBytes", e.getThresholdBytes());

        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(errorResponse);
    }

    @ExceptionHandler(StackDeploymentException.class)
    public ResponseEntity<?> handleStackDeploymentException(StackDeploymentException e, WebRequest request) {
        log.error("Stack deployment error - stackName: {}, errorCode: {}", e.getStackName(), e.getErrorCode(), e);

        HttpStatus httpStatus = ErrorCode.fromCode(e.getErrorCode()).getHttpStatus();

        Map<String, Object> errorResponse = errorBody(httpStatus, "Stack Deployment Error", e.getMessage());
        errorResponse.put("stackName", e.getStackName());
        errorResponse.put("errorCode", e.getErrorCode());

        return ResponseEntity.status(httpStatus).body(errorResponse);
    }

    /**
     * 502 Bad Gateway, CloudFormation or S3 rejected a call
     */
    @ExceptionHandler(AwsServiceException.class)
    public ResponseEntity<?> handleAwsServiceException(AwsServiceException e, WebRequest request) {
        log.error("AWS API error - service: {}, statusCode: {}", e.awsErrorDetails() != null
            ? e.awsErrorDetails().serviceName() : "unknown", e.statusCode(), e);

        Map<String, Object> errorResponse = errorBody(HttpStatus.BAD_GATEWAY, "AWS API Error", e.getMessage());
        errorResponse.put("errorCode", ErrorCode.REMOTE_API_ERROR.getCode());
        if (e.awsErrorDetails() != null) {
            errorResponse.put("awsErrorCode", e.awsErrorDetails().errorCode());
        }

        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(errorResponse);
    }

    /**
     * 400 Bad Request, e.g. missing stack name or unknown operation id
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<?> handleIllegalArgumentException(IllegalArgumentException e, WebRequest request) {
        log.error("Illegal argument error: {}", e.getMessage(), e);

        Map<String, Object> errorResponse = errorBody(HttpStatus.BAD_REQUEST, "Bad Request", e.getMessage());

        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<?> handleGlobalException(Exception e, WebRequest request) {
        log.error("Unexpected error occurred - errorClass: {}", e.getClass().getSimpleName(), e);

        Map<String, Object> errorResponse = errorBody(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
            e.getMessage() != null ? e.getMessage() : "Unexpected error");
        errorResponse.put("errorCode", ErrorCode.UNEXPECTED_ERROR.getCode());
        errorResponse.put("exceptionClass", e.getClass().getSimpleName());

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    private Map<String, Object> errorBody(HttpStatus status, String error, String message) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("timestamp", LocalDateTime.now());
        errorResponse.put("status", status.value());
        errorResponse.put("error", error);
        errorResponse.put("message", message);
        return errorResponse;
    }
}
