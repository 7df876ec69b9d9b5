package com.panda.stackdeployer.feature.stack.exception;

import org.springframework.http.HttpStatus;

/**
 * Error codes raised while deploying or destroying a stack, with the HTTP status each maps to.
 */
public enum ErrorCode {

    /**
     * 400 Bad Request
     * The stack has no resolved account/region
     */
    CONFIGURATION_ERROR("CONFIGURATION_ERROR", HttpStatus.BAD_REQUEST, "Stack environment is not resolved"),

    /**
     * 413 Payload Too Large
     * Template exceeds the inline size limit and no toolkit bucket is configured
     */
    TEMPLATE_TOO_LARGE("TEMPLATE_TOO_LARGE", HttpStatus.PAYLOAD_TOO_LARGE, "Template too large to deploy inline"),

    /**
     * 409 Conflict
     * A stack that failed creation could not be deleted
     */
    STALE_STACK_CLEANUP_FAILED("STALE_STACK_CLEANUP_FAILED", HttpStatus.CONFLICT, "Failed stack could not be cleaned up"),

    /**
     * 400 Bad Request
     * CloudFormation rejected the change set
     */
    CHANGE_SET_FAILED("CHANGE_SET_FAILED", HttpStatus.BAD_REQUEST, "Change set creation failed"),

    /**
     * 409 Conflict
     * Stack ended in a failed or rolled back state
     */
    STACK_FAILED("STACK_FAILED", HttpStatus.CONFLICT, "Stack operation failed"),

    /**
     * 409 Conflict
     * Stack still exists after a delete request
     */
    STACK_DESTROY_FAILED("STACK_DESTROY_FAILED", HttpStatus.CONFLICT, "Stack could not be destroyed"),

    /**
     * 409 Conflict
     * Another deploy or destroy of the same stack has not finished yet
     */
    OPERATION_IN_PROGRESS("OPERATION_IN_PROGRESS", HttpStatus.CONFLICT, "Stack operation already in progress"),

    /**
     * 408 Request Timeout
     */
    STACK_WAIT_TIMEOUT("STACK_WAIT_TIMEOUT", HttpStatus.REQUEST_TIMEOUT, "Timed out waiting for stack"),

    /**
     * 502 Bad Gateway
     * CloudFormation or S3 returned an error
     */
    REMOTE_API_ERROR("REMOTE_API_ERROR", HttpStatus.BAD_GATEWAY, "AWS API error"),

    /**
     * 500 Internal Server Error
     */
    UNEXPECTED_ERROR("UNEXPECTED_ERROR", HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error");

    private final String code;
    private final HttpStatus httpStatus;
    private final String description;

    ErrorCode(String code, HttpStatus httpStatus, String description) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Looks up an error code by its string form.
     *
     * @param code error code string
     * @return matching ErrorCode, or UNEXPECTED_ERROR when unknown
     */
    public static ErrorCode fromCode(String code) {
        if (code == null) {
            return UNEXPECTED_ERROR;
        }
        try {
            return ErrorCode.valueOf(code);
        } catch (IllegalArgumentException e) {
            return UNEXPECTED_ERROR;
        }
    }
}
