package com.panda.stackdeployer.feature.stack.exception;

public class StackDeploymentException extends RuntimeException {

    private String stackName;
    private String errorCode;

    public StackDeploymentException(String message) {
        super(message);
    }

    public StackDeploymentException(String message, Throwable cause) {
        super(message, cause);
    }

    public StackDeploymentException(String message, String stackName, String errorCode) {
        super(message);
        this.stackName = stackName;
        this.errorCode = errorCode;
    }

    public StackDeploymentException(String message, String stackName, String errorCode, Throwable cause) {
        super(message, cause);
        this.stackName = stackName;
        this.errorCode = errorCode;
    }

    public String getStackName() {
        return stackName;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
