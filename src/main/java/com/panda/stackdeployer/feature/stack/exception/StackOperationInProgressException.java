package com.panda.stackdeployer.feature.stack.exception;

public class StackOperationInProgressException extends StackDeploymentException {

    private final String runningOperationId;

    public StackOperationInProgressException(String stackName, String runningOperationId) {
        super("Stack " + stackName + " already has an operation in progress: " + runningOperationId,
                stackName, "OPERATION_IN_PROGRESS");
        this.runningOperationId = runningOperationId;
    }

    public String getRunningOperationId() {
        return runningOperationId;
    }
}
