package com.panda.stackdeployer.feature.stack.exception;

public class StackFailedException extends StackDeploymentException {

    private final String observedStatus;

    public StackFailedException(String message, String stackName, String observedStatus) {
        super(message, stackName, "STACK_FAILED");
        this.observedStatus = observedStatus;
    }

    public String getObservedStatus() {
        return observedStatus;
    }
}
