package com.panda.stackdeployer.feature.stack.exception;

public class StackDestroyException extends StackDeploymentException {

    private final String observedStatus;

    public StackDestroyException(String stackName, String observedStatus) {
        super("Failed to destroy " + stackName + ": " + observedStatus, stackName, "STACK_DESTROY_FAILED");
        this.observedStatus = observedStatus;
    }

    public String getObservedStatus() {
        return observedStatus;
    }
}
