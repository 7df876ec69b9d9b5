package com.panda.stackdeployer.feature.stack.exception;

public class StaleStackCleanupException extends StackDeploymentException {

    private final String observedStatus;

    public StaleStackCleanupException(String stackName, String observedStatus) {
        super("Failed deleting stack " + stackName + " that had previously failed creation (current state: "
                + observedStatus + ")", stackName, "STALE_STACK_CLEANUP_FAILED");
        this.observedStatus = observedStatus;
    }

    public String getObservedStatus() {
        return observedStatus;
    }
}
