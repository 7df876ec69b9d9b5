package com.panda.stackdeployer.feature.stack.exception;

public class ChangeSetFailedException extends StackDeploymentException {

    private final String changeSetName;
    private final String statusReason;

    public ChangeSetFailedException(String stackName, String changeSetName, String statusReason) {
        super("Failed to create ChangeSet " + changeSetName + " on " + stackName + ": " + statusReason,
                stackName, "CHANGE_SET_FAILED");
        this.changeSetName = changeSetName;
        this.statusReason = statusReason;
    }

    public String getChangeSetName() {
        return changeSetName;
    }

    public String getStatusReason() {
        return statusReason;
    }
}
