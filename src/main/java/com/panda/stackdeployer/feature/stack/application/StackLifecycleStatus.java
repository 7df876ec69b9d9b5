package com.panda.stackdeployer.feature.stack.application;

import software.amazon.awssdk.services.cloudformation.model.Stack;

import java.util.Objects;
import java.util.Set;

/**
 * Observed CloudFormation stack status, with the reason CloudFormation gave for it.
 */
public class StackLifecycleStatus {

    private static final Set<String> ROLLBACK_COMPLETE_STATES =
            Set.of("ROLLBACK_COMPLETE", "UPDATE_ROLLBACK_COMPLETE", "IMPORT_ROLLBACK_COMPLETE");

    private static final Set<String> CREATION_FAILURE_STATES =
            Set.of("CREATE_FAILED", "ROLLBACK_COMPLETE", "ROLLBACK_FAILED");

    private final String name;
    private final String reason;

    public StackLifecycleStatus(String name, String reason) {
        this.name = Objects.requireNonNull(name, "name");
        this.reason = reason;
    }

    public static StackLifecycleStatus fromStack(Stack stack) {
        return new StackLifecycleStatus(stack.stackStatusAsString(), stack.stackStatusReason());
    }

    public String getName() {
        return name;
    }

    public String getReason() {
        return reason;
    }

    public boolean isInProgress() {
        return name.endsWith("_IN_PROGRESS");
    }

    public boolean isFailure() {
        return name.endsWith("_FAILED") || ROLLBACK_COMPLETE_STATES.contains(name);
    }

    public boolean isDeleted() {
        return "DELETE_COMPLETE".equals(name);
    }

    // a change set was created for a new stack but never executed
    public boolean isReviewInProgress() {
        return "REVIEW_IN_PROGRESS".equals(name);
    }

    public boolean isCreationFailure() {
        return CREATION_FAILURE_STATES.contains(name);
    }

    public boolean isSuccess() {
        return !isInProgress() && !isFailure() && !isDeleted();
    }

    @Override
    public String toString() {
        return reason != null ? name + " (" + reason + ")" : name;
    }
}
