package com.panda.stackdeployer.feature.stack.application;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.cloudformation.model.Stack;
import software.amazon.awssdk.services.cloudformation.model.StackStatus;

class StackLifecycleStatusTest {

    private static StackLifecycleStatus status(String name) {
        return new StackLifecycleStatus(name, null);
    }

    @Test
    @DisplayName("Anything ending in _IN_PROGRESS is in progress")
    void inProgress() {
        assertThat(status("CREATE_IN_PROGRESS").isInProgress()).isTrue();
        assertThat(status("UPDATE_COMPLETE_CLEANUP_IN_PROGRESS").isInProgress()).isTrue();
        assertThat(status("REVIEW_IN_PROGRESS").isInProgress()).isTrue();
        assertThat(status("UPDATE_COMPLETE").isInProgress()).isFalse();
    }

    @Test
    @DisplayName("Failed and rolled back states are failures")
    void failures() {
        assertThat(status("CREATE_FAILED").isFailure()).isTrue();
        assertThat(status("DELETE_FAILED").isFailure()).isTrue();
        assertThat(status("ROLLBACK_COMPLETE").isFailure()).isTrue();
        assertThat(status("UPDATE_ROLLBACK_COMPLETE").isFailure()).isTrue();
        assertThat(status("CREATE_COMPLETE").isFailure()).isFalse();
        assertThat(status("DELETE_COMPLETE").isFailure()).isFalse();
    }

    @Test
    @DisplayName("Only settled, non-failed, non-deleted states are successes")
    void success() {
        assertThat(status("CREATE_COMPLETE").isSuccess()).isTrue();
        assertThat(status("UPDATE_COMPLETE").isSuccess()).isTrue();
        assertThat(status("DELETE_COMPLETE").isSuccess()).isFalse();
        assertThat(status("UPDATE_IN_PROGRESS").isSuccess()).isFalse();
        assertThat(status("UPDATE_ROLLBACK_COMPLETE").isSuccess()).isFalse();
    }

    @Test
    @DisplayName("Update rollbacks are failures but not failed creations")
    void creationFailure() {
        assertThat(status("CREATE_FAILED").isCreationFailure()).isTrue();
        assertThat(status("ROLLBACK_COMPLETE").isCreationFailure()).isTrue();
        assertThat(status("ROLLBACK_FAILED").isCreationFailure()).isTrue();
        assertThat(status("UPDATE_ROLLBACK_COMPLETE").isCreationFailure()).isFalse();
        assertThat(status("UPDATE_ROLLBACK_FAILED").isCreationFailure()).isFalse();
    }

    @Test
    @DisplayName("Renders the reason next to the status")
    void rendersReason() {
        StackLifecycleStatus status = StackLifecycleStatus.fromStack(Stack.builder()
                .stackStatus(StackStatus.DELETE_FAILED)
                .stackStatusReason("Bucket not empty")
                .build());

        assertThat(status.toString()).isEqualTo("DELETE_FAILED (Bucket not empty)");
        assertThat(status("DELETE_COMPLETE").toString()).isEqualTo("DELETE_COMPLETE");
    }
}
