package com.panda.stackdeployer.feature.stack.application;

import com.panda.stackdeployer.feature.stack.dto.ChangeSetRequest;
import com.panda.stackdeployer.feature.stack.exception.ChangeSetFailedException;
import com.panda.stackdeployer.feature.stack.exception.StackDeploymentException;
import com.panda.stackdeployer.feature.stack.exception.StackWaitTimeoutException;
import com.panda.stackdeployer.feature.stack.exception.StaleStackCleanupException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.cloudformation.model.Change;
import software.amazon.awssdk.services.cloudformation.model.ChangeSetStatus;
import software.amazon.awssdk.services.cloudformation.model.CreateChangeSetResponse;
import software.amazon.awssdk.services.cloudformation.model.DeleteChangeSetRequest;
import software.amazon.awssdk.services.cloudformation.model.DeleteStackRequest;
import software.amazon.awssdk.services.cloudformation.model.DescribeChangeSetRequest;
import software.amazon.awssdk.services.cloudformation.model.DescribeChangeSetResponse;
import software.amazon.awssdk.services.cloudformation.model.ExecuteChangeSetRequest;
import software.amazon.awssdk.services.cloudformation.model.Stack;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Creates, waits on, executes and deletes change sets.
 *
 * Remote errors are not retried here; they reach the caller unchanged.
 */
@Slf4j
@Component
public class ChangeSetManager {

    private static final List<String> NO_CHANGES_REASONS = List.of(
            "The submitted information didn't contain changes.",
            "No updates are to be performed.");

    private final StackLookup stackLookup;
    private final StackStatePoller statePoller;
    private final long pollIntervalMs;
    private final long maxWaitMs;

    public ChangeSetManager(StackLookup stackLookup,
                            StackStatePoller statePoller,
                            @Value("${stack.deploy.poll-interval-ms:5000}") long pollIntervalMs,
                            @Value("${stack.deploy.max-wait-ms:0}") long maxWaitMs) {
        this.stackLookup = stackLookup;
        this.statePoller = statePoller;
        this.pollIntervalMs = pollIntervalMs;
        this.maxWaitMs = maxWaitMs;
    }

    /**
     * Deletes the stack if its first creation failed, and waits until it is gone.
     *
     * @throws StaleStackCleanupException if the stack does not end up fully deleted
     */
    public void deleteStackIfFailedCreating(CloudFormationClient cfn, String stackName) {
        if (!stackLookup.stackFailedCreating(cfn, stackName)) {
            return;
        }
        log.debug("Found existing stack {} that had previously failed creation. Deleting it before attempting to re-create it.",
                stackName);
        cfn.deleteStack(DeleteStackRequest.builder().stackName(stackName).build());

        Optional<Stack> deleted = statePoller.waitForStack(cfn, stackName, StackWaitMode.DELETE);
        if (deleted.isPresent()) {
            StackLifecycleStatus status = StackLifecycleStatus.fromStack(deleted.get());
            if (!status.isDeleted()) {
                throw new StaleStackCleanupException(stackName, status.toString());
            }
        }
    }

    public CreateChangeSetResponse createChangeSet(CloudFormationClient cfn, ChangeSetRequest request) {
        log.debug("Attempting to create ChangeSet {} to {} stack {}",
                request.getChangeSetName(), request.getType(), request.getStackName());
        CreateChangeSetResponse response = cfn.createChangeSet(request.toSdkRequest());
        log.debug("Initiated creation of changeset: {}; waiting for it to finish creating...", response.id());
        return response;
    }

    /**
     * Waits until the change set is ready to execute.
     *
     * A change set that failed because there was nothing to change is returned with an
     * empty change list rather than raised.
     *
     * @return the description with the changes of every page merged
     * @throws ChangeSetFailedException if CloudFormation failed the change set for any other reason
     */
    public DescribeChangeSetResponse waitForChangeSet(CloudFormationClient cfn, String stackName, String changeSetName) {
        log.debug("Waiting for changeset {} on stack {} to finish creating...", changeSetName, stackName);
        long startTime = System.currentTimeMillis();

        while (true) {
            DescribeChangeSetResponse description = describeChangeSet(cfn, stackName, changeSetName);
            ChangeSetStatus status = description.status();

            if (status == ChangeSetStatus.CREATE_PENDING || status == ChangeSetStatus.CREATE_IN_PROGRESS) {
                log.debug("Changeset {} on stack {} is still being created ({})", changeSetName, stackName, status);
                sleep(stackName, startTime);
                continue;
            }
            if (status == ChangeSetStatus.CREATE_COMPLETE) {
                log.debug("Changeset {} on stack {} is ready with {} changes",
                        changeSetName, stackName, description.changes().size());
                return description;
            }
            if (status == ChangeSetStatus.FAILED && isNoChangesReason(description.statusReason())) {
                log.debug("Changeset {} on stack {} contains no changes: {}",
                        changeSetName, stackName, description.statusReason());
                return description.toBuilder().changes(List.of()).build();
            }
            throw new ChangeSetFailedException(stackName, changeSetName,
                    description.statusReason() != null ? description.statusReason() : description.statusAsString());
        }
    }

    public void executeChangeSet(CloudFormationClient cfn, String stackName, String changeSetName) {
        log.debug("Initiating execution of changeset {} on stack {}", changeSetName, stackName);
        cfn.executeChangeSet(ExecuteChangeSetRequest.builder()
                .stackName(stackName)
                .changeSetName(changeSetName)
                .build());
    }

    public void deleteChangeSet(CloudFormationClient cfn, String stackName, String changeSetName) {
        log.debug("Deleting changeset {} on stack {}", changeSetName, stackName);
        cfn.deleteChangeSet(DeleteChangeSetRequest.builder()
                .stackName(stackName)
                .changeSetName(changeSetName)
                .build());
    }

    public static boolean hasNoChanges(DescribeChangeSetResponse description) {
        return description == null || description.changes() == null || description.changes().isEmpty();
    }

    private DescribeChangeSetResponse describeChangeSet(CloudFormationClient cfn, String stackName, String changeSetName) {
        List<Change> changes = new ArrayList<>();
        DescribeChangeSetResponse first = null;
        String nextToken = null;
        do {
            DescribeChangeSetResponse page = cfn.describeChangeSet(DescribeChangeSetRequest.builder()
                    .stackName(stackName)
                    .changeSetName(changeSetName)
                    .nextToken(nextToken)
                    .build());
            if (first == null) {
                first = page;
            }
            changes.addAll(page.changes());
            nextToken = page.nextToken();
        } while (nextToken != null);

        return first.toBuilder().changes(changes).nextToken(null).build();
    }

    private static boolean isNoChangesReason(String reason) {
        return reason != null && NO_CHANGES_REASONS.stream().anyMatch(reason::startsWith);
    }

    private void sleep(String stackName, long startTime) {
        long waited = System.currentTimeMillis() - startTime;
        if (maxWaitMs > 0 && waited >= maxWaitMs) {
            throw new StackWaitTimeoutException("Timed out after " + waited + "ms waiting for change set on " + stackName,
                    stackName, waited, maxWaitMs);
        }
        try {
            Thread.sleep(pollIntervalMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StackDeploymentException("Interrupted while waiting for change set on " + stackName,
                    stackName, "INTERRUPTED", e);
        }
    }
}
