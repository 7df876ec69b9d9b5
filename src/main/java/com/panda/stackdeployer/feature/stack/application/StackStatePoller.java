package com.panda.stackdeployer.feature.stack.application;

import com.panda.stackdeployer.feature.stack.exception.StackDeploymentException;
import com.panda.stackdeployer.feature.stack.exception.StackFailedException;
import com.panda.stackdeployer.feature.stack.exception.StackWaitTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.cloudformation.model.Stack;

import java.util.Optional;

/**
 * Polls a stack until it leaves its in-progress states.
 *
 * Waiting is done on the calling thread; interrupting that thread cancels the wait.
 */
@Slf4j
@Component
public class StackStatePoller {

    private final StackLookup stackLookup;
    private final long pollIntervalMs;
    private final long maxWaitMs;

    public StackStatePoller(StackLookup stackLookup,
                            @Value("${stack.deploy.poll-interval-ms:5000}") long pollIntervalMs,
                            @Value("${stack.deploy.max-wait-ms:0}") long maxWaitMs) {
        this.stackLookup = stackLookup;
        this.pollIntervalMs = pollIntervalMs;
        this.maxWaitMs = maxWaitMs;
    }

    /**
     * Waits for the stack to reach a terminal state.
     *
     * @param cfn       CloudFormation client
     * @param stackName stack name
     * @param mode      DEPLOY raises on disappearance, deletion and failure states;
     *                  DELETE returns empty on disappearance and the stack for any terminal state
     * @return the stack in its terminal state, empty if it no longer exists
     */
    public Optional<Stack> waitForStack(CloudFormationClient cfn, String stackName, StackWaitMode mode) {
        long startTime = System.currentTimeMillis();
        int pollCount = 0;

        while (true) {
            pollCount++;
            Optional<Stack> stack = stackLookup.describeStack(cfn, stackName);

            if (stack.isEmpty()) {
                if (mode == StackWaitMode.DELETE) {
                    log.debug("Stack {} no longer exists after {} polls", stackName, pollCount);
                    return Optional.empty();
                }
                throw new StackFailedException("The stack named " + stackName + " does not exist",
                        stackName, "NOT_FOUND");
            }

            StackLifecycleStatus status = StackLifecycleStatus.fromStack(stack.get());
            if (status.isInProgress()) {
                log.debug("Stack {} has an ongoing operation in progress and is not stable ({})", stackName, status);
                sleep(stackName, startTime);
                continue;
            }

            log.debug("Stack {} reached {} after {} polls", stackName, status, pollCount);
            if (mode == StackWaitMode.DELETE) {
                return stack;
            }
            if (status.isDeleted()) {
                throw new StackFailedException("The stack named " + stackName + " was deleted",
                        stackName, status.getName());
            }
            if (status.isFailure()) {
                throw new StackFailedException("The stack named " + stackName + " is in a failed state: " + status,
                        stackName, status.getName());
            }
            return stack;
        }
    }

    private void sleep(String stackName, long startTime) {
        long waited = System.currentTimeMillis() - startTime;
        if (maxWaitMs > 0 && waited >= maxWaitMs) {
            throw new StackWaitTimeoutException("Timed out after " + waited + "ms waiting for stack " + stackName,
                    stackName, waited, maxWaitMs);
        }
        try {
            Thread.sleep(pollIntervalMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StackDeploymentException("Interrupted while waiting for stack " + stackName,
                    stackName, "INTERRUPTED", e);
        }
    }
}
