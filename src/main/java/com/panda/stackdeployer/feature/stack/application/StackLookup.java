package com.panda.stackdeployer.feature.stack.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.cloudformation.model.CloudFormationException;
import software.amazon.awssdk.services.cloudformation.model.DescribeStacksRequest;
import software.amazon.awssdk.services.cloudformation.model.Output;
import software.amazon.awssdk.services.cloudformation.model.Stack;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only queries against a named stack.
 */
@Slf4j
@Component
public class StackLookup {

    /**
     * Describes a stack by name.
     *
     * @param cfn       CloudFormation client
     * @param stackName stack name
     * @return the stack, or empty when CloudFormation reports it does not exist
     */
    public Optional<Stack> describeStack(CloudFormationClient cfn, String stackName) {
        try {
            return cfn.describeStacks(DescribeStacksRequest.builder().stackName(stackName).build())
                    .stacks().stream().findFirst();
        } catch (CloudFormationException e) {
            if (isStackNotFound(e)) {
                log.debug("Stack {} does not exist", stackName);
                return Optional.empty();
            }
            throw e;
        }
    }

    /**
     * A stack exists when it is present and neither deleted nor still awaiting execution
     * of its first change set.
     */
    public boolean stackExists(CloudFormationClient cfn, String stackName) {
        return describeStack(cfn, stackName)
                .map(StackLifecycleStatus::fromStack)
                .map(status -> !status.isDeleted() && !status.isReviewInProgress())
                .orElse(false);
    }

    public boolean stackFailedCreating(CloudFormationClient cfn, String stackName) {
        return describeStack(cfn, stackName)
                .map(StackLifecycleStatus::fromStack)
                .map(StackLifecycleStatus::isCreationFailure)
                .orElse(false);
    }

    public Map<String, String> stackOutputs(CloudFormationClient cfn, String stackName) {
        Map<String, String> outputs = new LinkedHashMap<>();
        describeStack(cfn, stackName).ifPresent(stack -> {
            for (Output output : stack.outputs()) {
                outputs.put(output.outputKey(), output.outputValue());
            }
        });
        return outputs;
    }

    private static boolean isStackNotFound(CloudFormationException e) {
        String message = e.awsErrorDetails() != null && e.awsErrorDetails().errorMessage() != null
                ? e.awsErrorDetails().errorMessage()
                : e.getMessage();
        return message != null && message.contains("does not exist");
    }
}
