package com.panda.stackdeployer.feature.stack.application;

import com.panda.stackdeployer.feature.stack.dto.ChangeSetRequest;
import com.panda.stackdeployer.feature.stack.dto.DeployStackOptions;
import com.panda.stackdeployer.feature.stack.dto.DeployStackResult;
import com.panda.stackdeployer.feature.stack.dto.DestroyStackOptions;
import com.panda.stackdeployer.feature.stack.dto.StackDescriptor;
import com.panda.stackdeployer.feature.stack.dto.TemplateBodyParameter;
import com.panda.stackdeployer.feature.stack.exception.MissingEnvironmentException;
import com.panda.stackdeployer.feature.stack.exception.StackDestroyException;
import com.panda.stackdeployer.feature.stack.exception.TemplateTooLargeException;
import com.panda.stackdeployer.feature.stack.infrastructure.AccessMode;
import com.panda.stackdeployer.feature.stack.infrastructure.ToolkitInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.cloudformation.model.ChangeSetType;
import software.amazon.awssdk.services.cloudformation.model.CreateChangeSetResponse;
import software.amazon.awssdk.services.cloudformation.model.DeleteStackRequest;
import software.amazon.awssdk.services.cloudformation.model.DescribeChangeSetResponse;
import software.amazon.awssdk.services.cloudformation.model.Parameter;
import software.amazon.awssdk.services.cloudformation.model.Stack;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Deploys a synthesized stack through a change set, and destroys stacks.
 *
 * Deploy flow:
 * 1. Upload the template to the toolkit bucket, or inline it if small enough
 * 2. Delete a stack left behind by a failed creation
 * 3. Create a CREATE or UPDATE change set and wait for it
 * 4. No changes: delete the change set and report a no-op
 *    (a change set whose wait failed is deleted too, before the error is rethrown)
 * 5. Otherwise execute it and wait for the stack to settle, with the activity monitor running
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StackDeployer {

    static final int LARGE_TEMPLATE_SIZE_KB = 50;

    private final StackParameterPreparer parameterPreparer;
    private final TemplateSerializer templateSerializer;
    private final StackLookup stackLookup;
    private final ChangeSetManager changeSetManager;
    private final StackStatePoller statePoller;
    private final StackActivityMonitorFactory monitorFactory;

    public DeployStackResult deployStack(DeployStackOptions options) {
        StackDescriptor stack = options.getStack();
        if (stack.getEnvironment() == null) {
            throw new MissingEnvironmentException(stack.getName());
        }

        List<Parameter> parameters = parameterPreparer.prepare(stack, options.getToolkitInfo());
        String deployName = options.resolveDeployName();
        String executionId = UUID.randomUUID().toString();

        CloudFormationClient cfn = options.getClientFactory().cloudFormation(stack.getEnvironment(), AccessMode.WRITE);
        TemplateBodyParameter body = makeBodyParameter(stack, options.getToolkitInfo());

        changeSetManager.deleteStackIfFailedCreating(cfn, deployName);

        boolean update = stackLookup.stackExists(cfn, deployName);
        String changeSetName = ChangeSetRequest.changeSetNameFor(executionId);
        ChangeSetRequest request = ChangeSetRequest.builder()
                .stackName(deployName)
                .changeSetName(changeSetName)
                .type(update ? ChangeSetType.UPDATE : ChangeSetType.CREATE)
                .description(ChangeSetRequest.descriptionFor(executionId))
                .body(body)
                .parameters(parameters)
                .roleArn(options.getRoleArn())
                .build();

        CreateChangeSetResponse changeSet = changeSetManager.createChangeSet(cfn, request);
        DescribeChangeSetResponse description;
        try {
            description = changeSetManager.waitForChangeSet(cfn, deployName, changeSetName);
        } catch (RuntimeException e) {
            discardChangeSet(cfn, deployName, changeSetName, e);
            throw e;
        }

        if (ChangeSetManager.hasNoChanges(description)) {
            log.debug("No changes are to be performed on {}, assuming success.", deployName);
            changeSetManager.deleteChangeSet(cfn, deployName, changeSetName);
            return DeployStackResult.builder()
                    .noOp(true)
                    .outputs(stackLookup.stackOutputs(cfn, deployName))
                    .stackArn(changeSet.stackId())
                    .build();
        }

        StackActivityMonitor monitor = options.isQuiet() ? null
                : monitorFactory.create(cfn, deployName, stack.getMetadata(), description.changes().size(),
                        options.getActivityPublisher()).start();
        try {
            changeSetManager.executeChangeSet(cfn, deployName, changeSetName);
            log.debug("Execution of changeset {} on stack {} has started; waiting for the update to complete...",
                    changeSetName, deployName);
            statePoller.waitForStack(cfn, deployName, StackWaitMode.DEPLOY);
        } finally {
            if (monitor != null) {
                monitor.stop();
            }
        }
        log.info("Stack {} has completed updating", deployName);

        return DeployStackResult.builder()
                .noOp(false)
                .outputs(stackLookup.stackOutputs(cfn, deployName))
                .stackArn(changeSet.stackId())
                .build();
    }

    public void destroyStack(DestroyStackOptions options) {
        StackDescriptor stack = options.getStack();
        if (stack.getEnvironment() == null) {
            throw new MissingEnvironmentException(stack.getName());
        }

        String deployName = options.resolveDeployName();
        CloudFormationClient cfn = options.getClientFactory().cloudFormation(stack.getEnvironment(), AccessMode.WRITE);
        if (!stackLookup.stackExists(cfn, deployName)) {
            log.info("Stack {} does not exist, nothing to destroy", deployName);
            return;
        }

        StackActivityMonitor monitor = options.isQuiet() ? null
                : monitorFactory.create(cfn, deployName, stack.getMetadata(), null,
                        options.getActivityPublisher()).start();
        Optional<Stack> destroyed;
        try {
            cfn.deleteStack(DeleteStackRequest.builder()
                    .stackName(deployName)
                    .roleARN(options.getRoleArn())
                    .build());
            destroyed = statePoller.waitForStack(cfn, deployName, StackWaitMode.DELETE);
        } finally {
            if (monitor != null) {
                monitor.stop();
            }
        }

        if (destroyed.isPresent()) {
            StackLifecycleStatus status = StackLifecycleStatus.fromStack(destroyed.get());
            if (!status.isDeleted()) {
                throw new StackDestroyException(deployName, status.toString());
            }
        }
        log.info("Stack {} destroyed", deployName);
    }

    /**
     * Deletes a change set that will never be executed because waiting for it failed.
     * The interrupt flag is cleared for the duration of the call so a cancelled operation
     * can still clean up, and restored afterwards.
     */
    private void discardChangeSet(CloudFormationClient cfn, String deployName, String changeSetName,
                                  RuntimeException cause) {
        boolean interrupted = Thread.interrupted();
        try {
            log.warn("Waiting for changeset {} on stack {} failed, deleting it", changeSetName, deployName);
            changeSetManager.deleteChangeSet(cfn, deployName, changeSetName);
        } catch (RuntimeException e) {
            log.error("Failed to delete changeset {} on stack {}", changeSetName, deployName, e);
            cause.addSuppressed(e);
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * Puts the template in the toolkit bucket when there is one, otherwise inlines it.
     * Without a bucket, templates over {@value #LARGE_TEMPLATE_SIZE_KB}KiB cannot be deployed.
     */
    TemplateBodyParameter makeBodyParameter(StackDescriptor stack, ToolkitInfo toolkitInfo) {
        String templateYaml = templateSerializer.toYaml(stack.getTemplate());

        if (toolkitInfo != null) {
            ToolkitInfo.UploadResult uploaded = toolkitInfo.uploadIfChanged(templateYaml,
                    new ToolkitInfo.UploadProps("cdk/" + stack.getName() + "/", ".yml", "application/x-yaml"));
            String templateUrl = toolkitInfo.getBucketUrl() + "/" + uploaded.getKey();
            log.debug("Stored template in S3 at: {}", templateUrl);
            return TemplateBodyParameter.url(templateUrl);
        }

        long size = templateYaml.getBytes(StandardCharsets.UTF_8).length;
        long threshold = LARGE_TEMPLATE_SIZE_KB * 1024L;
        if (size > threshold) {
            String message = String.format(
                    "The template for stack \"%s\" is %dKiB. Templates larger than %dKiB must be uploaded to S3. "
                            + "Run \"cdk bootstrap %s\" to set up a toolkit bucket in this environment, and then re-deploy.",
                    stack.getName(), Math.round(size / 1024.0), LARGE_TEMPLATE_SIZE_KB,
                    stack.getEnvironment().getName());
            log.error(message);
            throw new TemplateTooLargeException(message, stack.getName(), size, threshold);
        }
        return TemplateBodyParameter.inline(templateYaml);
    }
}
