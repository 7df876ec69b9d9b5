package com.panda.stackdeployer.feature.stack.application;

import com.panda.stackdeployer.feature.stack.dto.DeployStackOptions;
import com.panda.stackdeployer.feature.stack.dto.DeployStackResult;
import com.panda.stackdeployer.feature.stack.dto.DestroyStackOptions;
import com.panda.stackdeployer.feature.stack.dto.StackDeployRequest;
import com.panda.stackdeployer.feature.stack.dto.StackDescriptor;
import com.panda.stackdeployer.feature.stack.dto.StackDestroyRequest;
import com.panda.stackdeployer.feature.stack.dto.StackOperationResponse;
import com.panda.stackdeployer.feature.stack.dto.StackOperationResult;
import com.panda.stackdeployer.feature.stack.event.StackActivityStore;
import com.panda.stackdeployer.feature.stack.event.StackEventPublisher;
import com.panda.stackdeployer.feature.stack.exception.MissingEnvironmentException;
import com.panda.stackdeployer.feature.stack.infrastructure.CloudFormationClientFactory;
import com.panda.stackdeployer.feature.stack.infrastructure.StackOperationErrorHandler;
import com.panda.stackdeployer.feature.stack.infrastructure.StackOperationExecutor;
import com.panda.stackdeployer.feature.stack.infrastructure.StackOperationResultStore;
import com.panda.stackdeployer.feature.stack.infrastructure.StackOperationTask;
import com.panda.stackdeployer.feature.stack.infrastructure.ToolkitInfo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * Validates deploy/destroy requests and hands them to the background executor.
 * Returns immediately with an operation id to follow. A stack with an operation still
 * running rejects new ones.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StartStackOperationService {

    static final String DEPLOY = "DEPLOY";
    static final String DESTROY = "DESTROY";

    private final StackDeployer stackDeployer;
    private final ToolkitStackLookup toolkitStackLookup;
    private final CloudFormationClientFactory clientFactory;
    private final StackOperationExecutor operationExecutor;
    private final StackOperationResultStore resultStore;
    private final StackEventPublisher eventPublisher;
    private final StackOperationErrorHandler errorHandler;
    private final StackActivityStore activityStore;

    public StackOperationResponse deploy(StackDeployRequest request) {
        StackDescriptor stack = validate(request.getStackName(), request.toDescriptor());
        String deployName = request.getDeployName() != null ? request.getDeployName() : stack.getName();
        String operationId = newOperationId();

        Callable<StackOperationResult> operation = () -> {
            ToolkitInfo toolkitInfo = toolkitStackLookup
                    .resolve(clientFactory, stack.getEnvironment(), request.getToolkitBucket())
                    .orElse(null);

            DeployStackResult result = stackDeployer.deployStack(DeployStackOptions.builder()
                    .stack(stack)
                    .clientFactory(clientFactory)
                    .toolkitInfo(toolkitInfo)
                    .roleArn(request.getRoleArn())
                    .deployName(deployName)
                    .quiet(request.isQuiet())
                    .activityPublisher(eventPublisher.forOperation(operationId))
                    .build());

            return StackOperationResult.builder()
                    .status(result.isNoOp() ? StackOperationResult.NO_OP : StackOperationResult.SUCCEEDED)
                    .stackArn(result.getStackArn())
                    .outputs(result.getOutputs())
                    .build();
        };

        return submit(operationId, DEPLOY, deployName, operation);
    }

    public StackOperationResponse destroy(StackDestroyRequest request) {
        StackDescriptor stack = validate(request.getStackName(), request.toDescriptor());
        String deployName = request.getDeployName() != null ? request.getDeployName() : stack.getName();
        String operationId = newOperationId();

        Callable<StackOperationResult> operation = () -> {
            stackDeployer.destroyStack(DestroyStackOptions.builder()
                    .stack(stack)
                    .clientFactory(clientFactory)
                    .roleArn(request.getRoleArn())
                    .deployName(deployName)
                    .quiet(request.isQuiet())
                    .activityPublisher(eventPublisher.forOperation(operationId))
                    .build());

            return StackOperationResult.builder()
                    .status(StackOperationResult.SUCCEEDED)
                    .build();
        };

        return submit(operationId, DESTROY, deployName, operation);
    }

    private StackDescriptor validate(String stackName, StackDescriptor stack) {
        if (stackName == null || stackName.isBlank()) {
            throw new IllegalArgumentException("stackName is required");
        }
        if (stack.getEnvironment() == null) {
            throw new MissingEnvironmentException(stackName);
        }
        return stack;
    }

    private StackOperationResponse submit(String operationId, String operationType, String deployName,
                                          Callable<StackOperationResult> operation) {
        StackOperationResult running = StackOperationResult.builder()
                .operationId(operationId)
                .operation(operationType)
                .deployName(deployName)
                .status(StackOperationResult.RUNNING)
                .startedAt(LocalDateTime.now())
                .build();
        resultStore.save(running);

        StackOperationTask task = new StackOperationTask(running, operation, resultStore, eventPublisher,
                errorHandler, activityStore);
        try {
            operationExecutor.execute(operationId, deployName, task);
        } catch (RuntimeException e) {
            resultStore.remove(operationId);
            throw e;
        }

        log.info("{} of {} accepted - operationId: {}", operationType, deployName, operationId);
        return new StackOperationResponse(operationId, deployName,
                "Operation started. Listen to /api/v1/stacks/operations/" + operationId + "/events");
    }

    private static String newOperationId() {
        return "op_" + UUID.randomUUID().toString().replace("-", "").substring(0, 10);
    }
}
