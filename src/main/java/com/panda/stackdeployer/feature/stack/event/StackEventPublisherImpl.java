package com.panda.stackdeployer.feature.stack.event;

import com.panda.stackdeployer.feature.stack.dto.StackOperationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class StackEventPublisherImpl implements StackEventPublisher {

    private final StackActivityStore stackActivityStore;

    @Override
    public void publishActivity(String operationId, StackActivity activity) {
        try {
            StackActivityEvent event = new StackActivityEvent();
            event.setType("activity");
            event.setMessage(activity.getResourceStatus() + " " + activity.getResourceType() + " "
                    + (activity.getConstructPath() != null ? activity.getConstructPath() : activity.getLogicalResourceId()));

            Map<String, Object> details = new HashMap<>();
            details.put("progress", activity.progress());
            details.put("timestamp", activity.getTimestamp() != null ? activity.getTimestamp().toString() : null);
            details.put("stackName", activity.getStackName());
            details.put("logicalResourceId", activity.getLogicalResourceId());
            details.put("resourceType", activity.getResourceType());
            details.put("resourceStatus", activity.getResourceStatus());
            if (activity.getStatusReason() != null) {
                details.put("statusReason", activity.getStatusReason());
            }
            event.setDetails(details);

            stackActivityStore.broadcastEvent(operationId, event);
        } catch (Exception e) {
            log.error("Failed to publish activity event for operation: {}", operationId, e);
        }
    }

    @Override
    public void publishSuccessEvent(String operationId, StackOperationResult result) {
        try {
            Map<String, Object> details = new HashMap<>();
            details.put("status", result.getStatus());
            details.put("deployName", result.getDeployName());
            if (result.getStackArn() != null) {
                details.put("stackArn", result.getStackArn());
            }
            if (result.getOutputs() != null) {
                details.put("outputs", result.getOutputs());
            }

            String message = StackOperationResult.NO_OP.equals(result.getStatus())
                    ? "No changes to " + result.getDeployName()
                    : result.getOperation() + " of " + result.getDeployName() + " completed";
            stackActivityStore.sendDoneEvent(operationId, message, details);

            log.info("Success event published - operationId: {}, deployName: {}, status: {}",
                    operationId, result.getDeployName(), result.getStatus());
        } catch (Exception e) {
            log.error("Failed to publish success event for operation: {}", operationId, e);
        }
    }

    @Override
    public void publishErrorEvent(String operationId, String errorMessage) {
        publishErrorEvent(operationId, errorMessage, null);
    }

    @Override
    public void publishErrorEvent(String operationId, String errorMessage, Map<String, Object> errorDetails) {
        try {
            stackActivityStore.sendErrorEvent(operationId, errorMessage, errorDetails);

            log.warn("Error event published - operationId: {}, error: {}", operationId, errorMessage);
        } catch (Exception e) {
            log.error("Failed to publish error event for operation: {}", operationId, e);
        }
    }
}
