package com.panda.stackdeployer.feature.stack.event;

import com.panda.stackdeployer.feature.stack.dto.StackOperationResult;

import java.util.Map;

public interface StackEventPublisher {

    void publishActivity(String operationId, StackActivity activity);

    void publishSuccessEvent(String operationId, StackOperationResult result);

    void publishErrorEvent(String operationId, String errorMessage);

    void publishErrorEvent(String operationId, String errorMessage, Map<String, Object> errorDetails);

    /**
     * Adapts this publisher to the monitor-facing callback for one operation.
     *
     * @param operationId operation the monitored events belong to
     * @return publisher that forwards every activity to {@link #publishActivity}
     */
    default StackActivityPublisher forOperation(String operationId) {
        return activity -> publishActivity(operationId, activity);
    }
}
