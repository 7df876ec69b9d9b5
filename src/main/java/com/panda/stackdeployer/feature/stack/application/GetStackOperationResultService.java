package com.panda.stackdeployer.feature.stack.application;

import com.panda.stackdeployer.feature.stack.dto.StackOperationResult;
import com.panda.stackdeployer.feature.stack.infrastructure.StackOperationResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class GetStackOperationResultService {

    private final StackOperationResultStore resultStore;

    /**
     * @throws IllegalArgumentException when the id is blank or unknown
     */
    public StackOperationResult getResult(String operationId) {
        if (operationId == null || operationId.isEmpty()) {
            log.warn("Invalid operationId provided");
            throw new IllegalArgumentException("operationId is required");
        }

        StackOperationResult result = resultStore.get(operationId);
        if (result == null) {
            log.warn("Stack operation result not found - operationId: {}", operationId);
            throw new IllegalArgumentException("No stack operation found: " + operationId);
        }

        log.debug("Stack operation result retrieved - operationId: {}, status: {}", operationId, result.getStatus());
        return result;
    }
}
