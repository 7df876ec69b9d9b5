package com.panda.stackdeployer.feature.stack.infrastructure;

import com.panda.stackdeployer.feature.stack.dto.StackOperationResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory store of stack operation results.
 * - keeps at most 1000 results
 * - evicts the oldest first
 */
@Slf4j
@Component
public class StackOperationResultStore {

    private static final int MAX_RESULTS = 1000;
    private final Map<String, StackOperationResult> results = new ConcurrentHashMap<>();
    private final LinkedHashMap<String, Long> insertionOrder = new LinkedHashMap<>();

    public synchronized void save(StackOperationResult result) {
        if (result == null || result.getOperationId() == null) {
            log.warn("Cannot save null or invalid stack operation result");
            return;
        }

        String operationId = result.getOperationId();
        if (results.containsKey(operationId)) {
            insertionOrder.remove(operationId);
            log.debug("Updating existing result for operationId: {}", operationId);
        }

        results.put(operationId, result);
        insertionOrder.put(operationId, System.currentTimeMillis());

        log.info("Stack operation result saved - operationId: {}, deployName: {}, status: {}",
                operationId, result.getDeployName(), result.getStatus());

        if (results.size() > MAX_RESULTS) {
            evictOldest();
        }
    }

    public synchronized void remove(String operationId) {
        if (results.remove(operationId) != null) {
            insertionOrder.remove(operationId);
            log.debug("Stack operation result removed - operationId: {}", operationId);
        }
    }

    public StackOperationResult get(String operationId) {
        return results.get(operationId);
    }

    /**
     * Results of the given status, most recently completed first.
     *
     * @param status RUNNING, SUCCEEDED, NO_OP or FAILED
     */
    public List<StackOperationResult> getByStatus(String status) {
        return results.values().stream()
                .filter(r -> status.equals(r.getStatus()))
                .sorted(Comparator.comparing(StackOperationResult::getCompletedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    public int size() {
        return results.size();
    }

    private void evictOldest() {
        if (insertionOrder.isEmpty()) {
            return;
        }
        String oldestOperationId = insertionOrder.keySet().iterator().next();
        results.remove(oldestOperationId);
        insertionOrder.remove(oldestOperationId);

        log.info("Evicted oldest stack operation result due to size limit - operationId: {}", oldestOperationId);
    }
}
