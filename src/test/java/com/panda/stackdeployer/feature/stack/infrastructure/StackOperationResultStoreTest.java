package com.panda.stackdeployer.feature.stack.infrastructure;

import static org.assertj.core.api.Assertions.assertThat;

import com.panda.stackdeployer.feature.stack.dto.StackOperationResult;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StackOperationResultStoreTest {

    private StackOperationResultStore store;

    @BeforeEach
    void setUp() {
        store = new StackOperationResultStore();
    }

    private static StackOperationResult result(String id, String status) {
        return StackOperationResult.builder()
                .operationId(id)
                .deployName("demo")
                .status(status)
                .build();
    }

    @Test
    @DisplayName("Saving the same operation again replaces it")
    void replacesExisting() {
        store.save(result("op_1", StackOperationResult.RUNNING));
        store.save(result("op_1", StackOperationResult.SUCCEEDED));

        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get("op_1").getStatus()).isEqualTo(StackOperationResult.SUCCEEDED);
    }

    @Test
    @DisplayName("Ignores results without an operation id")
    void ignoresInvalid() {
        store.save(null);
        store.save(result(null, StackOperationResult.RUNNING));

        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("Evicts the oldest result beyond the limit")
    void evictsOldest() {
        for (int i = 0; i <= 1000; i++) {
            store.save(result("op_" + i, StackOperationResult.SUCCEEDED));
        }

        assertThat(store.size()).isEqualTo(1000);
        assertThat(store.get("op_0")).isNull();
        assertThat(store.get("op_1000")).isNotNull();
    }

    @Test
    @DisplayName("Lists results by status, most recently completed first")
    void byStatus() {
        StackOperationResult older = result("op_1", StackOperationResult.FAILED);
        older.setCompletedAt(LocalDateTime.of(2024, 5, 1, 10, 0));
        StackOperationResult newer = result("op_2", StackOperationResult.FAILED);
        newer.setCompletedAt(LocalDateTime.of(2024, 5, 1, 11, 0));
        store.save(older);
        store.save(newer);
        store.save(result("op_3", StackOperationResult.RUNNING));

        assertThat(store.getByStatus(StackOperationResult.FAILED))
                .extracting(StackOperationResult::getOperationId)
                .containsExactly("op_2", "op_1");
    }
}
