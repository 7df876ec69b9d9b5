package com.panda.stackdeployer.feature.stack.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.panda.stackdeployer.feature.stack.dto.StackOperationResult;
import com.panda.stackdeployer.feature.stack.infrastructure.StackOperationResultStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GetStackOperationResultServiceTest {

    private StackOperationResultStore resultStore;
    private GetStackOperationResultService service;

    @BeforeEach
    void setUp() {
        resultStore = new StackOperationResultStore();
        service = new GetStackOperationResultService(resultStore);
    }

    @Test
    @DisplayName("Returns a stored result")
    void returnsResult() {
        resultStore.save(StackOperationResult.builder().operationId("op_1").status(StackOperationResult.RUNNING).build());

        assertThat(service.getResult("op_1").getStatus()).isEqualTo(StackOperationResult.RUNNING);
    }

    @Test
    @DisplayName("Rejects unknown and blank ids")
    void rejectsUnknown() {
        assertThatThrownBy(() -> service.getResult("op_missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("op_missing");
        assertThatThrownBy(() -> service.getResult("")).isInstanceOf(IllegalArgumentException.class);
    }
}
