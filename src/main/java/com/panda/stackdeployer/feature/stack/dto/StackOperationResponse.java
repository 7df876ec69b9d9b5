package com.panda.stackdeployer.feature.stack.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Accepted stack operation")
public class StackOperationResponse {
    @Schema(description = "Operation ID", example = "op_1a2b3c4d5e")
    private String operationId;

    @Schema(description = "Stack name the operation targets", example = "demo")
    private String deployName;

    @Schema(description = "Hint for following the operation")
    private String message;
}
