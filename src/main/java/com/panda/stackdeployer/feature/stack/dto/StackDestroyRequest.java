package com.panda.stackdeployer.feature.stack.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "Stack destroy request")
public class StackDestroyRequest {
    @Schema(description = "Stack name", example = "demo")
    private String stackName;

    @Schema(description = "Target AWS account", example = "123456789012")
    private String account;

    @Schema(description = "Target AWS region", example = "us-east-1")
    private String region;

    @Schema(description = "Role CloudFormation assumes for the deletion")
    private String roleArn;

    @Schema(description = "Name the stack was deployed under, defaults to stackName")
    private String deployName;

    @Schema(description = "Skip the stack activity monitor")
    private boolean quiet;

    public StackDescriptor toDescriptor() {
        return StackDescriptor.builder()
                .name(stackName)
                .environment(account != null && region != null ? new StackEnvironment(account, region) : null)
                .build();
    }
}
