package com.panda.stackdeployer.feature.stack.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
@Schema(description = "Stack deploy request")
public class StackDeployRequest {
    @Schema(description = "Stack name", example = "demo")
    private String stackName;

    @Schema(description = "Target AWS account", example = "123456789012")
    private String account;

    @Schema(description = "Target AWS region", example = "us-east-1")
    private String region;

    @Schema(description = "Synthesized CloudFormation template")
    private Map<String, Object> template;

    @Schema(description = "Construct metadata keyed by construct path")
    private Map<String, List<MetadataEntry>> metadata;

    @Schema(description = "Stack parameter values")
    private Map<String, String> parameters;

    @Schema(description = "Role CloudFormation assumes for the deployment",
            example = "arn:aws:iam::123456789012:role/cfn-exec")
    private String roleArn;

    @Schema(description = "Name to deploy the stack under, defaults to stackName")
    private String deployName;

    @Schema(description = "Toolkit bucket for template upload", example = "cdktoolkit-stagingbucket-1a2b3c")
    private String toolkitBucket;

    @Schema(description = "Skip the stack activity monitor")
    private boolean quiet;

    public StackDescriptor toDescriptor() {
        return StackDescriptor.builder()
                .name(stackName)
                .environment(account != null && region != null ? new StackEnvironment(account, region) : null)
                .template(template != null ? template : Map.of())
                .metadata(metadata != null ? metadata : Map.of())
                .parameters(parameters != null ? parameters : Map.of())
                .build();
    }
}
