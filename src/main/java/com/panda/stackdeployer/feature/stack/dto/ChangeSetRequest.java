package com.panda.stackdeployer.feature.stack.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import software.amazon.awssdk.services.cloudformation.model.Capability;
import software.amazon.awssdk.services.cloudformation.model.ChangeSetType;
import software.amazon.awssdk.services.cloudformation.model.CreateChangeSetRequest;
import software.amazon.awssdk.services.cloudformation.model.Parameter;

import java.util.List;

/**
 * Everything sent with a CreateChangeSet call.
 *
 * - type: CREATE for a new stack, UPDATE for an existing one
 * - body: inline template or S3 URL
 * - roleArn: service role CloudFormation assumes, optional
 * - capabilities: always include the IAM capabilities since templates may carry managed policies
 */
@Value
@Builder
public class ChangeSetRequest {

    public static final List<Capability> REQUIRED_CAPABILITIES =
            List.of(Capability.CAPABILITY_IAM, Capability.CAPABILITY_NAMED_IAM);

    String stackName;
    String changeSetName;
    ChangeSetType type;
    String description;
    TemplateBodyParameter body;
    @Singular
    List<Parameter> parameters;
    String roleArn;
    @Builder.Default
    List<Capability> capabilities = REQUIRED_CAPABILITIES;

    public static String changeSetNameFor(String executionId) {
        return "CDK-" + executionId;
    }

    public static String descriptionFor(String executionId) {
        return "CDK Changeset for execution " + executionId;
    }

    public CreateChangeSetRequest toSdkRequest() {
        return CreateChangeSetRequest.builder()
                .stackName(stackName)
                .changeSetName(changeSetName)
                .changeSetType(type)
                .description(description)
                .templateBody(body.getTemplateBody())
                .templateURL(body.getTemplateUrl())
                .parameters(parameters)
                .roleARN(roleArn)
                .capabilities(capabilities)
                .build();
    }
}
