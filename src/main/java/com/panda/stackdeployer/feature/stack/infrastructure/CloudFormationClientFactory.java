package com.panda.stackdeployer.feature.stack.infrastructure;

import com.panda.stackdeployer.feature.stack.dto.StackEnvironment;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.s3.S3Client;

/**
 * Hands out authenticated clients scoped to a stack environment.
 * Passed explicitly into each deploy/destroy call.
 */
public interface CloudFormationClientFactory {

    CloudFormationClient cloudFormation(StackEnvironment environment, AccessMode mode);

    S3Client s3(StackEnvironment environment, AccessMode mode);
}
