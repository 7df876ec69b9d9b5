package com.panda.stackdeployer.feature.stack.application;

import com.panda.stackdeployer.feature.stack.dto.StackEnvironment;
import com.panda.stackdeployer.feature.stack.infrastructure.AccessMode;
import com.panda.stackdeployer.feature.stack.infrastructure.CloudFormationClientFactory;
import com.panda.stackdeployer.feature.stack.infrastructure.ToolkitInfo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;

import java.util.Map;
import java.util.Optional;

/**
 * Finds the toolkit staging bucket of an environment from the outputs of its toolkit stack.
 */
@Slf4j
@Component
public class ToolkitStackLookup {

    static final String BUCKET_NAME_OUTPUT = "BucketName";
    static final String BUCKET_DOMAIN_NAME_OUTPUT = "BucketDomainName";

    private final StackLookup stackLookup;
    private final String toolkitStackName;

    public ToolkitStackLookup(StackLookup stackLookup,
                              @Value("${stack.toolkit.stack-name:CDKToolkit}") String toolkitStackName) {
        this.stackLookup = stackLookup;
        this.toolkitStackName = toolkitStackName;
    }

    /**
     * Uses the explicitly named bucket if given, otherwise looks up the toolkit stack.
     *
     * @return the toolkit, or empty when the environment has not been bootstrapped
     */
    public Optional<ToolkitInfo> resolve(CloudFormationClientFactory clientFactory,
                                         StackEnvironment environment,
                                         String explicitBucket) {
        if (explicitBucket != null && !explicitBucket.isBlank()) {
            return Optional.of(ToolkitInfo.forBucket(clientFactory.s3(environment, AccessMode.WRITE), explicitBucket));
        }
        return lookup(clientFactory, environment);
    }

    public Optional<ToolkitInfo> lookup(CloudFormationClientFactory clientFactory, StackEnvironment environment) {
        CloudFormationClient cfn = clientFactory.cloudFormation(environment, AccessMode.READ);
        Map<String, String> outputs = stackLookup.stackOutputs(cfn, toolkitStackName);

        String bucketName = outputs.get(BUCKET_NAME_OUTPUT);
        if (bucketName == null) {
            log.debug("No toolkit stack {} found in {}", toolkitStackName, environment.getName());
            return Optional.empty();
        }
        String bucketEndpoint = outputs.getOrDefault(BUCKET_DOMAIN_NAME_OUTPUT, bucketName + ".s3.amazonaws.com");
        log.debug("Using toolkit bucket {} from stack {} in {}", bucketName, toolkitStackName, environment.getName());
        return Optional.of(new ToolkitInfo(clientFactory.s3(environment, AccessMode.WRITE), bucketName, bucketEndpoint));
    }
}
