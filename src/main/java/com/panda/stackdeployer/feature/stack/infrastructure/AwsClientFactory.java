package com.panda.stackdeployer.feature.stack.infrastructure;

import com.panda.stackdeployer.feature.stack.dto.StackEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.core.SdkClient;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.s3.S3Client;

import jakarta.annotation.PreDestroy;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds CloudFormation and S3 clients per region from the configured credentials provider.
 * Clients are reused per region and closed on shutdown.
 */
@Slf4j
@Component
public class AwsClientFactory implements CloudFormationClientFactory {

    private final AwsCredentialsProvider credentialsProvider;
    private final Map<String, SdkClient> clients = new ConcurrentHashMap<>();

    public AwsClientFactory(AwsCredentialsProvider credentialsProvider) {
        this.credentialsProvider = credentialsProvider;
    }

    @Override
    public CloudFormationClient cloudFormation(StackEnvironment environment, AccessMode mode) {
        log.debug("CloudFormation client requested for {} ({})", environment.getName(), mode);
        return (CloudFormationClient) clients.computeIfAbsent("cloudformation:" + environment.getRegion(),
                k -> CloudFormationClient.builder()
                        .region(Region.of(environment.getRegion()))
                        .credentialsProvider(credentialsProvider)
                        .build());
    }

    @Override
    public S3Client s3(StackEnvironment environment, AccessMode mode) {
        log.debug("S3 client requested for {} ({})", environment.getName(), mode);
        return (S3Client) clients.computeIfAbsent("s3:" + environment.getRegion(),
                k -> S3Client.builder()
                        .region(Region.of(environment.getRegion()))
                        .credentialsProvider(credentialsProvider)
                        .build());
    }

    @PreDestroy
    public void close() {
        clients.values().forEach(client -> {
            try {
                client.close();
            } catch (Exception e) {
                log.warn("Failed to close AWS client {}", client.serviceName(), e);
            }
        });
        clients.clear();
    }
}
