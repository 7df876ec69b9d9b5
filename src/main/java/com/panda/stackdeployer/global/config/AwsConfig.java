package com.panda.stackdeployer.global.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.AwsSessionCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;

@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.credentials.access-key-id:}")
    private String accessKeyId;

    @Value("${aws.credentials.secret-access-key:}")
    private String secretAccessKey;

    @Value("${aws.credentials.session-token:}")
    private String sessionToken;

    /**
     * Credentials used for every CloudFormation and S3 client.
     *
     * Static keys are used when both aws.credentials.access-key-id and aws.credentials.secret-access-key
     * are set, otherwise the SDK default chain (environment, profile, instance role).
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        if (!accessKeyId.isEmpty() && !secretAccessKey.isEmpty()) {
            log.info("Using static AWS credentials");
            if (!sessionToken.isEmpty()) {
                return StaticCredentialsProvider.create(
                        AwsSessionCredentials.create(accessKeyId, secretAccessKey, sessionToken));
            }
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKeyId, secretAccessKey));
        }
        log.info("Using default AWS credentials provider chain");
        return DefaultCredentialsProvider.create();
    }
}
