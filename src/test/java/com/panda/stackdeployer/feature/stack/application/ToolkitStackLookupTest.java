package com.panda.stackdeployer.feature.stack.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

import com.panda.stackdeployer.feature.stack.dto.StackEnvironment;
import com.panda.stackdeployer.feature.stack.infrastructure.AccessMode;
import com.panda.stackdeployer.feature.stack.infrastructure.CloudFormationClientFactory;
import com.panda.stackdeployer.feature.stack.infrastructure.ToolkitInfo;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.s3.S3Client;

@ExtendWith(MockitoExtension.class)
class ToolkitStackLookupTest {

    private static final StackEnvironment ENV = new StackEnvironment("123456789012", "us-east-1");

    @Mock
    private StackLookup stackLookup;

    @Mock
    private CloudFormationClientFactory clientFactory;

    @Mock
    private CloudFormationClient cfn;

    @Mock
    private S3Client s3;

    private ToolkitStackLookup toolkitStackLookup;

    @BeforeEach
    void setUp() {
        toolkitStackLookup = new ToolkitStackLookup(stackLookup, "CDKToolkit");
    }

    @Test
    @DisplayName("Reads the bucket from the toolkit stack outputs")
    void readsToolkitOutputs() {
        when(clientFactory.cloudFormation(ENV, AccessMode.READ)).thenReturn(cfn);
        when(clientFactory.s3(ENV, AccessMode.WRITE)).thenReturn(s3);
        when(stackLookup.stackOutputs(cfn, "CDKToolkit")).thenReturn(Map.of(
                "BucketName", "cdktoolkit-stagingbucket-1a2b",
                "BucketDomainName", "cdktoolkit-stagingbucket-1a2b.s3.us-east-1.amazonaws.com"));

        Optional<ToolkitInfo> toolkit = toolkitStackLookup.lookup(clientFactory, ENV);

        assertThat(toolkit).isPresent();
        assertThat(toolkit.get().getBucketName()).isEqualTo("cdktoolkit-stagingbucket-1a2b");
        assertThat(toolkit.get().getBucketUrl())
                .isEqualTo("https://cdktoolkit-stagingbucket-1a2b.s3.us-east-1.amazonaws.com");
    }

    @Test
    @DisplayName("Finds nothing in an environment that was never bootstrapped")
    void notBootstrapped() {
        when(clientFactory.cloudFormation(ENV, AccessMode.READ)).thenReturn(cfn);
        when(stackLookup.stackOutputs(cfn, "CDKToolkit")).thenReturn(Map.of());

        assertThat(toolkitStackLookup.resolve(clientFactory, ENV, null)).isEmpty();
        verify(clientFactory, never()).s3(ENV, AccessMode.WRITE);
    }

    @Test
    @DisplayName("Uses an explicitly named bucket without looking up the toolkit stack")
    void explicitBucket() {
        when(clientFactory.s3(ENV, AccessMode.WRITE)).thenReturn(s3);

        Optional<ToolkitInfo> toolkit = toolkitStackLookup.resolve(clientFactory, ENV, "my-bucket");

        assertThat(toolkit).hasValueSatisfying(t -> assertThat(t.getBucketName()).isEqualTo("my-bucket"));
        verifyNoInteractions(stackLookup);
    }
}
