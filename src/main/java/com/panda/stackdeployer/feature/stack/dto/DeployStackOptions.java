package com.panda.stackdeployer.feature.stack.dto;

import com.panda.stackdeployer.feature.stack.event.StackActivityPublisher;
import com.panda.stackdeployer.feature.stack.infrastructure.CloudFormationClientFactory;
import com.panda.stackdeployer.feature.stack.infrastructure.ToolkitInfo;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeployStackOptions {
    StackDescriptor stack;
    CloudFormationClientFactory clientFactory;
    ToolkitInfo toolkitInfo;                    // optional, enables S3 template upload
    String roleArn;                             // optional
    String deployName;                          // optional, defaults to the stack name
    boolean quiet;
    StackActivityPublisher activityPublisher;   // optional

    public String resolveDeployName() {
        return deployName != null ? deployName : stack.getName();
    }
}
