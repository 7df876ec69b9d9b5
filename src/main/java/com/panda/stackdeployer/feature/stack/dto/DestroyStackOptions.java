package com.panda.stackdeployer.feature.stack.dto;

import com.panda.stackdeployer.feature.stack.event.StackActivityPublisher;
import com.panda.stackdeployer.feature.stack.infrastructure.CloudFormationClientFactory;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DestroyStackOptions {
    StackDescriptor stack;
    CloudFormationClientFactory clientFactory;
    String roleArn;
    String deployName;
    boolean quiet;
    StackActivityPublisher activityPublisher;

    public String resolveDeployName() {
        return deployName != null ? deployName : stack.getName();
    }
}
