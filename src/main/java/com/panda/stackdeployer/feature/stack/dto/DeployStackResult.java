package com.panda.stackdeployer.feature.stack.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class DeployStackResult {
    boolean noOp;
    Map<String, String> outputs;
    String stackArn;
}
