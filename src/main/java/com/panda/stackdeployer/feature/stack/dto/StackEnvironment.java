package com.panda.stackdeployer.feature.stack.dto;

import lombok.Value;

/**
 * Account and region a stack is deployed into.
 */
@Value
public class StackEnvironment {
    String account;
    String region;

    public String getName() {
        return "aws://" + account + "/" + region;
    }
}
