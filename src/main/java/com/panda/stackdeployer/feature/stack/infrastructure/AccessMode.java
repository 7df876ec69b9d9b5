package com.panda.stackdeployer.feature.stack.infrastructure;

public enum AccessMode {
    READ,
    WRITE
}
