package com.panda.stackdeployer.feature.stack.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class MetadataEntry {

    public static final String LOGICAL_ID = "aws:cdk:logicalId";

    private String type;
    private Object data;
}
