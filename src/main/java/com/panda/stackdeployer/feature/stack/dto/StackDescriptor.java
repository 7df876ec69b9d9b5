package com.panda.stackdeployer.feature.stack.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A synthesized stack: the template to deploy plus where and under which name.
 *
 * Metadata is keyed by construct path; entries of type {@link MetadataEntry#LOGICAL_ID}
 * map a template logical id back to the construct that produced it.
 */
@Value
@Builder(toBuilder = true)
public class StackDescriptor {
    String name;
    StackEnvironment environment;   // null when unresolved
    @Builder.Default
    Map<String, Object> template = Map.of();
    @Builder.Default
    Map<String, List<MetadataEntry>> metadata = Map.of();
    @Builder.Default
    Map<String, String> parameters = Map.of();
}
