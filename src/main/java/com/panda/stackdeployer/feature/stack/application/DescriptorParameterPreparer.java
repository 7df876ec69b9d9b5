package com.panda.stackdeployer.feature.stack.application;

import com.panda.stackdeployer.feature.stack.dto.StackDescriptor;
import com.panda.stackdeployer.feature.stack.infrastructure.ToolkitInfo;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.cloudformation.model.Parameter;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Passes the parameter values declared on the descriptor through, ordered by key.
 */
@Component
public class DescriptorParameterPreparer implements StackParameterPreparer {

    @Override
    public List<Parameter> prepare(StackDescriptor stack, ToolkitInfo toolkitInfo) {
        return stack.getParameters().entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> Parameter.builder()
                        .parameterKey(entry.getKey())
                        .parameterValue(entry.getValue())
                        .build())
                .collect(Collectors.toList());
    }
}
