package com.panda.stackdeployer.feature.stack.application;

import com.panda.stackdeployer.feature.stack.dto.StackDescriptor;
import com.panda.stackdeployer.feature.stack.infrastructure.ToolkitInfo;
import software.amazon.awssdk.services.cloudformation.model.Parameter;

import java.util.List;

/**
 * Produces the CloudFormation parameters a stack is deployed with, e.g. asset locations.
 */
public interface StackParameterPreparer {

    List<Parameter> prepare(StackDescriptor stack, ToolkitInfo toolkitInfo);
}
