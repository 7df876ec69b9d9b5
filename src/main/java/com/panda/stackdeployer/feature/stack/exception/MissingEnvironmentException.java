package com.panda.stackdeployer.feature.stack.exception;

public class MissingEnvironmentException extends StackDeploymentException {

    public MissingEnvironmentException(String stackName) {
        super("The stack " + stackName + " does not have an environment", stackName, "CONFIGURATION_ERROR");
    }
}
