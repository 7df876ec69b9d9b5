package com.panda.stackdeployer.feature.stack.exception;

public class TemplateTooLargeException extends StackDeploymentException {

    private final long templateSizeBytes;
    private final long thresholdBytes;

    public TemplateTooLargeException(String message, String stackName, long templateSizeBytes, long thresholdBytes) {
        super(message, stackName, "TEMPLATE_TOO_LARGE");
        this.templateSizeBytes = templateSizeBytes;
        this.thresholdBytes = thresholdBytes;
    }

    public long getTemplateSizeBytes() {
        return templateSizeBytes;
    }

    public long getThresholdBytes() {
        return thresholdBytes;
    }
}
