package com.panda.stackdeployer.feature.stack.exception;

public class StackWaitTimeoutException extends StackDeploymentException {

    private final Long waitedMillis;
    private final Long timeoutMillis;

    public StackWaitTimeoutException(String message, String stackName, Long waitedMillis, Long timeoutMillis) {
        super(message, stackName, "STACK_WAIT_TIMEOUT");
        this.waitedMillis = waitedMillis;
        this.timeoutMillis = timeoutMillis;
    }

    public Long getWaitedMillis() {
        return waitedMillis;
    }

    public Long getTimeoutMillis() {
        return timeoutMillis;
    }
}
