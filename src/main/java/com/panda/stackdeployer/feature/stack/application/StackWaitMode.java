package com.panda.stackdeployer.feature.stack.application;

/**
 * What the caller of {@link StackStatePoller#waitForStack} expects to happen to the stack.
 */
public enum StackWaitMode {
    /** Stack is being created or updated: disappearance and failure states are errors. */
    DEPLOY,
    /** Stack is being deleted: disappearance is success, terminal states are returned as-is. */
    DELETE
}
