package com.panda.stackdeployer.feature.stack.event;

/**
 * Receives stack events rendered by the activity monitor.
 */
@FunctionalInterface
public interface StackActivityPublisher {

    void publish(StackActivity activity);
}
