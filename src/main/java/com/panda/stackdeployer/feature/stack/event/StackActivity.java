package com.panda.stackdeployer.feature.stack.event;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One stack event as shown by the activity monitor.
 */
@Value
@Builder
public class StackActivity {
    String eventId;
    Instant timestamp;
    String stackName;
    String logicalResourceId;
    String constructPath;       // null when the metadata has no entry for the logical id
    String resourceType;
    String resourceStatus;
    String statusReason;
    int resourcesDone;
    Integer resourcesTotal;     // null when unknown, e.g. during destroy

    public String progress() {
        return resourcesTotal != null ? resourcesDone + "/" + resourcesTotal : String.valueOf(resourcesDone);
    }

    public boolean isFailure() {
        return resourceStatus != null && resourceStatus.endsWith("_FAILED");
    }
}
