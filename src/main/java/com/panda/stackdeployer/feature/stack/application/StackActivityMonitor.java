package com.panda.stackdeployer.feature.stack.application;

import com.panda.stackdeployer.feature.stack.dto.MetadataEntry;
import com.panda.stackdeployer.feature.stack.event.StackActivity;
import com.panda.stackdeployer.feature.stack.event.StackActivityPublisher;
import lombok.extern.slf4j.Slf4j;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;
import software.amazon.awssdk.services.cloudformation.model.DescribeStackEventsRequest;
import software.amazon.awssdk.services.cloudformation.model.DescribeStackEventsResponse;
import software.amazon.awssdk.services.cloudformation.model.StackEvent;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Follows the events of a stack while an operation runs on it, on its own thread.
 *
 * Only events newer than the monitor's creation are reported, each once, oldest first.
 * Failing to read events is logged and never affects the operation being watched.
 * {@link #start()} and {@link #stop()} are idempotent; {@link #stop()} reads one last time
 * so the final events are not lost.
 */
@Slf4j
public class StackActivityMonitor implements AutoCloseable {

    private static final String STACK_RESOURCE_TYPE = "AWS::CloudFormation::Stack";

    private final CloudFormationClient cfn;
    private final String stackName;
    private final Map<String, String> constructPathByLogicalId;
    private final Integer resourcesTotal;
    private final StackActivityPublisher publisher;
    private final long intervalMs;
    private final Instant startTime;

    private final Set<String> seenEventIds = new HashSet<>();
    private int resourcesDone;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> tick;
    private boolean started;
    private boolean stopped;

    public StackActivityMonitor(CloudFormationClient cfn,
                                String stackName,
                                Map<String, List<MetadataEntry>> metadata,
                                Integer resourcesTotal,
                                StackActivityPublisher publisher,
                                long intervalMs,
                                Clock clock) {
        this.cfn = cfn;
        this.stackName = stackName;
        this.constructPathByLogicalId = indexLogicalIds(metadata);
        this.resourcesTotal = resourcesTotal;
        this.publisher = publisher;
        this.intervalMs = Math.max(1, intervalMs);
        this.startTime = clock.instant();
    }

    public synchronized StackActivityMonitor start() {
        if (started) {
            return this;
        }
        started = true;
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "stack-activity-" + stackName);
            t.setDaemon(true);
            return t;
        });
        tick = scheduler.scheduleWithFixedDelay(this::readNewEvents, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        log.debug("Activity monitor started for stack {}", stackName);
        return this;
    }

    public void stop() {
        synchronized (this) {
            if (!started || stopped) {
                return;
            }
            stopped = true;
            tick.cancel(false);
            scheduler.shutdown();
        }
        try {
            if (!scheduler.awaitTermination(intervalMs + 5000, TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
                log.warn("Activity monitor for stack {} did not terminate in time", stackName);
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        readNewEvents();
        log.debug("Activity monitor stopped for stack {}", stackName);
    }

    @Override
    public void close() {
        stop();
    }

    public synchronized boolean isRunning() {
        return started && !stopped;
    }

    public synchronized int getResourcesDone() {
        return resourcesDone;
    }

    synchronized void readNewEvents() {
        try {
            List<StackEvent> fresh = fetchUnseenEvents();
            Collections.reverse(fresh);
            for (StackEvent event : fresh) {
                seenEventIds.add(event.eventId());
                report(event);
            }
        } catch (SdkException e) {
            log.debug("Could not read events of stack {}: {}", stackName, e.getMessage());
        } catch (RuntimeException e) {
            log.warn("Error while reporting activity of stack {}", stackName, e);
        }
    }

    // CloudFormation returns events newest first; stop paging at the first old or already seen event.
    // Ids are only marked seen once the whole read succeeded.
    private List<StackEvent> fetchUnseenEvents() {
        List<StackEvent> fresh = new ArrayList<>();
        String nextToken = null;
        do {
            DescribeStackEventsResponse page = cfn.describeStackEvents(DescribeStackEventsRequest.builder()
                    .stackName(stackName)
                    .nextToken(nextToken)
                    .build());
            for (StackEvent event : page.stackEvents()) {
                if (event.timestamp() != null && event.timestamp().isBefore(startTime)) {
                    return fresh;
                }
                if (seenEventIds.contains(event.eventId())) {
                    return fresh;
                }
                fresh.add(event);
            }
            nextToken = page.nextToken();
        } while (nextToken != null);
        return fresh;
    }

    private void report(StackEvent event) {
        String status = event.resourceStatusAsString();
        if (status != null && status.endsWith("_COMPLETE") && !isStackItself(event)) {
            resourcesDone++;
        }

        StackActivity activity = StackActivity.builder()
                .eventId(event.eventId())
                .timestamp(event.timestamp())
                .stackName(stackName)
                .logicalResourceId(event.logicalResourceId())
                .constructPath(constructPathByLogicalId.get(event.logicalResourceId()))
                .resourceType(event.resourceType())
                .resourceStatus(status)
                .statusReason(event.resourceStatusReason())
                .resourcesDone(resourcesDone)
                .resourcesTotal(resourcesTotal)
                .build();

        String resource = activity.getConstructPath() != null ? activity.getConstructPath() : activity.getLogicalResourceId();
        if (activity.isFailure()) {
            log.warn("{} | {} | {} | {} | {} {}", activity.progress(), activity.getTimestamp(), status,
                    activity.getResourceType(), resource, activity.getStatusReason());
        } else {
            log.info("{} | {} | {} | {} | {}", activity.progress(), activity.getTimestamp(), status,
                    activity.getResourceType(), resource);
        }

        if (publisher != null) {
            publisher.publish(activity);
        }
    }

    private boolean isStackItself(StackEvent event) {
        return STACK_RESOURCE_TYPE.equals(event.resourceType()) && stackName.equals(event.logicalResourceId());
    }

    private static Map<String, String> indexLogicalIds(Map<String, List<MetadataEntry>> metadata) {
        Map<String, String> index = new HashMap<>();
        if (metadata == null) {
            return index;
        }
        metadata.forEach((path, entries) -> {
            if (entries == null) {
                return;
            }
            for (MetadataEntry entry : entries) {
                if (MetadataEntry.LOGICAL_ID.equals(entry.getType()) && entry.getData() != null) {
                    index.put(entry.getData().toString(), path);
                }
            }
        });
        return index;
    }
}
