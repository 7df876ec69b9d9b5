package com.panda.stackdeployer.feature.stack.application;

import com.panda.stackdeployer.feature.stack.dto.MetadataEntry;
import com.panda.stackdeployer.feature.stack.event.StackActivityPublisher;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.cloudformation.CloudFormationClient;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@Component
public class StackActivityMonitorFactory {

    private final long intervalMs;

    public StackActivityMonitorFactory(@Value("${stack.deploy.activity-interval-ms:2000}") long intervalMs) {
        this.intervalMs = intervalMs;
    }

    /**
     * @param resourcesTotal number of changes expected, null when unknown
     */
    public StackActivityMonitor create(CloudFormationClient cfn,
                                       String stackName,
                                       Map<String, List<MetadataEntry>> metadata,
                                       Integer resourcesTotal,
                                       StackActivityPublisher publisher) {
        return new StackActivityMonitor(cfn, stackName, metadata, resourcesTotal, publisher, intervalMs,
                Clock.systemUTC());
    }
}
