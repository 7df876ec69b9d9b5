package com.panda.stackdeployer.feature.stack.application;

import com.panda.stackdeployer.feature.stack.event.StackActivityStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class StreamStackEventsService {

    private final StackActivityStore stackActivityStore;
    private final GetStackOperationResultService getStackOperationResultService;

    public SseEmitter stream(String operationId) {
        // unknown ids are rejected before an emitter is opened
        getStackOperationResultService.getResult(operationId);

        SseEmitter emitter = stackActivityStore.registerEmitter(operationId);
        try {
            emitter.send(SseEmitter.event()
                    .id(UUID.randomUUID().toString())
                    .name("connected")
                    .reconnectTime(3000)
                    .data(Map.of("message", "SSE connection established", "operationId", operationId)));
        } catch (IOException e) {
            log.warn("Failed to send connected event for operation: {}", operationId, e);
        }
        return emitter;
    }
}
