package com.panda.stackdeployer.feature.stack.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps the event history of each stack operation and fans events out to SSE clients.
 * Clients that connect late get the history replayed first. Once an operation has finished,
 * its history is kept for {@code stack.events.history-retention-ms} and then dropped.
 */
@Slf4j
@Component
public class StackActivityStore {

    private static final long EMITTER_TIMEOUT_MS = 60 * 60 * 1000L;

    // operationId -> connected SSE clients
    private final Map<String, List<SseEmitter>> emitterMap = new ConcurrentHashMap<>();

    // operationId -> events so far
    private final Map<String, Queue<StackActivityEvent>> eventHistoryMap = new ConcurrentHashMap<>();

    private final ScheduledExecutorService closer = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-closer");
        t.setDaemon(true);
        return t;
    });

    private final long closeDelayMs;
    private final long historyRetentionMs;

    public StackActivityStore(@Value("${stack.events.close-delay-ms:5000}") long closeDelayMs,
                              @Value("${stack.events.history-retention-ms:600000}") long historyRetentionMs) {
        this.closeDelayMs = closeDelayMs;
        this.historyRetentionMs = historyRetentionMs;
    }

    public SseEmitter registerEmitter(String operationId) {
        SseEmitter emitter = new SseEmitter(EMITTER_TIMEOUT_MS);

        emitter.onCompletion(() -> removeEmitter(operationId, emitter));
        emitter.onTimeout(() -> removeEmitter(operationId, emitter));
        emitter.onError(throwable -> removeEmitter(operationId, emitter));

        for (StackActivityEvent event : getHistory(operationId)) {
            try {
                emitter.send(toSseEvent(event));
            } catch (IOException e) {
                log.warn("Failed to replay history to emitter for operation: {}", operationId, e);
                return emitter;
            }
        }

        emitterMap.computeIfAbsent(operationId, k -> Collections.synchronizedList(new ArrayList<>()))
                .add(emitter);

        log.info("SSE emitter registered for operation: {}", operationId);
        return emitter;
    }

    private void removeEmitter(String operationId, SseEmitter emitter) {
        List<SseEmitter> emitters = emitterMap.get(operationId);
        if (emitters != null) {
            emitters.remove(emitter);
            log.debug("SSE emitter removed for operation: {}, remaining: {}", operationId, emitters.size());
        }
    }

    public void broadcastEvent(String operationId, StackActivityEvent event) {
        eventHistoryMap.computeIfAbsent(operationId, k -> new ConcurrentLinkedQueue<>())
                .offer(event);

        List<SseEmitter> emitters = emitterMap.get(operationId);
        if (emitters == null || emitters.isEmpty()) {
            return;
        }

        List<SseEmitter> failedEmitters = new ArrayList<>();
        synchronized (emitters) {
            for (SseEmitter emitter : emitters) {
                try {
                    emitter.send(toSseEvent(event));
                } catch (IOException e) {
                    log.warn("Failed to send event to emitter for operation: {}", operationId, e);
                    failedEmitters.add(emitter);
                }
            }
        }
        failedEmitters.forEach(failed -> removeEmitter(operationId, failed));
    }

    // "success" event, connections are closed shortly after
    public void sendDoneEvent(String operationId, String message, Map<String, Object> details) {
        StackActivityEvent event = new StackActivityEvent("success", message, withTimestamp(details));
        broadcastEvent(operationId, event);
        scheduleClose(operationId);
    }

    // "fail" event, connections are closed shortly after
    public void sendErrorEvent(String operationId, String message, Map<String, Object> errorDetails) {
        StackActivityEvent event = new StackActivityEvent("fail", message, withTimestamp(errorDetails));

        log.info("[Error Event] type: fail, message: {}, details: {}", message, event.getDetails());

        broadcastEvent(operationId, event);
        scheduleClose(operationId);
    }

    public List<StackActivityEvent> getHistory(String operationId) {
        Queue<StackActivityEvent> history = eventHistoryMap.get(operationId);
        return history != null ? new ArrayList<>(history) : List.of();
    }

    public int getEventCount(String operationId) {
        Queue<StackActivityEvent> history = eventHistoryMap.get(operationId);
        return history != null ? history.size() : 0;
    }

    public void closeAllEmitters(String operationId) {
        List<SseEmitter> emitters = emitterMap.remove(operationId);
        if (emitters == null) {
            return;
        }
        synchronized (emitters) {
            for (SseEmitter emitter : emitters) {
                try {
                    emitter.complete();
                } catch (Exception e) {
                    log.warn("Failed to complete emitter for operation: {}", operationId, e);
                }
            }
        }
        log.info("All SSE emitters closed for operation: {}", operationId);
    }

    @PreDestroy
    public void shutdown() {
        closer.shutdownNow();
    }

    // the history outlives the connections so late subscribers still get a replay
    private void scheduleClose(String operationId) {
        closer.schedule(() -> closeAllEmitters(operationId), closeDelayMs, TimeUnit.MILLISECONDS);
        closer.schedule(() -> evictHistory(operationId), closeDelayMs + historyRetentionMs, TimeUnit.MILLISECONDS);
    }

    void evictHistory(String operationId) {
        if (eventHistoryMap.remove(operationId) != null) {
            log.debug("Event history evicted for operation: {}", operationId);
        }
    }

    private static Map<String, Object> withTimestamp(Map<String, Object> details) {
        Map<String, Object> unified = new HashMap<>();
        unified.put("timestamp", java.time.Instant.now().toString());
        if (details != null) {
            unified.putAll(details);
        }
        return unified;
    }

    private static SseEmitter.SseEventBuilder toSseEvent(StackActivityEvent event) {
        String eventType = event.getType() != null ? event.getType() : "activity";
        return SseEmitter.event()
                .id(UUID.randomUUID().toString())
                .name(eventType)
                .reconnectTime(3000)
                .data(event);
    }
}
