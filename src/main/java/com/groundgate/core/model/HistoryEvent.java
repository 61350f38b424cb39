package com.groundgate.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One entry in a task's append-only history.
 *
 * @param event     event name: start, retry, complete, blocked
 * @param status    task status when the event was recorded
 * @param payload   event details; values are plain JSON-friendly types
 * @param timestamp when the event was recorded
 */
public record HistoryEvent(
    String event,
    TaskStatus status,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public HistoryEvent {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
