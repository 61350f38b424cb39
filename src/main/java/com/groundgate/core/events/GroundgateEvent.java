package com.groundgate.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run executes.
 *
 * @param eventType  event type (e.g. "run.started", "task.retry", "task.completed")
 * @param rootTaskId the root task this event belongs to
 * @param taskId     the subtask this event relates to (nullable for run-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record GroundgateEvent(
    String eventType,
    String rootTaskId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static GroundgateEvent of(String eventType, String rootTaskId, String taskId,
                                     Map<String, Object> payload) {
        return new GroundgateEvent(eventType, rootTaskId, taskId, payload, Instant.now());
    }
}
