package com.stagegate.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a run progresses; the CLI renders these as progress lines.
 *
 * @param eventType event type, e.g. "run.created", "stage.entered", "task.started", "gate.decided"
 * @param runId     the run this event belongs to
 * @param taskId    the task this event relates to (nullable for run- and stage-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record WorkflowEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static WorkflowEvent of(String eventType, String runId, Map<String, Object> payload) {
        return new WorkflowEvent(eventType, runId, null, payload, Instant.now());
    }
}
