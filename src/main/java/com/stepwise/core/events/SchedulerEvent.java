package com.stepwise.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during a run, consumed by the CLI for live progress.
 *
 * @param eventType event type (e.g. "run.started", "group.started", "task.failed", "checkpoint.created")
 * @param runId     the run this event belongs to
 * @param taskId    the task this event relates to (nullable for run- and group-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record SchedulerEvent(
    String eventType,
    String runId,
    String taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static SchedulerEvent of(String eventType, String runId, String taskId, Map<String, Object> payload) {
        return new SchedulerEvent(eventType, runId, taskId, payload, Instant.now());
    }
}
