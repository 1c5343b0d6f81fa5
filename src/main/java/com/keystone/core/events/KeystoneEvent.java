package com.keystone.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted during workflow execution; the reasoning trail persists every one.
 *
 * @param eventType  dotted event type (e.g. "workflow.started", "step.gated", "conflict.escalated")
 * @param workflowId the workflow this event belongs to
 * @param stepId     the step this event relates to (nullable for workflow-level events)
 * @param payload    arbitrary key-value data associated with the event
 * @param timestamp  when the event occurred
 */
public record KeystoneEvent(
    String eventType,
    String workflowId,
    String stepId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static KeystoneEvent of(String eventType, String workflowId, String stepId, Map<String, Object> payload) {
        return new KeystoneEvent(eventType, workflowId, stepId, payload == null ? Map.of() : payload, Instant.now());
    }
}
