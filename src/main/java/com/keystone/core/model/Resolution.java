package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Outcome of resolving a conflict. Escalations are resolutions too and are always recorded.
 *
 * @param accepted         true when one output was accepted
 * @param acceptedOutputId ID of the accepted output ({@code artifact@step}), or null when escalated
 * @param acceptedStepId   step that produced the accepted output, or null when escalated
 * @param resolvedBy       authority role, "consensus", or "operator"
 * @param rationale        why this outcome was reached
 * @param decidedAt        when the decision was made
 */
public record Resolution(
    boolean accepted,
    String acceptedOutputId,
    String acceptedStepId,
    String resolvedBy,
    String rationale,
    Instant decidedAt
) implements Serializable {

    public static Resolution accepted(String outputId, String stepId, String resolvedBy, String rationale) {
        return new Resolution(true, outputId, stepId, resolvedBy, rationale, Instant.now());
    }

    public static Resolution escalated(String resolvedBy, String rationale) {
        return new Resolution(false, null, null, resolvedBy, rationale, Instant.now());
    }
}
