package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * Structured report of a failure, detailed enough to reproduce it.
 *
 * @param kind       taxonomy entry
 * @param workflowId workflow the issue occurred in
 * @param stepId     step involved, or null for workflow-level issues
 * @param message    human-readable summary
 * @param details    reproduction details (attempt numbers, artifact names, thresholds, ...)
 * @param at         when the issue was raised
 */
public record OrchestrationIssue(
    IssueKind kind,
    String workflowId,
    String stepId,
    String message,
    Map<String, String> details,
    Instant at
) implements Serializable {

    public OrchestrationIssue {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    public static OrchestrationIssue of(IssueKind kind, String workflowId, String stepId,
                                        String message, Map<String, String> details) {
        return new OrchestrationIssue(kind, workflowId, stepId, message, details, Instant.now());
    }
}
