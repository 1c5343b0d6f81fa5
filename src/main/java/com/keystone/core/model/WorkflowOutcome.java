package com.keystone.core.model;

import java.util.List;

/**
 * What an orchestration instance returns when it stops.
 *
 * @param workflowId      workflow the instance ran
 * @param status          why it stopped
 * @param plan            plan as re-read from storage at stop time
 * @param issues          structured issues raised during the run
 * @param handoffPackage  package written when status is HANDOFF_TRIGGERED, else null
 * @param wavesExecuted   number of waves dispatched by this instance
 */
public record WorkflowOutcome(
    String workflowId,
    OutcomeStatus status,
    Plan plan,
    List<OrchestrationIssue> issues,
    HandoffPackage handoffPackage,
    int wavesExecuted
) {

    public WorkflowOutcome {
        issues = issues == null ? List.of() : List.copyOf(issues);
    }
}
