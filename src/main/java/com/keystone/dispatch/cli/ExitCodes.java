package com.keystone.dispatch.cli;

import com.keystone.core.model.IssueKind;
import com.keystone.core.model.OrchestrationIssue;
import com.keystone.core.model.OutcomeStatus;
import com.keystone.core.model.Step;
import com.keystone.core.model.StepStatus;
import com.keystone.core.model.WorkflowOutcome;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Process exit codes of the CLI.
 */
public final class ExitCodes {

    public static final int OK = 0;
    public static final int FAILED = 1;
    public static final int INVALID = 2;
    public static final int HANDOFF = 3;
    public static final int BLOCKED = 4;

    private static final String CANCELLED = "cancelled by operator";

    private ExitCodes() {}

    public static int of(OutcomeStatus status) {
        return switch (status) {
            case COMPLETED -> OK;
            case FAILED -> FAILED;
            case HANDOFF_TRIGGERED -> HANDOFF;
            case BLOCKED -> BLOCKED;
        };
    }

    /**
     * Like {@link #of(OutcomeStatus)}, but a failed run whose failed steps all exhausted their
     * gate attempts exits with {@link #INVALID}.
     */
    public static int of(WorkflowOutcome outcome) {
        if (outcome.status() == OutcomeStatus.FAILED && gateExhausted(outcome)) {
            return INVALID;
        }
        return of(outcome.status());
    }

    static boolean gateExhausted(WorkflowOutcome outcome) {
        if (outcome.plan() == null) return false;
        Set<String> gated = stepsWith(outcome, IssueKind.GATE_VALIDATION_FAILED);
        Set<String> missing = stepsWith(outcome, IssueKind.MISSING_ARTIFACT);
        List<String> failed = outcome.plan().steps().stream()
                .filter(s -> s.status() == StepStatus.FAILED)
                .map(Step::stepId)
                .toList();
        boolean cancelled = outcome.plan().steps().stream().anyMatch(s -> s.status() == StepStatus.FAILED
                && s.statusReason() != null && s.statusReason().startsWith(CANCELLED));
        return !failed.isEmpty() && !cancelled
                && failed.stream().allMatch(id -> gated.contains(id) && !missing.contains(id));
    }

    private static Set<String> stepsWith(WorkflowOutcome outcome, IssueKind kind) {
        return outcome.issues().stream()
                .filter(i -> i.kind() == kind && i.stepId() != null)
                .map(OrchestrationIssue::stepId)
                .collect(Collectors.toSet());
    }
}
