package com.keystone.core.model;

import java.util.Collection;

/**
 * Aggregate status of a plan phase, derived from its steps.
 */
public enum PhaseStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    BLOCKED,
    FAILED;

    public static PhaseStatus of(Collection<Step> steps) {
        if (steps.isEmpty()) return COMPLETED;
        if (steps.stream().allMatch(s -> s.status() == StepStatus.COMPLETED)) return COMPLETED;
        if (steps.stream().anyMatch(s -> s.status() == StepStatus.FAILED)) return FAILED;
        if (steps.stream().anyMatch(s -> s.status() == StepStatus.BLOCKED)) return BLOCKED;
        if (steps.stream().allMatch(s -> s.status() == StepStatus.PENDING)) return PENDING;
        return IN_PROGRESS;
    }
}
