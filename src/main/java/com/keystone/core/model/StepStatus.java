package com.keystone.core.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a single plan step, with the transitions the plan store accepts.
 */
public enum StepStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    BLOCKED,   // awaiting operator resolution
    FAILED;

    public boolean canTransitionTo(StepStatus next) {
        return allowedNext().contains(next);
    }

    public Set<StepStatus> allowedNext() {
        return switch (this) {
            case PENDING -> EnumSet.of(IN_PROGRESS, BLOCKED, FAILED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, FAILED, BLOCKED, PENDING);
            case BLOCKED -> EnumSet.of(PENDING, COMPLETED, FAILED);
            case FAILED -> EnumSet.of(PENDING, COMPLETED);
            case COMPLETED -> EnumSet.noneOf(StepStatus.class);
        };
    }

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }
}
