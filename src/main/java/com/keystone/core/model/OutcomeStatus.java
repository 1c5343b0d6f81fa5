package com.keystone.core.model;

/**
 * Terminal result of one orchestration instance run.
 */
public enum OutcomeStatus {
    COMPLETED,
    FAILED,
    BLOCKED,
    HANDOFF_TRIGGERED
}
