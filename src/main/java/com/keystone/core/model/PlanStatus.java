package com.keystone.core.model;

/**
 * Lifecycle of a persisted plan. Plans are archived on completion, never deleted.
 */
public enum PlanStatus {
    ACTIVE,
    COMPLETED,
    BLOCKED,
    FAILED,
    ARCHIVED
}
