package com.keystone.core.model;

/**
 * Error taxonomy of the orchestration core. Only cyclic plans and unresolved conflicts
 * block the end user; everything else is retried or escalated autonomously.
 */
public enum IssueKind {
    CLASSIFICATION_AMBIGUOUS(false),
    CYCLIC_DEPENDENCY(true),
    GATE_VALIDATION_FAILED(false),
    MISSING_ARTIFACT(false),
    REGISTRY_INTEGRITY_MISMATCH(false),
    CONFLICT_UNRESOLVED(true),
    BUDGET_EXCEEDED(false);

    private final boolean blocking;

    IssueKind(boolean blocking) {
        this.blocking = blocking;
    }

    public boolean blocking() {
        return blocking;
    }
}
