package com.keystone.core.model;

/**
 * Overall outcome of one validation attempt.
 */
public enum GateVerdict {
    PASS,
    PASS_WITH_WARNINGS,  // logged, not blocking
    FAIL;

    public boolean passed() {
        return this != FAIL;
    }
}
