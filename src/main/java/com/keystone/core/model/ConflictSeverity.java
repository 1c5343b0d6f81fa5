package com.keystone.core.model;

public enum ConflictSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public ConflictSeverity max(ConflictSeverity other) {
        return compareTo(other) >= 0 ? this : other;
    }
}
