package com.keystone.core.model;

public enum ConflictStatus {
    OPEN,
    RESOLVED,
    ESCALATED  // waiting in the operator review queue
}
