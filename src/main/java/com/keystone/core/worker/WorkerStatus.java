package com.keystone.core.worker;

public enum WorkerStatus {
    COMPLETED,
    FAILED,
    NEEDS_CLARIFICATION
}
