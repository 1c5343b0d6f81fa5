package com.keystone.core.fallback;

public enum FallbackReason {
    RETRIES_EXHAUSTED,
    WORKER_UNAVAILABLE
}
