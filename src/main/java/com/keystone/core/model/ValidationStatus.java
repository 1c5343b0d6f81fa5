package com.keystone.core.model;

/**
 * Validation state of a registered artifact.
 */
public enum ValidationStatus {
    PENDING,
    PASS,
    FAIL
}
