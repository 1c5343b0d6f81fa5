package com.keystone.core.fallback;

/**
 * Chosen alternate role for a step, carrying the full context forward.
 */
public record FallbackDecision(String stepId, String fromRole, String toRole, FallbackContext context) {}
