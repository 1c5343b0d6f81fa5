package com.keystone.core.budget;

/**
 * Tokens consumed by one operation.
 *
 * @param tokens tokens consumed; never negative
 * @param source what consumed them (e.g. "STEP-002/developer")
 */
public record UsageDelta(long tokens, String source) {

    public UsageDelta {
        if (tokens < 0) {
            throw new IllegalArgumentException("Usage delta must not be negative: " + tokens);
        }
    }

    public static UsageDelta of(long tokens, String source) {
        return new UsageDelta(tokens, source);
    }
}
