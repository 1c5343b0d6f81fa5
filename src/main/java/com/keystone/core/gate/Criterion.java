package com.keystone.core.gate;

import java.util.Locale;

/**
 * Quality rubric criteria with their default weights (summing to 100).
 */
public enum Criterion {
    COMPLETENESS(25),
    ACCURACY(25),
    CLARITY(15),
    CONSISTENCY(15),
    ACTIONABILITY(20);

    private final double defaultWeight;

    Criterion(double defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public double defaultWeight() {
        return defaultWeight;
    }

    /** Lower-case key used in configuration and in an output's {@code quality} object. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
