package com.keystone.core.model;

/**
 * Complexity tier of a classified task. Declaration order is significant:
 * later constants are strictly more complex.
 */
public enum Complexity {
    TRIVIAL,
    SIMPLE,
    MODERATE,
    COMPLEX,
    CRITICAL;

    public boolean atLeast(Complexity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Returns the higher of this tier and {@code floor}. Never lowers a tier.
     */
    public Complexity escalateTo(Complexity floor) {
        return atLeast(floor) ? this : floor;
    }
}
