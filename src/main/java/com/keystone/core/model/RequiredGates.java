package com.keystone.core.model;

import java.io.Serializable;

/**
 * Gates a task must pass before its chain is considered complete.
 *
 * @param planner        a planning step runs before implementation
 * @param impactAnalysis an impact-analysis step runs after planning
 * @param review         review roles must sign off on the work
 */
public record RequiredGates(
    boolean planner,
    boolean impactAnalysis,
    boolean review
) implements Serializable {

    public static final RequiredGates NONE = new RequiredGates(false, false, false);

    /**
     * Gate policy by complexity: trivial work is ungated, simple work is reviewed,
     * moderate work is also planned, complex and critical work also gets impact analysis.
     */
    public static RequiredGates forComplexity(Complexity complexity) {
        return switch (complexity) {
            case TRIVIAL -> NONE;
            case SIMPLE -> new RequiredGates(false, false, true);
            case MODERATE -> new RequiredGates(true, false, true);
            case COMPLEX, CRITICAL -> new RequiredGates(true, true, true);
        };
    }

    public boolean none() {
        return !planner && !impactAnalysis && !review;
    }
}
