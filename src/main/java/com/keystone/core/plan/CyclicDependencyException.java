package com.keystone.core.plan;

import java.util.List;

/**
 * The step dependency graph contains a cycle. Fatal at plan creation.
 */
public class CyclicDependencyException extends InvalidPlanException {

    private final List<String> cycle;

    public CyclicDependencyException(List<String> cycle) {
        super("Cyclic step dependencies: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /** Step IDs along the cycle; the first ID is repeated at the end. */
    public List<String> cycle() {
        return cycle;
    }
}
