package com.keystone.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Ordered group of steps; the unit stored as one plan detail document.
 */
public record Phase(
    String phaseId,
    String name,
    int ordinal,
    List<Step> steps
) implements Serializable {

    public Phase {
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public PhaseStatus status() {
        return PhaseStatus.of(steps);
    }

    public Optional<Step> step(String stepId) {
        return steps.stream().filter(s -> s.stepId().equals(stepId)).findFirst();
    }
}
