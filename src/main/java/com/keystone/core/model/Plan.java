package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Fully loaded plan: the master index joined with every phase detail document.
 */
public record Plan(
    String workflowId,
    Task task,
    PlanStatus status,
    List<Phase> phases,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public Plan {
        phases = phases == null ? List.of() : List.copyOf(phases);
    }

    public List<Step> steps() {
        return phases.stream().flatMap(p -> p.steps().stream()).toList();
    }

    public Optional<Step> step(String stepId) {
        return steps().stream().filter(s -> s.stepId().equals(stepId)).findFirst();
    }

    public boolean allCompleted() {
        return steps().stream().allMatch(s -> s.status() == StepStatus.COMPLETED);
    }
}
