package com.keystone.core.model;

import java.io.Serializable;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * One unit of work in a plan phase.
 *
 * @param stepId            unique identifier within the workflow (e.g. "STEP-003")
 * @param assignedRole      worker role currently responsible for the step
 * @param dependencies      step IDs that must be COMPLETED before this step starts
 * @param status            current status
 * @param producedArtifacts artifact IDs ({@code name@vN}) registered for this step
 * @param outputSchema      name of the output contract the step's output is validated against
 * @param requiredInputs    explicit artifact references beyond the dependencies' outputs
 * @param fallbackFrom      role the step was reassigned from, or null
 * @param statusReason      reason recorded with the last status change, or null
 */
public record Step(
    String stepId,
    String assignedRole,
    SortedSet<String> dependencies,
    StepStatus status,
    SortedSet<String> producedArtifacts,
    String outputSchema,
    List<String> requiredInputs,
    String fallbackFrom,
    String statusReason
) implements Serializable {

    public Step {
        dependencies = sorted(dependencies);
        producedArtifacts = sorted(producedArtifacts);
        requiredInputs = requiredInputs == null ? List.of() : List.copyOf(requiredInputs);
        status = status == null ? StepStatus.PENDING : status;
    }

    public static Step pending(String stepId, String role, Collection<String> dependencies, String outputSchema) {
        return new Step(stepId, role, sorted(dependencies), StepStatus.PENDING, null,
                outputSchema, List.of(), null, null);
    }

    public Step withStatus(StepStatus next, Collection<String> artifacts, String reason) {
        var merged = new TreeSet<>(producedArtifacts);
        if (artifacts != null) {
            merged.addAll(artifacts);
        }
        return new Step(stepId, assignedRole, dependencies, next, merged,
                outputSchema, requiredInputs, fallbackFrom, reason);
    }

    public Step withRole(String role, String previousRole) {
        return new Step(stepId, role, dependencies, status, producedArtifacts,
                outputSchema, requiredInputs, previousRole, statusReason);
    }

    private static SortedSet<String> sorted(Collection<String> values) {
        return values == null
                ? Collections.unmodifiableSortedSet(new TreeSet<>())
                : Collections.unmodifiableSortedSet(new TreeSet<>(values));
    }
}
