package com.keystone.core.plan;

import com.keystone.core.model.ExecutionChain;
import com.keystone.core.model.PhaseStatus;
import com.keystone.core.model.PlanStatus;
import com.keystone.core.model.Task;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Master index of a plan: phase list and status only. Step detail, including which phase holds
 * a step, lives in the phase documents, so the index grows with the phase count alone.
 *
 * @param workflowId workflow identifier
 * @param task       the classified task the plan serves
 * @param chain      routed chain, or null for ad-hoc blueprints
 * @param status     plan lifecycle status
 * @param phases     phase entries in execution order
 * @param createdAt  creation time
 * @param updatedAt  time of the last mutation
 */
public record PlanIndex(
    String workflowId,
    Task task,
    ExecutionChain chain,
    PlanStatus status,
    List<PhaseEntry> phases,
    Instant createdAt,
    Instant updatedAt
) {

    public PlanIndex {
        phases = phases == null ? List.of() : List.copyOf(phases);
    }

    /**
     * @param phaseId   phase identifier
     * @param name      phase name
     * @param ordinal   1-based position, also the phase document number
     * @param file      phase document file name
     * @param status    derived phase status at the last mutation
     * @param stepCount number of steps stored in the phase document
     */
    public record PhaseEntry(String phaseId, String name, int ordinal, String file,
                             PhaseStatus status, int stepCount) {

        PhaseEntry withStatus(PhaseStatus next) {
            return new PhaseEntry(phaseId, name, ordinal, file, next, stepCount);
        }
    }

    public Optional<PhaseEntry> phase(String phaseId) {
        return phases.stream().filter(p -> p.phaseId().equals(phaseId)).findFirst();
    }

    PlanIndex with(PlanStatus nextStatus, List<PhaseEntry> nextPhases) {
        return new PlanIndex(workflowId, task, chain, nextStatus, nextPhases, createdAt, Instant.now());
    }
}
