package com.keystone.core.fallback;

import com.keystone.core.model.Artifact;
import com.keystone.core.model.GateRecord;

import java.util.List;
import java.util.Set;

/**
 * Everything the alternate role needs to take a step over.
 *
 * @param workflowId     owning workflow
 * @param stepId         the step being handed over
 * @param reason         why the previous role gave up
 * @param triedRoles     roles that already attempted the step, including the failed one
 * @param priorArtifacts artifacts the step consumed or produced so far
 * @param failureReasons gate errors and worker messages of earlier attempts
 * @param gateHistory    every gate record of the step
 */
public record FallbackContext(
    String workflowId,
    String stepId,
    FallbackReason reason,
    Set<String> triedRoles,
    List<Artifact> priorArtifacts,
    List<String> failureReasons,
    List<GateRecord> gateHistory
) {

    public FallbackContext {
        triedRoles = triedRoles == null ? Set.of() : Set.copyOf(triedRoles);
        priorArtifacts = priorArtifacts == null ? List.of() : List.copyOf(priorArtifacts);
        failureReasons = failureReasons == null ? List.of() : List.copyOf(failureReasons);
        gateHistory = gateHistory == null ? List.of() : List.copyOf(gateHistory);
    }
}
