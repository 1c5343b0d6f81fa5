package com.keystone.core.worker;

import java.util.List;
import java.util.Map;

/**
 * What a worker returns for one attempt.
 *
 * @param status            outcome reported by the worker
 * @param output            the step output; validated by the gate
 * @param artifacts         additional artifacts produced
 * @param requirementClaims requirement key to asserted value, compared across concurrent steps
 * @param tokensUsed        tokens the worker reports having consumed; 0 when unknown
 * @param message           free-form message, e.g. the clarification question
 */
public record WorkerResponse(
    WorkerStatus status,
    String output,
    List<ProducedArtifact> artifacts,
    Map<String, String> requirementClaims,
    long tokensUsed,
    String message
) {

    public WorkerResponse {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
        requirementClaims = requirementClaims == null ? Map.of() : Map.copyOf(requirementClaims);
    }

    public static WorkerResponse completed(String output) {
        return new WorkerResponse(WorkerStatus.COMPLETED, output, List.of(), Map.of(), 0, null);
    }

    public static WorkerResponse failed(String message) {
        return new WorkerResponse(WorkerStatus.FAILED, null, List.of(), Map.of(), 0, message);
    }
}
