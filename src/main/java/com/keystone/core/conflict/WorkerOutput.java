package com.keystone.core.conflict;

import java.util.Map;

/**
 * A gate-passed output of one step in a wave, as compared for conflicts.
 *
 * @param stepId            producing step
 * @param role              producing role
 * @param artifacts         artifact name to content
 * @param requirementClaims requirement key to asserted value
 */
public record WorkerOutput(String stepId, String role, Map<String, String> artifacts,
                           Map<String, String> requirementClaims) {

    public WorkerOutput {
        artifacts = artifacts == null ? Map.of() : Map.copyOf(artifacts);
        requirementClaims = requirementClaims == null ? Map.of() : Map.copyOf(requirementClaims);
    }

    /** Output ID of this step's version of {@code subject}. */
    public String outputId(String subject) {
        return subject + "@" + stepId;
    }
}
