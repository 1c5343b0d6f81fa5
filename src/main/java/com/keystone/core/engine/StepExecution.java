package com.keystone.core.engine;

import com.keystone.core.model.GateRecord;
import com.keystone.core.worker.WorkerResponse;

import java.util.List;
import java.util.Map;

/**
 * Result of running one step within a wave.
 *
 * @param stepId         the step
 * @param role           role that produced the final attempt
 * @param outcome        how the step ended
 * @param gate           gate record of the final attempt, or null when no attempt ran
 * @param response       worker response of the final attempt, or null
 * @param artifacts      artifact name to content, including the step output, when passed
 * @param claims         requirement claims of the output, when passed
 * @param inputArtifacts names of the artifacts the step consumed
 * @param message        reason for a non-passing outcome
 */
public record StepExecution(
    String stepId,
    String role,
    Outcome outcome,
    GateRecord gate,
    WorkerResponse response,
    Map<String, String> artifacts,
    Map<String, String> claims,
    List<String> inputArtifacts,
    String message
) {

    public enum Outcome {
        PASSED,
        FAILED,
        BLOCKED,
        CANCELLED
    }

    public StepExecution {
        artifacts = artifacts == null ? Map.of() : Map.copyOf(artifacts);
        claims = claims == null ? Map.of() : Map.copyOf(claims);
        inputArtifacts = inputArtifacts == null ? List.of() : List.copyOf(inputArtifacts);
    }

    static StepExecution ended(String stepId, String role, Outcome outcome, GateRecord gate, String message) {
        return new StepExecution(stepId, role, outcome, gate, null, null, null, null, message);
    }

    /** Artifact name under which a step's validated output is registered. */
    public static String outputArtifactName(String stepId) {
        return stepId + "-output.json";
    }
}
