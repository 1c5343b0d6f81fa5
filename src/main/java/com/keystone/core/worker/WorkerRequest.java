package com.keystone.core.worker;

import com.keystone.core.model.GateRecord;

import java.util.List;
import java.util.Map;

/**
 * Everything a worker receives for one attempt at a step.
 *
 * @param workflowId     owning workflow
 * @param stepId         step being executed
 * @param role           role the worker acts as
 * @param taskContext    rendered task context
 * @param requiredInputs consumable artifacts from dependencies and declared inputs
 * @param outputContract name and required fields of the output contract
 * @param priorFailures  gate errors of earlier attempts, oldest first
 * @param gateHistory    earlier gate records of the step, any role
 * @param fallbackFrom   role the step was taken over from, or null
 */
public record WorkerRequest(
    String workflowId,
    String stepId,
    String role,
    String taskContext,
    List<ArtifactInput> requiredInputs,
    Map<String, String> outputContract,
    List<String> priorFailures,
    List<GateRecord> gateHistory,
    String fallbackFrom
) {

    public WorkerRequest {
        requiredInputs = requiredInputs == null ? List.of() : List.copyOf(requiredInputs);
        outputContract = outputContract == null ? Map.of() : Map.copyOf(outputContract);
        priorFailures = priorFailures == null ? List.of() : List.copyOf(priorFailures);
        gateHistory = gateHistory == null ? List.of() : List.copyOf(gateHistory);
    }
}
