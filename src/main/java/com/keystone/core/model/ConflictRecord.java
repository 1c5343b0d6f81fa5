package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * A detected conflict between concurrently produced outputs.
 *
 * @param conflictId         deterministic identifier derived from the subject and outputs
 * @param workflowId         owning workflow
 * @param subject            artifact name or requirement key the outputs disagree on
 * @param conflictingOutputs output IDs in {@code subject@stepId} form
 * @param stepIds            steps that produced the conflicting outputs
 * @param roles              roles that produced the conflicting outputs
 * @param severity           classified severity
 * @param domainSpecific     true when every involved role belongs to one domain
 * @param resolutionAgent    authority role, "consensus", or "human-review"
 * @param status             open, resolved or escalated
 * @param resolution         recorded resolution, or null while open
 * @param detectedAt         when the conflict was detected
 */
public record ConflictRecord(
    String conflictId,
    String workflowId,
    String subject,
    List<String> conflictingOutputs,
    List<String> stepIds,
    List<String> roles,
    ConflictSeverity severity,
    boolean domainSpecific,
    String resolutionAgent,
    ConflictStatus status,
    Resolution resolution,
    Instant detectedAt
) implements Serializable {

    public ConflictRecord {
        conflictingOutputs = conflictingOutputs == null ? List.of() : List.copyOf(conflictingOutputs);
        stepIds = stepIds == null ? List.of() : List.copyOf(stepIds);
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public ConflictRecord withResolution(Resolution res, String agent) {
        return new ConflictRecord(conflictId, workflowId, subject, conflictingOutputs, stepIds, roles,
                severity, domainSpecific, agent,
                res.accepted() ? ConflictStatus.RESOLVED : ConflictStatus.ESCALATED,
                res, detectedAt);
    }
}
