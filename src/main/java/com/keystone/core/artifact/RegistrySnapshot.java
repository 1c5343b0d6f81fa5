package com.keystone.core.artifact;

import com.keystone.core.model.Artifact;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of a workflow's registry records, referenced by handoff packages.
 */
public record RegistrySnapshot(String workflowId, List<Artifact> artifacts, Instant takenAt) {

    public RegistrySnapshot {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }
}
