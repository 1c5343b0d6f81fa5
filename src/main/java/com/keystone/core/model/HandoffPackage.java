package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Minimal state needed to continue a workflow in a fresh orchestration instance.
 * References durable documents rather than embedding them, so its size does not grow
 * with the workflow.
 *
 * @param packageId                unique package identifier
 * @param workflowId               workflow being handed off
 * @param generation               generation of the instance that wrote the package
 * @param currentStep              next eligible step at handoff time, or null when none
 * @param planRef                  path of the plan master index, relative to the workspace
 * @param artifactRegistrySnapshot path of the registry snapshot, relative to the workspace
 * @param reasoningTrailRef        path of the reasoning trail, relative to the workspace
 * @param resourceUsage            usage at handoff time
 * @param createdAt                when the package was written
 */
public record HandoffPackage(
    String packageId,
    String workflowId,
    int generation,
    String currentStep,
    String planRef,
    String artifactRegistrySnapshot,
    String reasoningTrailRef,
    ResourceUsage resourceUsage,
    Instant createdAt
) implements Serializable {}
