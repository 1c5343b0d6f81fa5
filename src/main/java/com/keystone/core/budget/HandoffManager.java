package com.keystone.core.budget;

import com.keystone.core.artifact.ArtifactRegistry;
import com.keystone.core.model.Discrepancy;
import com.keystone.core.model.HandoffPackage;
import com.keystone.core.model.ResourceUsage;
import com.keystone.core.model.Step;
import com.keystone.core.model.StepStatus;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import com.keystone.core.plan.PlanNotFoundException;
import com.keystone.core.plan.PlanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Transfers workflow state between orchestration instances.
 * <p>
 * A package holds references only (plan index, registry snapshot, reasoning trail) so its size
 * does not depend on how far the workflow has progressed.
 */
@Service
public class HandoffManager {

    private static final Logger log = LoggerFactory.getLogger(HandoffManager.class);

    /**
     * What a fresh instance needs to continue.
     *
     * @param workflowId       workflow being resumed
     * @param generation       generation of the resuming instance
     * @param carriedTokens    tokens consumed by all earlier generations
     * @param discrepancies    integrity findings against the package's snapshot and the store
     * @param resetSteps       in-flight steps of the previous instance returned to PENDING
     */
    public record ResumeState(String workflowId, int generation, long carriedTokens,
                              List<Discrepancy> discrepancies, List<String> resetSteps) {}

    private final PlanStore planStore;
    private final ArtifactRegistry registry;
    private final JsonDocumentStore documents;
    private final WorkspaceLayout layout;

    public HandoffManager(PlanStore planStore, ArtifactRegistry registry, JsonDocumentStore documents,
                          WorkspaceLayout layout) {
        this.planStore = planStore;
        this.registry = registry;
        this.documents = documents;
        this.layout = layout;
    }

    /**
     * Writes a handoff package for the instance of the given generation.
     *
     * @param currentStep next eligible step, or null when none is eligible
     */
    public HandoffPackage prepare(String workflowId, int generation, String currentStep, ResourceUsage usage) {
        if (!planStore.exists(workflowId)) {
            throw new PlanNotFoundException(workflowId);
        }
        String snapshotRef = registry.snapshot(workflowId);
        var pkg = new HandoffPackage(
                "HO-" + UUID.randomUUID().toString().substring(0, 8),
                workflowId,
                generation,
                currentStep,
                layout.relativize(layout.planIndex(workflowId)),
                snapshotRef,
                layout.relativize(layout.trailFile(workflowId)),
                usage,
                Instant.now());
        if (!documents.writeNew(layout.handoffFile(workflowId, generation), pkg)) {
            throw new IllegalStateException("Generation " + generation + " of " + workflowId + " already handed off");
        }
        log.info("Handoff package {} written for {} (generation {}, next step {}, {} tokens)",
                pkg.packageId(), workflowId, generation, currentStep, usage.instanceTokens());
        return pkg;
    }

    /** Newest package of a workflow, by generation. */
    public Optional<HandoffPackage> latest(String workflowId) {
        return documents.list(layout.handoffDir(workflowId), ".json").stream()
                .map(p -> documents.read(p, HandoffPackage.class).orElseThrow())
                .max(Comparator.comparingInt(HandoffPackage::generation));
    }

    /**
     * Verifies plan and registry against the package and returns in-flight steps to PENDING.
     * Discrepancies are repaired by the registry and reported, never fatal.
     */
    public ResumeState resume(HandoffPackage pkg) {
        String workflowId = pkg.workflowId();
        if (!Files.isRegularFile(layout.resolve(pkg.planRef()))) {
            throw new PlanNotFoundException(workflowId);
        }
        var discrepancies = new ArrayList<Discrepancy>();
        registry.readSnapshot(pkg.artifactRegistrySnapshot()).ifPresentOrElse(
                snapshot -> discrepancies.addAll(registry.compareWithSnapshot(workflowId, snapshot)),
                () -> log.warn("Registry snapshot {} missing; verifying the store only", pkg.artifactRegistrySnapshot()));
        discrepancies.addAll(registry.verifyIntegrity(workflowId));

        List<String> reset = resetInFlight(workflowId);
        int generation = pkg.generation() + 1;
        long carried = pkg.resourceUsage() != null ? pkg.resourceUsage().cumulativeTokens() : 0;
        log.info("Resuming {} as generation {} ({} discrepancies, reset {})",
                workflowId, generation, discrepancies.size(), reset);
        return new ResumeState(workflowId, generation, carried, discrepancies, reset);
    }

    /**
     * Returns steps left IN_PROGRESS by a stopped instance to PENDING.
     */
    public List<String> resetInFlight(String workflowId) {
        var reset = new ArrayList<String>();
        for (Step step : planStore.loadPlan(workflowId).steps()) {
            if (step.status() == StepStatus.IN_PROGRESS) {
                planStore.updateStepStatus(workflowId, step.stepId(), StepStatus.PENDING, null,
                        "reset on resume: previous instance stopped mid-step");
                reset.add(step.stepId());
            }
        }
        return reset;
    }
}
