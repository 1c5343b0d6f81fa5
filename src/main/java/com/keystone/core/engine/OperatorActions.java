package com.keystone.core.engine;

import com.keystone.core.artifact.ArtifactRegistry;
import com.keystone.core.artifact.ArtifactSubmission;
import com.keystone.core.conflict.ConflictResolver;
import com.keystone.core.events.EventBus;
import com.keystone.core.events.KeystoneEvent;
import com.keystone.core.gate.GateLedger;
import com.keystone.core.gate.GateValidator;
import com.keystone.core.gate.SchemaCatalog;
import com.keystone.core.model.Artifact;
import com.keystone.core.model.ConflictRecord;
import com.keystone.core.model.ConflictStatus;
import com.keystone.core.model.GateRecord;
import com.keystone.core.model.Plan;
import com.keystone.core.model.Step;
import com.keystone.core.model.StepStatus;
import com.keystone.core.model.ValidationStatus;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import com.keystone.core.plan.PlanStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Operator surface: interventions that are not part of an orchestration run.
 */
@Service
public class OperatorActions {

    private static final Logger log = LoggerFactory.getLogger(OperatorActions.class);

    private final PlanStore planStore;
    private final GateValidator gate;
    private final GateLedger gateLedger;
    private final SchemaCatalog schemas;
    private final ArtifactRegistry registry;
    private final ConflictResolver conflicts;
    private final JsonDocumentStore documents;
    private final WorkspaceLayout layout;
    private final EventBus eventBus;

    public OperatorActions(PlanStore planStore, GateValidator gate, GateLedger gateLedger, SchemaCatalog schemas,
                           ArtifactRegistry registry, ConflictResolver conflicts, JsonDocumentStore documents,
                           WorkspaceLayout layout, EventBus eventBus) {
        this.planStore = planStore;
        this.gate = gate;
        this.gateLedger = gateLedger;
        this.schemas = schemas;
        this.registry = registry;
        this.conflicts = conflicts;
        this.documents = documents;
        this.layout = layout;
        this.eventBus = eventBus;
    }

    /**
     * Cancels a step. Pending and blocked steps fail immediately; a running step is marked and
     * fails before its next attempt.
     *
     * @return the step's status after the call
     * @throws IllegalStateException if the step already finished
     */
    public StepStatus cancelStep(String workflowId, String stepId, String reason) {
        Step step = requireStep(planStore.loadPlan(workflowId), stepId);
        String why = "cancelled by operator" + (reason != null && !reason.isBlank() ? ": " + reason : "");
        switch (step.status()) {
            case PENDING, BLOCKED -> {
                planStore.updateStepStatus(workflowId, stepId, StepStatus.FAILED, List.of(), why);
                publish("step.cancelled", workflowId, stepId, Map.of("reason", why));
                return StepStatus.FAILED;
            }
            case IN_PROGRESS -> {
                documents.writeNew(layout.cancelMarker(workflowId, stepId),
                        Map.of("stepId", stepId, "reason", why, "requestedAt", Instant.now().toString()));
                log.info("Cancellation of running step {} requested", stepId);
                publish("step.cancel_requested", workflowId, stepId, Map.of("reason", why));
                return StepStatus.IN_PROGRESS;
            }
            default -> throw new IllegalStateException("Step " + stepId + " is already " + step.status());
        }
    }

    /**
     * Re-runs the gate against a failed or blocked step's latest stored output. A passing
     * result registers the output and completes the step.
     *
     * @throws IllegalStateException if the step is not FAILED or BLOCKED, or an escalated
     *         conflict still holds it
     */
    public GateRecord rerunGate(String workflowId, String stepId) {
        Plan plan = planStore.loadPlan(workflowId);
        Step step = requireStep(plan, stepId);
        if (step.status() != StepStatus.FAILED && step.status() != StepStatus.BLOCKED) {
            throw new IllegalStateException("Gate can only be re-run on FAILED or BLOCKED steps; "
                    + stepId + " is " + step.status());
        }
        for (ConflictRecord open : conflicts.escalated(workflowId)) {
            if (open.status() == ConflictStatus.ESCALATED && open.stepIds().contains(stepId)) {
                throw new IllegalStateException("Step " + stepId + " is held by escalated conflict "
                        + open.conflictId() + "; settle it with 'keystone resolve " + workflowId + " "
                        + open.conflictId() + " <subject@stepId>'");
            }
        }
        GateRecord record = gate.revalidate(workflowId, stepId, schemas.require(step.outputSchema()),
                gate.defaultRubric());
        if (!record.passed()) {
            log.warn("Re-run gate for {} still fails: {}", stepId, record.errors());
            return record;
        }
        String output = gateLedger.readOutput(workflowId, record.outputRef()).orElseThrow();
        Artifact artifact = registry.register(new ArtifactSubmission(workflowId,
                StepExecution.outputArtifactName(stepId), stepId, output, ValidationStatus.PASS,
                dependencyInputs(plan, step)));
        planStore.updateStepStatus(workflowId, stepId, StepStatus.COMPLETED, List.of(artifact.artifactId()),
                "gate re-run by operator passed (attempt " + record.attempt() + ")");
        publish("step.completed", workflowId, stepId, Map.of("attempt", record.attempt(), "operator", true));
        return record;
    }

    /**
     * Closes an escalated conflict with the operator's choice, registers the accepted content
     * and completes involved steps that no other escalated conflict still holds.
     */
    public ConflictRecord resolveConflict(String workflowId, String conflictId, String acceptedOutputId,
                                          String rationale) {
        ConflictRecord resolved = conflicts.resolveManually(workflowId, conflictId, acceptedOutputId, rationale);
        String acceptedStep = resolved.resolution().acceptedStepId();
        var acceptedIds = new ArrayList<String>();
        if (!resolved.subject().startsWith(ConflictResolver.REQUIREMENT_PREFIX)) {
            String content = conflicts.candidates(resolved).get(acceptedOutputId);
            if (content == null) {
                throw new IllegalStateException("No stored candidate " + acceptedOutputId + " for " + conflictId);
            }
            Artifact artifact = registry.register(new ArtifactSubmission(workflowId, resolved.subject(),
                    acceptedStep, content, ValidationStatus.PASS, List.of()));
            acceptedIds.add(artifact.artifactId());
        }

        var stillHeld = new LinkedHashSet<String>();
        for (ConflictRecord open : conflicts.escalated(workflowId)) {
            if (open.status() == ConflictStatus.ESCALATED) stillHeld.addAll(open.stepIds());
        }
        Plan plan = planStore.loadPlan(workflowId);
        for (String stepId : new LinkedHashSet<>(resolved.stepIds())) {
            Step step = requireStep(plan, stepId);
            if (stepId.equals(acceptedStep) && !acceptedIds.isEmpty()) {
                planStore.updateStepStatus(workflowId, stepId, step.status(), acceptedIds,
                        "accepted in conflict " + conflictId);
            }
            if (step.status() == StepStatus.BLOCKED && !stillHeld.contains(stepId)) {
                planStore.updateStepStatus(workflowId, stepId, StepStatus.COMPLETED, List.of(),
                        "conflict " + conflictId + " resolved by operator");
            }
        }
        publish("conflict.resolved", workflowId, acceptedStep, Map.of("conflictId", conflictId,
                "accepted", acceptedOutputId, "resolvedBy", ConflictResolver.OPERATOR));
        return resolved;
    }

    private List<String> dependencyInputs(Plan plan, Step step) {
        var names = new LinkedHashSet<String>();
        for (String dep : step.dependencies()) {
            plan.step(dep).ifPresent(d -> d.producedArtifacts().forEach(id -> names.add(StepRunner.nameOf(id))));
        }
        return List.copyOf(names);
    }

    private static Step requireStep(Plan plan, String stepId) {
        return plan.step(stepId).orElseThrow(() ->
                new IllegalArgumentException("Unknown step " + stepId + " in " + plan.workflowId()));
    }

    private void publish(String type, String workflowId, String stepId, Map<String, Object> payload) {
        eventBus.publish(KeystoneEvent.of(type, workflowId, stepId, payload));
    }
}
