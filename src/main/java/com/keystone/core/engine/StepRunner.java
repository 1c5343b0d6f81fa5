package com.keystone.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.core.artifact.ArtifactReference;
import com.keystone.core.artifact.ArtifactRegistry;
import com.keystone.core.artifact.MissingArtifactException;
import com.keystone.core.budget.TokenEstimator;
import com.keystone.core.budget.UsageDelta;
import com.keystone.core.fallback.FallbackContext;
import com.keystone.core.fallback.FallbackDecision;
import com.keystone.core.fallback.FallbackReason;
import com.keystone.core.fallback.FallbackRouter;
import com.keystone.core.gate.GateLedger;
import com.keystone.core.gate.GateValidator;
import com.keystone.core.gate.OutputSchema;
import com.keystone.core.gate.RetryBudgetExhaustedException;
import com.keystone.core.gate.SchemaCatalog;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.Artifact;
import com.keystone.core.model.GateRecord;
import com.keystone.core.model.IssueKind;
import com.keystone.core.model.Plan;
import com.keystone.core.model.Step;
import com.keystone.core.model.StepStatus;
import com.keystone.core.model.Task;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import com.keystone.core.plan.PlanStore;
import com.keystone.core.worker.ArtifactInput;
import com.keystone.core.worker.ContextTemplate;
import com.keystone.core.worker.ProducedArtifact;
import com.keystone.core.worker.Worker;
import com.keystone.core.worker.WorkerRegistry;
import com.keystone.core.worker.WorkerRequest;
import com.keystone.core.worker.WorkerResponse;
import com.keystone.core.worker.WorkerStatus;
import com.keystone.core.worker.WorkerUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs a single step to a settled outcome: resolves its inputs, dispatches it to the assigned
 * role's worker, gates every attempt and falls back to an alternate role once the role's
 * attempts are used up or its worker is unavailable.
 * <p>
 * Passing output is returned, not registered; the wave settles registration after conflict
 * detection across the wave's outputs.
 */
@Component
public class StepRunner {

    private static final Logger log = LoggerFactory.getLogger(StepRunner.class);

    private final PlanStore planStore;
    private final ArtifactRegistry registry;
    private final GateValidator gate;
    private final GateLedger gateLedger;
    private final SchemaCatalog schemas;
    private final WorkerRegistry workers;
    private final FallbackRouter fallbackRouter;
    private final KeystoneMetrics metrics;
    private final WorkspaceLayout layout;
    private final ObjectMapper mapper;

    @Autowired
    public StepRunner(PlanStore planStore, ArtifactRegistry registry, GateValidator gate, GateLedger gateLedger,
                      SchemaCatalog schemas, WorkerRegistry workers, FallbackRouter fallbackRouter,
                      KeystoneMetrics metrics, WorkspaceLayout layout, JsonDocumentStore documents) {
        this.planStore = planStore;
        this.registry = registry;
        this.gate = gate;
        this.gateLedger = gateLedger;
        this.schemas = schemas;
        this.workers = workers;
        this.fallbackRouter = fallbackRouter;
        this.metrics = metrics;
        this.layout = layout;
        this.mapper = documents.mapper();
    }

    public StepExecution run(RunContext ctx, Plan plan, Step step) {
        String workflowId = ctx.workflowId();
        String stepId = step.stepId();
        MdcContext.setStep(workflowId, stepId, step.assignedRole());

        List<Artifact> consumed;
        List<ArtifactInput> inputs;
        try {
            consumed = resolveInputs(workflowId, plan, step);
            inputs = consumed.stream()
                    .map(a -> new ArtifactInput(a.name(), a.version(), a.producingStep(),
                            registry.readContent(workflowId, a).orElse("")))
                    .toList();
        } catch (MissingArtifactException e) {
            ctx.raise(IssueKind.MISSING_ARTIFACT, stepId, e.getMessage(),
                    Map.of("artifact", e.artifactName(), "reason", e.reason().name()));
            planStore.updateStepStatus(workflowId, stepId, StepStatus.FAILED, List.of(), e.getMessage());
            return StepExecution.ended(stepId, step.assignedRole(), StepExecution.Outcome.FAILED, null, e.getMessage());
        }
        List<String> inputNames = consumed.stream().map(Artifact::name).toList();

        planStore.updateStepStatus(workflowId, stepId, StepStatus.IN_PROGRESS, List.of(),
                "dispatched to " + step.assignedRole());
        ctx.publish("step.started", stepId, Map.of("role", step.assignedRole(), "inputs", inputNames));

        OutputSchema schema = schemas.require(step.outputSchema());
        String role = step.assignedRole();
        String fallbackFrom = step.fallbackFrom();
        var tried = new LinkedHashSet<String>();
        var unavailable = new HashSet<String>();
        var failures = new ArrayList<String>();
        GateRecord last = null;
        long startMs = System.currentTimeMillis();

        while (true) {
            if (cancelled(workflowId, stepId)) {
                String reason = "cancelled by operator";
                planStore.updateStepStatus(workflowId, stepId, StepStatus.FAILED, List.of(), reason);
                ctx.publish("step.cancelled", stepId, Map.of("role", role));
                return StepExecution.ended(stepId, role, StepExecution.Outcome.CANCELLED, last, reason);
            }
            tried.add(role);
            MdcContext.setStep(workflowId, stepId, role);

            Optional<Worker> worker = unavailable.contains(role) ? Optional.empty() : workers.find(role);
            FallbackReason giveUp = worker.isEmpty() ? FallbackReason.WORKER_UNAVAILABLE
                    : gate.attemptsRemaining(workflowId, stepId, role) == 0 ? FallbackReason.RETRIES_EXHAUSTED
                    : null;
            if (giveUp != null) {
                var context = new FallbackContext(workflowId, stepId, giveUp, tried, consumed,
                        failures, gateLedger.history(workflowId, stepId));
                Optional<FallbackDecision> decision = fallbackRouter.fallback(role, context);
                if (decision.isEmpty()) {
                    String reason = "no fallback left after " + tried + " (" + giveUp + ")";
                    planStore.updateStepStatus(workflowId, stepId, StepStatus.FAILED, List.of(), reason);
                    ctx.publish("step.failed", stepId, Map.of("role", role, "reason", reason));
                    return StepExecution.ended(stepId, role, StepExecution.Outcome.FAILED, last, reason);
                }
                String next = decision.get().toRole();
                planStore.reassignStep(workflowId, stepId, next, giveUp.name());
                metrics.recordFallback(role, next);
                ctx.publish("step.fallback", stepId,
                        Map.of("from", role, "to", next, "reason", giveUp.name()));
                fallbackFrom = role;
                role = next;
                continue;
            }

            var request = new WorkerRequest(workflowId, stepId, role, taskContext(ctx.task(), workflowId, stepId, role),
                    inputs, Map.of("schema", schema.name(), "required", String.join(",", schema.required().keySet())),
                    failures, gateLedger.history(workflowId, stepId), fallbackFrom);

            WorkerResponse response;
            try {
                response = worker.get().execute(request);
            } catch (WorkerUnavailableException e) {
                log.warn("Worker for {} unavailable: {}", role, e.getMessage());
                unavailable.add(role);
                failures.add(role + ": " + e.getMessage());
                continue;
            }
            ctx.budget().track(UsageDelta.of(TokenEstimator.estimate(request.taskContext())
                    + TokenEstimator.estimate(response.output()) + response.tokensUsed(), stepId));

            if (response.status() == WorkerStatus.NEEDS_CLARIFICATION) {
                String question = response.message() != null ? response.message() : "clarification requested";
                planStore.updateStepStatus(workflowId, stepId, StepStatus.BLOCKED, List.of(), question);
                ctx.publish("step.blocked", stepId, Map.of("role", role, "question", question));
                return StepExecution.ended(stepId, role, StepExecution.Outcome.BLOCKED, last, question);
            }
            boolean workerFailed = response.status() == WorkerStatus.FAILED;

            GateRecord record;
            try {
                record = workerFailed
                        ? gate.rejectFailedAttempt(workflowId, stepId, role, response.output(), response.message())
                        : gate.validate(workflowId, stepId, role, response.output(), schema, gate.defaultRubric());
            } catch (RetryBudgetExhaustedException e) {
                log.debug("{}", e.getMessage());
                continue;
            }
            last = record;
            metrics.recordGateResult(record.verdict().name());
            metrics.recordGateScore(record.qualityScore());

            if (record.passed()) {
                metrics.recordStepExecution(role, System.currentTimeMillis() - startMs);
                ctx.publish("step.passed", stepId, Map.of("role", role, "attempt", record.attempt(),
                        "score", record.qualityScore(), "verdict", record.verdict().name()));
                return passed(stepId, role, record, response, inputNames);
            }

            failures.addAll(record.errors());
            ctx.raise(IssueKind.GATE_VALIDATION_FAILED, stepId,
                    "attempt " + record.attempt() + " by " + role + " failed the gate",
                    Map.of("attempt", String.valueOf(record.attempt()),
                            "role", role,
                            "schemaCheck", record.schemaCheck().name(),
                            "score", String.valueOf(record.qualityScore()),
                            "errors", String.join("; ", record.errors()),
                            "outputRef", record.outputRef()));
        }
    }

    /**
     * Consumable inputs: the registered outputs of every dependency, then declared inputs.
     * Optional declared inputs that are not consumable are skipped.
     */
    List<Artifact> resolveInputs(String workflowId, Plan plan, Step step) {
        var byName = new LinkedHashMap<String, Artifact>();
        for (String dep : step.dependencies()) {
            Step dependency = plan.step(dep).orElseThrow(() ->
                    new MissingArtifactException(dep, MissingArtifactException.Reason.NOT_PRODUCED,
                            "dependency step is not in the plan"));
            for (String artifactId : dependency.producedArtifacts()) {
                String name = nameOf(artifactId);
                byName.putIfAbsent(name, registry.requireConsumable(workflowId, name));
            }
        }
        for (String raw : step.requiredInputs()) {
            var reference = ArtifactReference.parse(raw);
            try {
                byName.put(reference.name(), registry.requireConsumable(workflowId, reference));
            } catch (MissingArtifactException e) {
                if (!reference.optional()) throw e;
                log.info("Optional input {} skipped for {}: {}", reference.name(), step.stepId(), e.reason());
            }
        }
        return new ArrayList<>(byName.values());
    }

    private StepExecution passed(String stepId, String role, GateRecord record, WorkerResponse response,
                                 List<String> inputNames) {
        var artifacts = new LinkedHashMap<String, String>();
        artifacts.put(StepExecution.outputArtifactName(stepId), response.output());
        for (ProducedArtifact produced : response.artifacts()) {
            artifacts.put(produced.name(), produced.content());
        }
        var claims = new LinkedHashMap<String, String>(response.requirementClaims());
        claims.putAll(requirementsOf(response.output()));
        return new StepExecution(stepId, role, StepExecution.Outcome.PASSED, record, response,
                artifacts, claims, inputNames, null);
    }

    /** Textual values of the output's {@code requirements} object. */
    private Map<String, String> requirementsOf(String output) {
        var claims = new LinkedHashMap<String, String>();
        try {
            JsonNode requirements = mapper.readTree(output).path("requirements");
            if (requirements.isObject()) {
                requirements.fields().forEachRemaining(e -> {
                    if (e.getValue().isValueNode()) claims.put(e.getKey(), e.getValue().asText());
                });
            }
        } catch (JsonProcessingException e) {
            log.debug("Output of passed step not re-parsable: {}", e.getOriginalMessage());
        }
        return claims;
    }

    private boolean cancelled(String workflowId, String stepId) {
        return Files.exists(layout.cancelMarker(workflowId, stepId));
    }

    static String taskContext(Task task, String workflowId, String stepId, String role) {
        return ContextTemplate.render(ContextTemplate.DEFAULT, Map.of(
                "workflow_id", workflowId,
                "step_id", stepId,
                "role", role,
                "task_type", task.type().name(),
                "complexity", task.complexity().name(),
                "task", task.description(),
                "files", task.fileContext().isEmpty() ? "(none)" : String.join(", ", task.fileContext())));
    }

    static String nameOf(String artifactId) {
        int at = artifactId.lastIndexOf("@v");
        return at < 0 ? artifactId : artifactId.substring(0, at);
    }
}
