package com.keystone.core.engine;

import com.keystone.config.KeystoneProperties;
import com.keystone.core.artifact.ArtifactRegistry;
import com.keystone.core.artifact.ArtifactSubmission;
import com.keystone.core.budget.ContextBudgetMonitor;
import com.keystone.core.budget.HandoffManager;
import com.keystone.core.classifier.TaskClassifier;
import com.keystone.core.conflict.ConflictResolver;
import com.keystone.core.conflict.WorkerOutput;
import com.keystone.core.events.EventBus;
import com.keystone.core.logging.MdcContext;
import com.keystone.core.metrics.KeystoneMetrics;
import com.keystone.core.model.Artifact;
import com.keystone.core.model.ConflictRecord;
import com.keystone.core.model.Discrepancy;
import com.keystone.core.model.ExecutionChain;
import com.keystone.core.model.HandoffPackage;
import com.keystone.core.model.IssueKind;
import com.keystone.core.model.OutcomeStatus;
import com.keystone.core.model.Plan;
import com.keystone.core.model.PlanStatus;
import com.keystone.core.model.Resolution;
import com.keystone.core.model.Step;
import com.keystone.core.model.StepStatus;
import com.keystone.core.model.Task;
import com.keystone.core.model.ValidationStatus;
import com.keystone.core.model.WorkflowOutcome;
import com.keystone.core.plan.PlanBlueprint;
import com.keystone.core.plan.PlanStore;
import com.keystone.core.routing.AgentRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Drives a workflow from request to a terminal outcome.
 * <p>
 * A run classifies the request, routes it into an execution chain, persists the plan and then
 * loops: compute the next wave, dispatch it, settle its outputs (conflict detection, artifact
 * registration, step status). Before every wave the context budget is checked; once the handoff
 * threshold is crossed the instance writes a handoff package and stops, and a fresh instance
 * continues through {@link #resume(String)}.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final TaskClassifier classifier;
    private final AgentRouter router;
    private final PlanStore planStore;
    private final StepScheduler scheduler;
    private final WaveExecutor waves;
    private final ArtifactRegistry registry;
    private final ConflictResolver conflicts;
    private final HandoffManager handoff;
    private final EventBus eventBus;
    private final KeystoneMetrics metrics;
    private final KeystoneProperties properties;

    public WorkflowEngine(TaskClassifier classifier, AgentRouter router, PlanStore planStore,
                          StepScheduler scheduler, WaveExecutor waves, ArtifactRegistry registry,
                          ConflictResolver conflicts, HandoffManager handoff, EventBus eventBus,
                          KeystoneMetrics metrics, KeystoneProperties properties) {
        this.classifier = classifier;
        this.router = router;
        this.planStore = planStore;
        this.scheduler = scheduler;
        this.waves = waves;
        this.registry = registry;
        this.conflicts = conflicts;
        this.handoff = handoff;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.properties = properties;
    }

    /**
     * Classifies and routes a request, persists its plan and runs it as generation 1.
     */
    public WorkflowOutcome start(String request, List<String> fileContext) {
        return start(request, fileContext, null);
    }

    /**
     * Like {@link #start(String, List)}, but with a caller-supplied plan layout instead of the
     * one derived from the execution chain.
     */
    public WorkflowOutcome start(String request, List<String> fileContext, PlanBlueprint blueprint) {
        Task task = classifier.classify(request, fileContext);
        metrics.recordClassification(task.type().name(), task.complexity().name());
        ExecutionChain chain = router.route(task);
        Plan plan = blueprint != null ? planStore.createPlan(task, blueprint) : planStore.createPlan(task, chain);
        String workflowId = plan.workflowId();
        MdcContext.setWorkflow(workflowId);
        try {
            log.info("Started workflow {} for task {} ({}/{}), {} steps, chain {}", workflowId, task.id(),
                    task.type(), task.complexity(), plan.steps().size(), chain.orderedRoles());
            var ctx = newContext(workflowId, task, 1, 0);
            ctx.publish("workflow.created", null, Map.of("taskId", task.id(), "type", task.type().name(),
                    "complexity", task.complexity().name(), "roles", chain.orderedRoles()));
            if (task.ambiguous()) {
                ctx.raise(IssueKind.CLASSIFICATION_AMBIGUOUS, null,
                        "no type rule matched; defaulted to " + task.type() + "/" + task.complexity(),
                        Map.of("request", request, "reasons", String.join("; ", task.reasons())));
            }
            return run(ctx);
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Continues a workflow in a fresh instance. With a handoff package the instance takes the
     * next generation and carries the recorded usage; without one (e.g. after a crash) the
     * registry is verified and in-flight steps are reset.
     */
    public WorkflowOutcome resume(String workflowId) {
        MdcContext.setWorkflow(workflowId);
        try {
            Plan plan = planStore.loadPlan(workflowId);
            Optional<HandoffPackage> pkg = handoff.latest(workflowId);
            List<Discrepancy> discrepancies;
            RunContext ctx;
            if (plan.status() == PlanStatus.ARCHIVED) {
                discrepancies = List.of();
                ctx = newContext(workflowId, plan.task(), 1, 0);
            } else if (pkg.isPresent()) {
                var state = handoff.resume(pkg.get());
                discrepancies = state.discrepancies();
                ctx = newContext(workflowId, plan.task(), state.generation(), state.carriedTokens());
                ctx.publish("workflow.resumed", null, Map.of("generation", state.generation(),
                        "fromPackage", pkg.get().packageId(), "resetSteps", state.resetSteps()));
            } else {
                discrepancies = registry.verifyIntegrity(workflowId);
                var reset = handoff.resetInFlight(workflowId);
                ctx = newContext(workflowId, plan.task(), 1, 0);
                ctx.publish("workflow.resumed", null, Map.of("generation", 1, "resetSteps", reset));
            }
            if (!discrepancies.isEmpty()) {
                metrics.recordIntegrityDiscrepancies(discrepancies.size());
                for (Discrepancy d : discrepancies) {
                    ctx.raise(IssueKind.REGISTRY_INTEGRITY_MISMATCH, null, d.detail(),
                            Map.of("type", d.type().name(), "artifact", d.artifactName(),
                                    "version", String.valueOf(d.version())));
                }
            }
            return run(ctx);
        } finally {
            MdcContext.clear();
        }
    }

    private RunContext newContext(String workflowId, Task task, int generation, long carriedTokens) {
        return new RunContext(workflowId, task, generation,
                ContextBudgetMonitor.fromProperties(properties, carriedTokens), eventBus, metrics);
    }

    private WorkflowOutcome run(RunContext ctx) {
        String workflowId = ctx.workflowId();
        int maxParallel = properties.getMaxParallel();
        int waveNumber = 0;

        while (true) {
            Plan plan = planStore.loadPlan(workflowId);
            if (plan.status() == PlanStatus.ARCHIVED) {
                return finish(ctx, OutcomeStatus.COMPLETED, plan, null, waveNumber);
            }

            List<Step> wave = scheduler.computeNextWave(plan, maxParallel);
            if (wave.isEmpty()) {
                return terminal(ctx, plan, waveNumber);
            }

            if (ctx.budget().shouldHandoff()) {
                String next = wave.get(0).stepId();
                HandoffPackage pkg = handoff.prepare(workflowId, ctx.generation(), next, ctx.budget().usage());
                metrics.recordHandoff(ctx.generation());
                ctx.raise(IssueKind.BUDGET_EXCEEDED, next,
                        "context budget at %.0f%%; handed off generation %d".formatted(
                                ctx.budget().utilization() * 100, ctx.generation()),
                        Map.of("packageId", pkg.packageId(),
                                "utilization", String.valueOf(ctx.budget().utilization()),
                                "nextStep", next));
                ctx.publish("workflow.handoff", next, Map.of("packageId", pkg.packageId(),
                        "generation", ctx.generation()));
                return finish(ctx, OutcomeStatus.HANDOFF_TRIGGERED, planStore.loadPlan(workflowId), pkg, waveNumber);
            }

            waveNumber++;
            var results = waves.execute(ctx, plan, wave, waveNumber, maxParallel);
            settle(ctx, results);
            MdcContext.setWorkflow(workflowId);
        }
    }

    private WorkflowOutcome terminal(RunContext ctx, Plan plan, int waves) {
        String workflowId = ctx.workflowId();
        if (plan.allCompleted()) {
            planStore.updatePlanStatus(workflowId, PlanStatus.COMPLETED);
            planStore.archivePlan(workflowId);
            return finish(ctx, OutcomeStatus.COMPLETED, planStore.loadPlan(workflowId), null, waves);
        }
        boolean blocked = plan.steps().stream().anyMatch(s -> s.status() == StepStatus.BLOCKED);
        planStore.updatePlanStatus(workflowId, blocked ? PlanStatus.BLOCKED : PlanStatus.FAILED);
        return finish(ctx, blocked ? OutcomeStatus.BLOCKED : OutcomeStatus.FAILED,
                planStore.loadPlan(workflowId), null, waves);
    }

    private WorkflowOutcome finish(RunContext ctx, OutcomeStatus status, Plan plan, HandoffPackage pkg, int waves) {
        metrics.recordWorkflowResult(status.name());
        ctx.publish("workflow." + status.name().toLowerCase(), null,
                Map.of("waves", waves, "issues", ctx.issues().size()));
        log.info("Workflow {} stopped: {} after {} wave(s), {} issue(s)", ctx.workflowId(), status, waves,
                ctx.issues().size());
        return new WorkflowOutcome(ctx.workflowId(), status, plan, ctx.issues(), pkg, waves);
    }

    /**
     * Settles a wave: detects and resolves conflicts across passing outputs, registers artifacts
     * and moves each step to its final status for this wave.
     */
    void settle(RunContext ctx, List<StepExecution> results) {
        String workflowId = ctx.workflowId();
        var passed = new LinkedHashMap<String, StepExecution>();
        for (StepExecution r : results) {
            if (r.outcome() == StepExecution.Outcome.PASSED) passed.put(r.stepId(), r);
        }
        if (passed.isEmpty()) {
            return;
        }

        var outputs = passed.values().stream()
                .map(r -> new WorkerOutput(r.stepId(), r.role(), r.artifacts(), r.claims()))
                .toList();
        List<ConflictRecord> detected = conflicts.detectConflicts(workflowId, outputs);

        // subjects a step must not register under its own name
        Map<String, Set<String>> withheld = new HashMap<>();
        Map<String, List<String>> produced = new HashMap<>();
        Map<String, String> blockedBy = new HashMap<>();
        for (ConflictRecord record : detected) {
            Resolution resolution = conflicts.resolve(record);
            boolean accepted = resolution != null && resolution.accepted();
            metrics.recordConflict(record.severity().name(), accepted ? "resolved" : "escalated");
            boolean artifactSubject = passed.values().stream()
                    .anyMatch(r -> r.artifacts().containsKey(record.subject()));
            if (artifactSubject) {
                record.stepIds().forEach(s -> withheld.computeIfAbsent(s, k -> new HashSet<>()).add(record.subject()));
            }
            if (accepted) {
                ctx.publish("conflict.resolved", resolution.acceptedStepId(), Map.of("conflictId", record.conflictId(),
                        "subject", record.subject(), "accepted", resolution.acceptedOutputId(),
                        "resolvedBy", resolution.resolvedBy()));
                StepExecution winner = passed.get(resolution.acceptedStepId());
                if (artifactSubject && winner != null) {
                    Artifact artifact = register(workflowId, winner, record.subject(),
                            winner.artifacts().get(record.subject()));
                    produced.computeIfAbsent(winner.stepId(), k -> new ArrayList<>()).add(artifact.artifactId());
                }
            } else {
                String reason = resolution != null ? resolution.rationale() : "unresolved";
                ctx.raise(IssueKind.CONFLICT_UNRESOLVED, null, "conflict " + record.conflictId() + " on '"
                                + record.subject() + "' needs operator review",
                        Map.of("conflictId", record.conflictId(),
                                "subject", record.subject(),
                                "outputs", String.join(", ", record.conflictingOutputs()),
                                "severity", record.severity().name(),
                                "reason", String.valueOf(reason)));
                record.stepIds().forEach(s -> blockedBy.putIfAbsent(s, record.conflictId()));
            }
        }

        for (StepExecution r : passed.values()) {
            Set<String> skip = withheld.getOrDefault(r.stepId(), Set.of());
            var ids = produced.computeIfAbsent(r.stepId(), k -> new ArrayList<>());
            r.artifacts().forEach((name, content) -> {
                if (!skip.contains(name)) ids.add(register(workflowId, r, name, content).artifactId());
            });
            String conflictId = blockedBy.get(r.stepId());
            if (conflictId != null) {
                planStore.updateStepStatus(workflowId, r.stepId(), StepStatus.BLOCKED, ids,
                        "awaiting resolution of conflict " + conflictId);
                ctx.publish("step.blocked", r.stepId(), Map.of("conflictId", conflictId));
            } else {
                planStore.updateStepStatus(workflowId, r.stepId(), StepStatus.COMPLETED, ids,
                        "gate " + r.gate().verdict() + " (score " + r.gate().qualityScore() + ")");
                ctx.publish("step.completed", r.stepId(), Map.of("role", r.role(), "artifacts", ids));
            }
        }
    }

    private Artifact register(String workflowId, StepExecution execution, String name, String content) {
        return registry.register(new ArtifactSubmission(workflowId, name, execution.stepId(), content,
                ValidationStatus.PASS, execution.inputArtifacts()));
    }
}
