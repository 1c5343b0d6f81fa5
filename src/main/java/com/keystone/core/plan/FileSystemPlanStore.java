package com.keystone.core.plan;

import com.keystone.config.KeystoneProperties;
import com.keystone.core.artifact.ArtifactReference;
import com.keystone.core.model.ExecutionChain;
import com.keystone.core.model.Phase;
import com.keystone.core.model.PhaseStatus;
import com.keystone.core.model.Plan;
import com.keystone.core.model.PlanStatus;
import com.keystone.core.model.Step;
import com.keystone.core.model.StepStatus;
import com.keystone.core.model.Task;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import com.keystone.core.roles.RoleCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * {@link PlanStore} over JSON documents: one master index per plan plus one document per phase.
 * Phases larger than the configured step bound are split across several documents.
 */
@Service
public class FileSystemPlanStore implements PlanStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemPlanStore.class);

    private final JsonDocumentStore documents;
    private final WorkspaceLayout layout;
    private final RoleCatalog roles;
    private final int maxStepsPerPhase;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    @Autowired
    public FileSystemPlanStore(JsonDocumentStore documents, WorkspaceLayout layout, RoleCatalog roles,
                               KeystoneProperties properties) {
        this(documents, layout, roles, properties.getMaxStepsPerPhase());
    }

    public FileSystemPlanStore(JsonDocumentStore documents, WorkspaceLayout layout, RoleCatalog roles,
                               int maxStepsPerPhase) {
        if (maxStepsPerPhase < 1) {
            throw new IllegalArgumentException("maxStepsPerPhase must be positive");
        }
        this.documents = documents;
        this.layout = layout;
        this.roles = roles;
        this.maxStepsPerPhase = maxStepsPerPhase;
    }

    @Override
    public Plan createPlan(Task task, ExecutionChain chain) {
        return create(task, chain, PlanBlueprint.fromChain(chain, roles));
    }

    @Override
    public Plan createPlan(Task task, PlanBlueprint blueprint) {
        return create(task, null, blueprint);
    }

    private Plan create(Task task, ExecutionChain chain, PlanBlueprint blueprint) {
        if (blueprint.stepCount() == 0) {
            throw new InvalidPlanException("Plan for " + task.id() + " has no steps");
        }
        validate(blueprint);

        String workflowId = "WF-" + UUID.randomUUID().toString().substring(0, 8);
        Instant now = Instant.now();
        var phases = new ArrayList<Phase>();
        var entries = new ArrayList<PlanIndex.PhaseEntry>();
        int ordinal = 0;
        for (var spec : blueprint.phases()) {
            List<List<PlanBlueprint.StepSpec>> chunks = chunk(spec.steps());
            for (int i = 0; i < chunks.size(); i++) {
                ordinal++;
                String name = chunks.size() == 1 ? spec.name()
                        : "%s (%d/%d)".formatted(spec.name(), i + 1, chunks.size());
                var steps = chunks.get(i).stream().map(FileSystemPlanStore::toStep).toList();
                var phase = new Phase("PH-%02d".formatted(ordinal), name, ordinal, steps);
                phases.add(phase);
                Path file = layout.phaseFile(workflowId, ordinal);
                entries.add(new PlanIndex.PhaseEntry(phase.phaseId(), name, ordinal,
                        file.getFileName().toString(), phase.status(), steps.size()));
            }
        }

        synchronized (lockFor(workflowId)) {
            for (int i = 0; i < phases.size(); i++) {
                documents.write(layout.phaseFile(workflowId, phases.get(i).ordinal()), phases.get(i));
            }
            // index last: a plan is visible only once all of its phase documents exist
            documents.write(layout.planIndex(workflowId),
                    new PlanIndex(workflowId, task, chain, PlanStatus.ACTIVE, entries, now, now));
        }
        log.info("Created plan {} for {}: {} phase document(s), {} step(s)",
                workflowId, task.id(), phases.size(), blueprint.stepCount());
        return new Plan(workflowId, task, PlanStatus.ACTIVE, phases, now, now);
    }

    private void validate(PlanBlueprint blueprint) {
        var graph = new DependencyGraph();
        Map<String, PlanBlueprint.StepSpec> byId = new HashMap<>();
        for (var phase : blueprint.phases()) {
            for (var step : phase.steps()) {
                if (step.stepId() == null || step.stepId().isBlank()) {
                    throw new InvalidPlanException("Step without ID in phase " + phase.name());
                }
                if (step.role() == null || step.role().isBlank()) {
                    throw new InvalidPlanException("Step " + step.stepId() + " has no role");
                }
                graph.addStep(step.stepId(), step.dependencies());
                byId.put(step.stepId(), step);
            }
        }
        graph.topologicalOrder();

        for (var step : byId.values()) {
            for (String input : step.requiredInputs()) {
                ArtifactReference ref;
                try {
                    ref = ArtifactReference.parse(input);
                } catch (IllegalArgumentException e) {
                    throw new InvalidPlanException("Step " + step.stepId() + ": " + e.getMessage());
                }
                if (ref.fromStep() != null && !byId.containsKey(ref.fromStep())) {
                    throw new InvalidPlanException("Step " + step.stepId() + " requires '" + input
                            + "' from unknown step " + ref.fromStep());
                }
                if (ref.fromStep() != null && !reaches(byId, step.stepId(), ref.fromStep())) {
                    throw new InvalidPlanException("Step " + step.stepId() + " requires '" + input
                            + "' but does not depend on step " + ref.fromStep());
                }
            }
        }
    }

    private static boolean reaches(Map<String, PlanBlueprint.StepSpec> byId, String from, String target) {
        var seen = new HashSet<String>();
        var stack = new ArrayList<>(byId.get(from).dependencies());
        while (!stack.isEmpty()) {
            String id = stack.remove(stack.size() - 1);
            if (id.equals(target)) return true;
            if (seen.add(id)) stack.addAll(byId.get(id).dependencies());
        }
        return false;
    }

    private List<List<PlanBlueprint.StepSpec>> chunk(List<PlanBlueprint.StepSpec> steps) {
        var chunks = new ArrayList<List<PlanBlueprint.StepSpec>>();
        for (int i = 0; i < steps.size(); i += maxStepsPerPhase) {
            chunks.add(steps.subList(i, Math.min(steps.size(), i + maxStepsPerPhase)));
        }
        return chunks;
    }

    private static Step toStep(PlanBlueprint.StepSpec spec) {
        return new Step(spec.stepId(), spec.role(), new TreeSet<>(spec.dependencies()),
                StepStatus.PENDING, null, spec.outputSchema(), spec.requiredInputs(), null, null);
    }

    @Override
    public Step updateStepStatus(String workflowId, String stepId, StepStatus status,
                                 Collection<String> artifacts, String reason) {
        synchronized (lockFor(workflowId)) {
            PlanIndex index = loadIndex(workflowId);
            requireMutable(index);
            Phase phase = phaseOf(index, stepId);
            Step current = phase.step(stepId).orElseThrow();
            Set<String> incoming = artifacts == null ? Set.of() : Set.copyOf(artifacts);

            if (current.status() == status && current.producedArtifacts().containsAll(incoming)) {
                log.debug("Step {} already {}; no-op", stepId, status);
                return current;
            }
            if (current.status() != status && !current.status().canTransitionTo(status)) {
                throw new InvalidPlanException("Illegal transition for " + stepId + ": "
                        + current.status() + " -> " + status + " (allowed: " + current.status().allowedNext() + ")");
            }
            if (status == StepStatus.IN_PROGRESS) {
                requireDependenciesCompleted(workflowId, index, current);
            }

            Step updated = current.withStatus(status, incoming, reason);
            writePhase(workflowId, index, phase, updated);
            log.info("Step {} {} -> {}{}", stepId, current.status(), status,
                    reason != null ? " (" + reason + ")" : "");
            return updated;
        }
    }

    @Override
    public Step reassignStep(String workflowId, String stepId, String newRole, String reason) {
        synchronized (lockFor(workflowId)) {
            PlanIndex index = loadIndex(workflowId);
            requireMutable(index);
            Phase phase = phaseOf(index, stepId);
            Step current = phase.step(stepId).orElseThrow();
            if (current.status() == StepStatus.COMPLETED) {
                throw new InvalidPlanException("Cannot reassign completed step " + stepId);
            }
            Step updated = current.withRole(newRole, current.assignedRole())
                    .withStatus(current.status(), null, reason);
            writePhase(workflowId, index, phase, updated);
            log.info("Step {} reassigned {} -> {}: {}", stepId, current.assignedRole(), newRole, reason);
            return updated;
        }
    }

    private void requireDependenciesCompleted(String workflowId, PlanIndex index, Step step) {
        for (String dep : step.dependencies()) {
            Step dependency = phaseOf(index, dep).step(dep).orElseThrow();
            if (dependency.status() != StepStatus.COMPLETED) {
                throw new InvalidPlanException("Step " + step.stepId() + " cannot start: dependency "
                        + dep + " is " + dependency.status());
            }
        }
    }

    private void writePhase(String workflowId, PlanIndex index, Phase phase, Step updated) {
        var steps = phase.steps().stream()
                .map(s -> s.stepId().equals(updated.stepId()) ? updated : s)
                .toList();
        var next = new Phase(phase.phaseId(), phase.name(), phase.ordinal(), steps);
        documents.write(layout.phaseFile(workflowId, phase.ordinal()), next);

        var entries = index.phases().stream()
                .map(e -> e.phaseId().equals(next.phaseId()) ? e.withStatus(next.status()) : e)
                .toList();
        PlanStatus planStatus = entries.stream().allMatch(e -> e.status() == PhaseStatus.COMPLETED)
                ? PlanStatus.COMPLETED
                : updated.status() == StepStatus.PENDING || updated.status() == StepStatus.IN_PROGRESS
                        ? PlanStatus.ACTIVE
                        : index.status() == PlanStatus.COMPLETED ? PlanStatus.ACTIVE : index.status();
        documents.write(layout.planIndex(workflowId), index.with(planStatus, entries));
    }

    @Override
    public Plan loadPlan(String workflowId) {
        PlanIndex index = loadIndex(workflowId);
        var phases = index.phases().stream().map(e -> readPhase(workflowId, e)).toList();
        return new Plan(workflowId, index.task(), index.status(), phases, index.createdAt(), index.updatedAt());
    }

    @Override
    public PlanIndex loadIndex(String workflowId) {
        return documents.read(layout.planIndex(workflowId), PlanIndex.class)
                .orElseThrow(() -> new PlanNotFoundException(workflowId));
    }

    @Override
    public Phase loadPhase(String workflowId, String phaseId) {
        PlanIndex index = loadIndex(workflowId);
        var entry = index.phase(phaseId)
                .orElseThrow(() -> new InvalidPlanException("Unknown phase " + phaseId + " in " + workflowId));
        return readPhase(workflowId, entry);
    }

    @Override
    public void updatePlanStatus(String workflowId, PlanStatus status) {
        mutateIndex(workflowId, index -> index.with(status, index.phases()));
    }

    @Override
    public void archivePlan(String workflowId) {
        mutateIndex(workflowId, index -> index.with(PlanStatus.ARCHIVED, index.phases()));
        log.info("Archived plan {}", workflowId);
    }

    private void mutateIndex(String workflowId, UnaryOperator<PlanIndex> change) {
        synchronized (lockFor(workflowId)) {
            PlanIndex index = loadIndex(workflowId);
            requireMutable(index);
            documents.write(layout.planIndex(workflowId), change.apply(index));
        }
    }

    @Override
    public boolean exists(String workflowId) {
        return Files.isRegularFile(layout.planIndex(workflowId));
    }

    @Override
    public List<String> listWorkflows() {
        return documents.listDirectories(layout.workflowsDir()).stream()
                .map(p -> p.getFileName().toString())
                .filter(this::exists)
                .toList();
    }

    private Phase phaseOf(PlanIndex index, String stepId) {
        for (PlanIndex.PhaseEntry entry : index.phases()) {
            Phase phase = readPhase(index.workflowId(), entry);
            if (phase.step(stepId).isPresent()) {
                return phase;
            }
        }
        throw new InvalidPlanException("Unknown step " + stepId + " in " + index.workflowId());
    }

    private Phase readPhase(String workflowId, PlanIndex.PhaseEntry entry) {
        return documents.read(layout.planDir(workflowId).resolve(entry.file()), Phase.class)
                .orElseThrow(() -> new InvalidPlanException("Phase document " + entry.file()
                        + " of " + workflowId + " is missing"));
    }

    private static void requireMutable(PlanIndex index) {
        if (index.status() == PlanStatus.ARCHIVED) {
            throw new InvalidPlanException("Plan " + index.workflowId() + " is archived");
        }
    }

    private Object lockFor(String workflowId) {
        return locks.computeIfAbsent(workflowId, k -> new Object());
    }
}
