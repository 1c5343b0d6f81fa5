package com.keystone.core.plan;

import com.keystone.core.model.ExecutionChain;
import com.keystone.core.model.RequiredGates;
import com.keystone.core.roles.Capability;
import com.keystone.core.roles.RoleCatalog;

import java.util.ArrayList;
import java.util.List;

/**
 * Phase and step layout of a plan before it is persisted. Built from a routed chain by
 * {@link #fromChain}, or supplied directly for ad-hoc chains (for example loaded from JSON).
 *
 * @param phases phases in execution order
 */
public record PlanBlueprint(List<PhaseSpec> phases) {

    public static final String PLAN_SCHEMA = "plan-output";
    public static final String WORK_SCHEMA = "work-output";
    public static final String REVIEW_SCHEMA = "review-output";

    public PlanBlueprint {
        phases = phases == null ? List.of() : List.copyOf(phases);
    }

    /**
     * @param name  phase name
     * @param steps steps of the phase
     */
    public record PhaseSpec(String name, List<StepSpec> steps) {
        public PhaseSpec {
            steps = steps == null ? List.of() : List.copyOf(steps);
        }
    }

    /**
     * @param stepId         unique step ID
     * @param role           assigned worker role
     * @param dependencies   step IDs that must complete first
     * @param outputSchema   output contract name; {@link #WORK_SCHEMA} when null
     * @param requiredInputs artifact references in {@code name (from step X[, optional])} form
     */
    public record StepSpec(String stepId, String role, List<String> dependencies,
                           String outputSchema, List<String> requiredInputs) {
        public StepSpec {
            dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
            requiredInputs = requiredInputs == null ? List.of() : List.copyOf(requiredInputs);
            outputSchema = outputSchema == null ? WORK_SCHEMA : outputSchema;
        }
    }

    /**
     * Materializes a chain into phases: planning (planner, then impact analysis), implementation
     * (primary, then the supporting roles in parallel), cross-cutting, review and approval.
     * The first steps of every phase depend on all steps of the previous phase.
     */
    public static PlanBlueprint fromChain(ExecutionChain chain, RoleCatalog roles) {
        var builder = new Builder();
        RequiredGates gates = chain.requiredGates();

        if (gates.planner() || gates.impactAnalysis()) {
            builder.phase("planning");
            if (gates.planner()) {
                builder.sequential(roles.resolve(Capability.PLANNING).roleName(), PLAN_SCHEMA);
            }
            if (gates.impactAnalysis()) {
                builder.sequential(roles.resolve(Capability.IMPACT_ANALYSIS).roleName(), WORK_SCHEMA);
            }
        }

        builder.phase("implementation");
        builder.sequential(chain.primaryRole(), WORK_SCHEMA);
        builder.parallel(chain.supportingRoles(), WORK_SCHEMA);

        if (!chain.crossCuttingRoles().isEmpty()) {
            builder.phase("cross-cutting");
            builder.parallel(chain.crossCuttingRoles(), WORK_SCHEMA);
        }
        if (!chain.reviewRoles().isEmpty()) {
            builder.phase("review");
            builder.parallel(chain.reviewRoles(), REVIEW_SCHEMA);
        }
        if (!chain.approvalRoles().isEmpty()) {
            builder.phase("approval");
            builder.parallel(chain.approvalRoles(), REVIEW_SCHEMA);
        }
        return builder.build();
    }

    public int stepCount() {
        return phases.stream().mapToInt(p -> p.steps().size()).sum();
    }

    private static final class Builder {
        private final List<PhaseSpec> phases = new ArrayList<>();
        private String currentName;
        private List<StepSpec> current = new ArrayList<>();
        private List<String> previousPhaseSteps = List.of();
        private List<String> lastGroup = List.of();
        private int counter;

        void phase(String name) {
            closePhase();
            currentName = name;
            current = new ArrayList<>();
            lastGroup = previousPhaseSteps;
        }

        /** Adds one step depending on everything added just before it. */
        void sequential(String role, String schema) {
            String id = nextId();
            current.add(new StepSpec(id, role, lastGroup, schema, List.of()));
            lastGroup = List.of(id);
        }

        /** Adds steps that all share the same predecessors. */
        void parallel(List<String> roles, String schema) {
            if (roles.isEmpty()) return;
            var ids = new ArrayList<String>();
            for (String role : roles) {
                String id = nextId();
                current.add(new StepSpec(id, role, lastGroup, schema, List.of()));
                ids.add(id);
            }
            lastGroup = ids;
        }

        PlanBlueprint build() {
            closePhase();
            return new PlanBlueprint(phases);
        }

        private void closePhase() {
            if (currentName != null && !current.isEmpty()) {
                phases.add(new PhaseSpec(currentName, current));
                previousPhaseSteps = current.stream().map(StepSpec::stepId).toList();
            }
            currentName = null;
        }

        private String nextId() {
            return "STEP-%03d".formatted(++counter);
        }
    }
}
