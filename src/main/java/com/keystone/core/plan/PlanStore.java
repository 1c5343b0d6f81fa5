package com.keystone.core.plan;

import com.keystone.core.model.ExecutionChain;
import com.keystone.core.model.Phase;
import com.keystone.core.model.Plan;
import com.keystone.core.model.PlanStatus;
import com.keystone.core.model.Step;
import com.keystone.core.model.StepStatus;
import com.keystone.core.model.Task;

import java.util.Collection;
import java.util.List;

/**
 * Durable source of truth for workflow progress.
 * <p>
 * Implementations never cache plan state: every read goes to storage and every mutation
 * re-reads before writing, so any orchestration instance can pick up where another stopped.
 */
public interface PlanStore {

    /** Creates a plan for a routed chain. */
    Plan createPlan(Task task, ExecutionChain chain);

    /** Creates a plan from an ad-hoc blueprint. */
    Plan createPlan(Task task, PlanBlueprint blueprint);

    /**
     * Applies a status transition and merges the given artifact IDs into the step.
     * Repeating the current status without new artifacts is a no-op.
     *
     * @throws InvalidPlanException on an illegal transition, an unknown step, or when
     *                              IN_PROGRESS is requested before every dependency completed
     */
    Step updateStepStatus(String workflowId, String stepId, StepStatus status,
                          Collection<String> artifacts, String reason);

    default Step updateStepStatus(String workflowId, String stepId, StepStatus status,
                                  Collection<String> artifacts) {
        return updateStepStatus(workflowId, stepId, status, artifacts, null);
    }

    /** Moves a step to another role, recording the role it came from. */
    Step reassignStep(String workflowId, String stepId, String newRole, String reason);

    Plan loadPlan(String workflowId);

    PlanIndex loadIndex(String workflowId);

    Phase loadPhase(String workflowId, String phaseId);

    void updatePlanStatus(String workflowId, PlanStatus status);

    /** Marks a finished plan ARCHIVED. Archived plans are kept and reject further mutation. */
    void archivePlan(String workflowId);

    boolean exists(String workflowId);

    List<String> listWorkflows();
}
