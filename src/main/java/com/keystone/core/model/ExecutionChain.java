package com.keystone.core.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Total-ordered sequence of worker roles a task is routed through.
 *
 * @param primaryRole         role that owns the task type
 * @param supportingRoles     roles from the same capability-matrix entry
 * @param crossCuttingRoles   roles injected by the trigger table (security, accessibility, ...)
 * @param reviewRoles         roles that review correctness once cross-cutting work is done
 * @param approvalRoles       roles whose sign-off completes complex and critical chains
 * @param requiredGates       gates implied by the task's complexity
 * @param triggerTableVersion version of the trigger table that produced the cross-cutting roles
 */
public record ExecutionChain(
    String primaryRole,
    List<String> supportingRoles,
    List<String> crossCuttingRoles,
    List<String> reviewRoles,
    List<String> approvalRoles,
    RequiredGates requiredGates,
    int triggerTableVersion
) implements Serializable {

    public ExecutionChain {
        supportingRoles = supportingRoles == null ? List.of() : List.copyOf(supportingRoles);
        crossCuttingRoles = crossCuttingRoles == null ? List.of() : List.copyOf(crossCuttingRoles);
        reviewRoles = reviewRoles == null ? List.of() : List.copyOf(reviewRoles);
        approvalRoles = approvalRoles == null ? List.of() : List.copyOf(approvalRoles);
    }

    /**
     * All roles in execution order: primary, supporting, cross-cutting, review, approval.
     */
    public List<String> orderedRoles() {
        var roles = new ArrayList<String>();
        roles.add(primaryRole);
        roles.addAll(supportingRoles);
        roles.addAll(crossCuttingRoles);
        roles.addAll(reviewRoles);
        roles.addAll(approvalRoles);
        return List.copyOf(roles);
    }
}
