package com.keystone.core.routing;

import com.keystone.core.model.Complexity;
import com.keystone.core.model.ExecutionChain;
import com.keystone.core.model.Task;
import com.keystone.core.roles.Capability;
import com.keystone.core.roles.RoleCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Routes a classified task to an ordered {@link ExecutionChain}.
 * <p>
 * Order is primary, supporting, cross-cutting, review, approval. A role appears once: when
 * it qualifies for a gating position (review or approval) it occupies only that position,
 * otherwise it keeps the earliest working position it qualified for.
 */
@Service
public class AgentRouter {

    private static final Logger log = LoggerFactory.getLogger(AgentRouter.class);

    private final RoleCatalog roles;

    public AgentRouter(RoleCatalog roles) {
        this.roles = roles;
    }

    public ExecutionChain route(Task task) {
        var entry = CapabilityMatrix.entryFor(task.type());
        String primary = roles.resolve(entry.primary()).roleName();

        var supporting = new LinkedHashSet<String>();
        for (Capability capability : entry.supporting()) {
            supporting.add(roles.resolve(capability).roleName());
        }

        var crossCutting = new LinkedHashSet<String>();
        for (CrossCuttingTrigger trigger : CrossCuttingTrigger.values()) {
            if (trigger.matches(task.description())) {
                crossCutting.add(roles.resolve(trigger.capability()).roleName());
            }
        }

        var review = new LinkedHashSet<String>();
        if (task.requiredGates().review()) {
            review.add(roles.resolve(Capability.CODE_REVIEW).roleName());
        }
        var approval = new LinkedHashSet<String>();
        if (task.complexity().atLeast(Complexity.COMPLEX)) {
            approval.add(roles.resolve(Capability.QUALITY_ASSURANCE).roleName());
        }

        // gating positions win; among working positions the earliest wins
        review.removeAll(approval);
        Set<String> gating = new LinkedHashSet<>(review);
        gating.addAll(approval);
        supporting.removeAll(gating);
        crossCutting.removeAll(gating);
        supporting.remove(primary);
        crossCutting.remove(primary);
        crossCutting.removeAll(supporting);
        if (gating.contains(primary)) {
            // the owning role always works the task; it drops out of gating instead
            review.remove(primary);
            approval.remove(primary);
        }

        var chain = new ExecutionChain(primary, new ArrayList<>(supporting), new ArrayList<>(crossCutting),
                new ArrayList<>(review), new ArrayList<>(approval), task.requiredGates(),
                CrossCuttingTrigger.TABLE_VERSION);
        log.info("Routed {} ({}/{}) -> {}", task.id(), task.type(), task.complexity(), chain.orderedRoles());
        return chain;
    }
}
