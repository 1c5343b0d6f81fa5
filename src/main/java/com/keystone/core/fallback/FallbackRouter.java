package com.keystone.core.fallback;

import com.keystone.core.worker.WorkerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Picks an alternate role when a role exhausts its gate attempts or its worker is unavailable.
 * Alternates come from a static capability-overlap matrix and are tried in matrix order,
 * skipping roles that already attempted the step and roles with no available worker.
 */
@Service
public class FallbackRouter {

    private static final Logger log = LoggerFactory.getLogger(FallbackRouter.class);

    private static final Map<String, List<String>> MATRIX = new LinkedHashMap<>();

    static {
        MATRIX.put("architect", List.of("developer"));
        MATRIX.put("ux-designer", List.of("developer"));
        MATRIX.put("pm", List.of("analyst"));
        MATRIX.put("analyst", List.of("pm"));
        MATRIX.put("developer", List.of("architect"));
        MATRIX.put("qa", List.of("code-reviewer", "developer"));
        MATRIX.put("code-reviewer", List.of("architect", "qa"));
        MATRIX.put("technical-writer", List.of("analyst", "pm"));
        MATRIX.put("devops", List.of("developer"));
        MATRIX.put("researcher", List.of("analyst"));
        MATRIX.put("planner", List.of("pm", "architect"));
        MATRIX.put("impact-analyst", List.of("architect"));
        MATRIX.put("security-architect", List.of("architect"));
        MATRIX.put("compliance-auditor", List.of("security-architect"));
        MATRIX.put("accessibility-expert", List.of("ux-designer"));
        MATRIX.put("performance-engineer", List.of("developer"));
        MATRIX.put("database-architect", List.of("architect", "developer"));
    }

    private final Predicate<String> available;

    @Autowired
    public FallbackRouter(WorkerRegistry workers) {
        this(workers::isAvailable);
    }

    public FallbackRouter(Predicate<String> available) {
        this.available = available;
    }

    public static List<String> alternatesFor(String role) {
        return MATRIX.getOrDefault(role, List.of());
    }

    public Optional<FallbackDecision> fallback(String failedRole, FallbackContext context) {
        for (String candidate : alternatesFor(failedRole)) {
            if (context.triedRoles().contains(candidate) || candidate.equals(failedRole)) {
                log.debug("Fallback {} -> {} skipped: already tried", failedRole, candidate);
                continue;
            }
            if (!available.test(candidate)) {
                log.debug("Fallback {} -> {} skipped: no worker", failedRole, candidate);
                continue;
            }
            log.info("Fallback for {}: {} -> {} ({})", context.stepId(), failedRole, candidate, context.reason());
            return Optional.of(new FallbackDecision(context.stepId(), failedRole, candidate, context));
        }
        log.warn("No fallback for {} on {} (tried {})", failedRole, context.stepId(), context.triedRoles());
        return Optional.empty();
    }
}
