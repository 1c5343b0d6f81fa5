package com.keystone.core.engine;

import com.keystone.core.model.Plan;
import com.keystone.core.model.Step;
import com.keystone.core.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the next wave of eligible steps: PENDING steps whose dependencies are all
 * COMPLETED, in plan order, capped at the concurrency limit.
 */
@Service
public class StepScheduler {

    private static final Logger log = LoggerFactory.getLogger(StepScheduler.class);

    public List<Step> computeNextWave(Plan plan, int maxParallel) {
        Set<String> completed = plan.steps().stream()
                .filter(s -> s.status() == StepStatus.COMPLETED)
                .map(Step::stepId)
                .collect(Collectors.toSet());

        var wave = new ArrayList<Step>();
        for (Step step : plan.steps()) {
            if (wave.size() >= maxParallel) break;
            if (step.status() != StepStatus.PENDING) continue;
            if (!completed.containsAll(step.dependencies())) {
                log.debug("  {} [{}] - deps unsatisfied: {}", step.stepId(), step.assignedRole(), step.dependencies());
                continue;
            }
            log.debug("  {} [{}] - eligible", step.stepId(), step.assignedRole());
            wave.add(step);
        }
        log.info("computeNextWave: {} steps, {} completed, maxParallel={} -> {}",
                plan.steps().size(), completed.size(), maxParallel, wave.stream().map(Step::stepId).toList());
        return wave;
    }

    /** The first step that would be dispatched next, if any. */
    public Optional<Step> nextEligible(Plan plan) {
        return computeNextWave(plan, 1).stream().findFirst();
    }
}
