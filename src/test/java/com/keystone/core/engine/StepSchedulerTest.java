package com.keystone.core.engine;

import com.keystone.core.model.Phase;
import com.keystone.core.model.Plan;
import com.keystone.core.model.PlanStatus;
import com.keystone.core.model.Step;
import com.keystone.core.model.StepStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StepSchedulerTest {

    private final StepScheduler scheduler = new StepScheduler();

    private static Step step(String id, StepStatus status, String... deps) {
        return Step.pending(id, "developer", List.of(deps), "work-output").withStatus(status, null, null);
    }

    private static Plan plan(Step... steps) {
        return new Plan("WF-1", null, PlanStatus.ACTIVE,
                List.of(new Phase("PH-01", "work", 1, List.of(steps))), Instant.now(), Instant.now());
    }

    @Test
    @DisplayName("only pending steps with completed dependencies are eligible")
    void eligibility() {
        Plan plan = plan(
                step("A", StepStatus.COMPLETED),
                step("B", StepStatus.PENDING, "A"),
                step("C", StepStatus.PENDING, "B"),
                step("D", StepStatus.IN_PROGRESS),
                step("E", StepStatus.PENDING));

        assertEquals(List.of("B", "E"), scheduler.computeNextWave(plan, 4).stream().map(Step::stepId).toList());
    }

    @Test
    @DisplayName("the wave is capped at the concurrency limit, keeping plan order")
    void capped() {
        Plan plan = plan(step("A", StepStatus.PENDING), step("B", StepStatus.PENDING), step("C", StepStatus.PENDING));

        assertEquals(List.of("A", "B"), scheduler.computeNextWave(plan, 2).stream().map(Step::stepId).toList());
        assertEquals("A", scheduler.nextEligible(plan).orElseThrow().stepId());
    }

    @Test
    @DisplayName("a failed dependency leaves nothing eligible")
    void failedDependency() {
        Plan plan = plan(step("A", StepStatus.FAILED), step("B", StepStatus.PENDING, "A"));

        assertTrue(scheduler.computeNextWave(plan, 4).isEmpty());
        assertTrue(scheduler.nextEligible(plan).isEmpty());
    }
}
