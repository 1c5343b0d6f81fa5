package com.keystone.core.engine;

import com.keystone.core.gate.OutputSchema;
import com.keystone.core.model.Complexity;
import com.keystone.core.model.GateRecord;
import com.keystone.core.model.OutcomeStatus;
import com.keystone.core.model.RequiredGates;
import com.keystone.core.model.StepStatus;
import com.keystone.core.model.Task;
import com.keystone.core.model.TaskType;
import com.keystone.core.model.WorkflowOutcome;
import com.keystone.core.plan.PlanBlueprint;
import com.keystone.core.worker.WorkerResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OperatorActionsTest {

    @TempDir
    Path workspace;

    private EngineHarness h;

    @BeforeEach
    void setUp() {
        h = new EngineHarness(workspace);
    }

    @AfterEach
    void tearDown() {
        h.close();
    }

    private static PlanBlueprint blueprint() {
        return new PlanBlueprint(List.of(new PlanBlueprint.PhaseSpec("work", List.of(
                new PlanBlueprint.StepSpec("A", "developer", List.of(), null, List.of()),
                new PlanBlueprint.StepSpec("B", "qa", List.of("A"), null, List.of())))));
    }

    private String createPlan() {
        var task = new Task("TASK-op", "add export", TaskType.IMPLEMENTATION, Complexity.SIMPLE,
                RequiredGates.forComplexity(Complexity.SIMPLE), List.of(), false, List.of());
        return h.plans.createPlan(task, blueprint()).workflowId();
    }

    @Nested
    @DisplayName("cancelStep")
    class CancelTests {

        @Test
        @DisplayName("pending steps fail immediately")
        void pending() {
            String wf = createPlan();

            assertEquals(StepStatus.FAILED, h.operator.cancelStep(wf, "B", "not needed"));
            var b = h.plans.loadPlan(wf).step("B").orElseThrow();
            assertEquals(StepStatus.FAILED, b.status());
            assertEquals("cancelled by operator: not needed", b.statusReason());
        }

        @Test
        @DisplayName("running steps get a cancel marker")
        void running() {
            String wf = createPlan();
            h.plans.updateStepStatus(wf, "A", StepStatus.IN_PROGRESS, List.of());

            assertEquals(StepStatus.IN_PROGRESS, h.operator.cancelStep(wf, "A", null));
            assertTrue(Files.exists(h.layout.cancelMarker(wf, "A")));
        }

        @Test
        @DisplayName("finished and unknown steps are rejected")
        void rejects() {
            String wf = createPlan();
            h.plans.updateStepStatus(wf, "A", StepStatus.IN_PROGRESS, List.of());
            h.plans.updateStepStatus(wf, "A", StepStatus.COMPLETED, List.of());

            assertThrows(IllegalStateException.class, () -> h.operator.cancelStep(wf, "A", null));
            assertThrows(IllegalArgumentException.class, () -> h.operator.cancelStep(wf, "Z", null));
        }
    }

    @Nested
    @DisplayName("rerunGate")
    class RerunTests {

        @Test
        @DisplayName("a relaxed contract lets a failed step pass on its stored output")
        void passesAfterContractChange() {
            h.worker("developer", r -> WorkerResponse.completed(
                    "{\"summary\": \"Implemented the requested change with tests\"}"));
            h.worker("qa", r -> WorkerResponse.completed(EngineHarness.GOOD_OUTPUT));
            WorkflowOutcome failed = h.engine.start("add export", List.of(), blueprint());
            assertEquals(OutcomeStatus.FAILED, failed.status());
            String wf = failed.workflowId();

            OutputSchema work = h.schemas.require(PlanBlueprint.WORK_SCHEMA);
            h.schemas.register(work.withAutofix(true));
            GateRecord record = h.operator.rerunGate(wf, "A");

            assertTrue(record.passed());
            assertEquals(List.of("actions"), record.autofixedFields());
            assertEquals(StepStatus.COMPLETED, h.plans.loadPlan(wf).step("A").orElseThrow().status());
            assertTrue(h.registry.get(wf, "A-output.json").isPresent());

            assertEquals(OutcomeStatus.COMPLETED, h.engine.resume(wf).status());
        }

        @Test
        @DisplayName("only failed or blocked steps can be re-gated")
        void rejectsPending() {
            String wf = createPlan();

            assertThrows(IllegalStateException.class, () -> h.operator.rerunGate(wf, "A"));
        }
    }
}
