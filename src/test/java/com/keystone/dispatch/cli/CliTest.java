package com.keystone.dispatch.cli;

import com.keystone.config.KeystoneProperties;
import com.keystone.core.artifact.ArtifactRegistry;
import com.keystone.core.classifier.TaskClassifier;
import com.keystone.core.conflict.ConflictResolver;
import com.keystone.core.engine.OperatorActions;
import com.keystone.core.engine.WorkflowEngine;
import com.keystone.core.gate.GateLedger;
import com.keystone.core.model.Discrepancy;
import com.keystone.core.model.DiscrepancyType;
import com.keystone.core.model.IssueKind;
import com.keystone.core.model.OrchestrationIssue;
import com.keystone.core.model.OutcomeStatus;
import com.keystone.core.model.Phase;
import com.keystone.core.model.Plan;
import com.keystone.core.model.PlanStatus;
import com.keystone.core.model.Step;
import com.keystone.core.model.StepStatus;
import com.keystone.core.model.WorkflowOutcome;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.plan.PlanNotFoundException;
import com.keystone.core.plan.PlanStore;
import com.keystone.core.roles.RoleCatalog;
import com.keystone.core.routing.AgentRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Exercises the picocli command tree without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private WorkflowEngine engine;
    private PlanStore planStore;
    private OperatorActions operator;
    private ArtifactRegistry registry;
    private ConflictResolver conflicts;
    private GateLedger gateLedger;

    @BeforeEach
    void setUp() {
        engine = mock(WorkflowEngine.class);
        planStore = mock(PlanStore.class);
        operator = mock(OperatorActions.class);
        registry = mock(ArtifactRegistry.class);
        conflicts = mock(ConflictResolver.class);
        gateLedger = mock(GateLedger.class);
    }

    private CommandLine.IFactory factory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == RunCommand.class) return (K) new RunCommand(engine, new JsonDocumentStore());
                if (cls == ResumeCommand.class) return (K) new ResumeCommand(engine);
                if (cls == ClassifyCommand.class) {
                    return (K) new ClassifyCommand(new TaskClassifier(new KeystoneProperties()),
                            new AgentRouter(new RoleCatalog()));
                }
                if (cls == StatusCommand.class) return (K) new StatusCommand(planStore);
                if (cls == GateCommand.class) return (K) new GateCommand(gateLedger, operator);
                if (cls == ConflictsCommand.class) return (K) new ConflictsCommand(conflicts);
                if (cls == ResolveCommand.class) return (K) new ResolveCommand(operator);
                if (cls == VerifyCommand.class) return (K) new VerifyCommand(registry);
                if (cls == CancelCommand.class) return (K) new CancelCommand(operator);
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        var capture = new ByteArrayOutputStream();
        var stream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(stream);
        System.setErr(stream);
        try {
            int exitCode = CliRunner.commandLine(new KeystoneCommand(), factory()).execute(args);
            stream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static WorkflowOutcome outcome(OutcomeStatus status, OrchestrationIssue... issues) {
        var plan = new Plan("WF-1", null, PlanStatus.ACTIVE, List.of(), Instant.now(), Instant.now());
        return new WorkflowOutcome("WF-1", status, plan, List.of(issues), null, 1);
    }

    @Nested
    @DisplayName("help")
    class HelpTests {

        @Test
        @DisplayName("top-level help lists every subcommand")
        void listsSubcommands() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            for (String sub : List.of("run", "resume", "classify", "status", "gate", "conflicts", "resolve",
                    "verify", "cancel")) {
                assertTrue(result.output().contains(sub), "missing " + sub);
            }
        }

        @Test
        @DisplayName("a missing required parameter is a usage error")
        void missingParameter() {
            assertEquals(CommandLine.ExitCode.USAGE, execute("run").exitCode());
        }
    }

    @Nested
    @DisplayName("run and resume")
    class RunTests {

        @Test
        @DisplayName("exit code follows the outcome status")
        void exitCodes() {
            when(engine.start(eq("Add export"), anyList(), isNull())).thenReturn(outcome(OutcomeStatus.COMPLETED));
            when(engine.resume("WF-1")).thenReturn(outcome(OutcomeStatus.HANDOFF_TRIGGERED));

            assertEquals(ExitCodes.OK, execute("run", "Add export", "-f", "src/Export.java").exitCode());
            verify(engine).start("Add export", List.of("src/Export.java"), null);
            CliResult resumed = execute("resume", "WF-1");
            assertEquals(ExitCodes.HANDOFF, resumed.exitCode());
            assertTrue(resumed.output().contains("keystone resume WF-1"));
        }

        @Test
        @DisplayName("blocked outcomes print their issues")
        void blocked() {
            var issue = OrchestrationIssue.of(IssueKind.CONFLICT_UNRESOLVED, "WF-1", null,
                    "conflict CONF-001 on 'config.yaml' needs operator review", Map.of());
            when(engine.resume("WF-1")).thenReturn(outcome(OutcomeStatus.BLOCKED, issue));

            CliResult result = execute("resume", "WF-1");

            assertEquals(ExitCodes.BLOCKED, result.exitCode());
            assertTrue(result.output().contains("CONFLICT_UNRESOLVED"));
        }

        @Test
        @DisplayName("a run that exhausts the gate exits as a validation failure, not a fatal error")
        void gateExhausted() {
            var failedStep = Step.pending("STEP-001", "developer", List.of(), "work-output")
                    .withStatus(StepStatus.FAILED, List.of(), "no fallback left after [developer, architect]");
            var plan = new Plan("WF-1", null, PlanStatus.FAILED,
                    List.of(new Phase("PHASE-1", "work", 1, List.of(failedStep))), Instant.now(), Instant.now());
            var issue = OrchestrationIssue.of(IssueKind.GATE_VALIDATION_FAILED, "WF-1", "STEP-001",
                    "attempt 6 by architect failed the gate", Map.of());
            when(engine.resume("WF-1")).thenReturn(
                    new WorkflowOutcome("WF-1", OutcomeStatus.FAILED, plan, List.of(issue), null, 1));

            assertEquals(ExitCodes.INVALID, execute("resume", "WF-1").exitCode());
        }

        @Test
        @DisplayName("a missing blueprint file is invalid input")
        void missingBlueprint() {
            assertEquals(ExitCodes.INVALID, execute("run", "x", "--blueprint", "/nonexistent/plan.json").exitCode());
        }
    }

    @Nested
    @DisplayName("operator commands")
    class OperatorTests {

        @Test
        @DisplayName("status of an unknown workflow is invalid input")
        void unknownWorkflow() {
            when(planStore.loadPlan("WF-X")).thenThrow(new PlanNotFoundException("WF-X"));

            assertEquals(ExitCodes.INVALID, execute("status", "WF-X").exitCode());
        }

        @Test
        @DisplayName("cancelling a running step reports the deferred stop")
        void cancelRunning() {
            when(operator.cancelStep("WF-1", "STEP-002", "obsolete")).thenReturn(StepStatus.IN_PROGRESS);

            CliResult result = execute("cancel", "WF-1", "STEP-002", "--reason", "obsolete");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("before its next attempt"));
        }

        @Test
        @DisplayName("cancelling a finished step is invalid input")
        void cancelFinished() {
            when(operator.cancelStep(any(), any(), any())).thenThrow(new IllegalStateException("already COMPLETED"));

            assertEquals(ExitCodes.INVALID, execute("cancel", "WF-1", "STEP-001").exitCode());
        }

        @Test
        @DisplayName("verify fails when discrepancies were repaired")
        void verify() {
            when(registry.verifyIntegrity("WF-1")).thenReturn(List.of(
                    new Discrepancy(DiscrepancyType.MISSING_CONTENT, "design.md", 2, "content missing")));

            CliResult result = execute("verify", "WF-1");

            assertEquals(ExitCodes.FAILED, result.exitCode());
            assertTrue(result.output().contains("design.md@v2"));
        }

        @Test
        @DisplayName("conflicts with nothing recorded")
        void noConflicts() {
            when(conflicts.list("WF-1")).thenReturn(List.of());

            CliResult result = execute("conflicts", "WF-1");

            assertEquals(ExitCodes.OK, result.exitCode());
            assertTrue(result.output().contains("No conflicts"));
        }
    }

    @Test
    @DisplayName("classify is a dry run that prints the chain")
    void classify() {
        CliResult result = execute("classify", "Fix the null pointer crash in the login handler");

        assertEquals(ExitCodes.OK, result.exitCode());
        assertTrue(result.output().contains("Primary:"));
        verify(engine, never()).start(any(), any(), any());
    }
}
