package com.keystone.core.gate;

import com.keystone.core.model.GateRecord;
import com.keystone.core.model.GateVerdict;
import com.keystone.core.model.SchemaCheck;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import com.keystone.core.plan.PlanBlueprint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class GateValidatorTest {

    private static final String WF = "WF-gate0001";
    private static final String GOOD = """
            {"summary": "Implemented the CSV export endpoint with paging",
             "actions": ["added ExportController", "added paging test"]}
            """;

    @TempDir
    Path workspace;

    private GateLedger ledger;
    private JsonDocumentStore documents;
    private OutputSchema workSchema;

    @BeforeEach
    void setUp() {
        documents = new JsonDocumentStore();
        ledger = new GateLedger(documents, new WorkspaceLayout(workspace));
        workSchema = new SchemaCatalog().require(PlanBlueprint.WORK_SCHEMA);
    }

    private GateValidator validator(QualityAssessor assessor) {
        return new GateValidator(ledger, assessor, documents.mapper(), 3, QualityRubric.standard());
    }

    private static QualityAssessor uniform(double score) {
        var scores = new EnumMap<Criterion, Double>(Criterion.class);
        for (Criterion c : Criterion.values()) scores.put(c, score);
        QualityAssessor assessor = mock(QualityAssessor.class);
        when(assessor.assess(any(), any())).thenReturn(new QualityAssessor.Assessment(scores, List.of("meh")));
        return assessor;
    }

    @Nested
    @DisplayName("Structural check")
    class SchemaTests {

        @Test
        @DisplayName("well-formed output passes with a full score")
        void passes() {
            GateRecord record = validator(new HeuristicQualityAssessor())
                    .validate(WF, "STEP-001", "developer", GOOD, workSchema, QualityRubric.standard());

            assertEquals(SchemaCheck.PASS, record.schemaCheck());
            assertEquals(GateVerdict.PASS, record.verdict());
            assertEquals(10.0, record.qualityScore(), 0.001);
            assertEquals(1, record.attempt());
            assertNull(record.previousAttempt());
        }

        @Test
        @DisplayName("missing required field fails with score zero")
        void missingField() {
            GateRecord record = validator(new HeuristicQualityAssessor())
                    .validate(WF, "STEP-001", "developer", "{\"summary\": \"x\"}", workSchema, QualityRubric.standard());

            assertEquals(SchemaCheck.FAIL, record.schemaCheck());
            assertEquals(GateVerdict.FAIL, record.verdict());
            assertEquals(0.0, record.qualityScore());
            assertTrue(record.errors().contains("missing required field 'actions'"));
        }

        @Test
        @DisplayName("non-JSON and wrongly typed outputs fail")
        void malformed() {
            var gate = validator(new HeuristicQualityAssessor());

            GateRecord prose = gate.validate(WF, "STEP-001", "developer", "I did it!", workSchema, QualityRubric.standard());
            GateRecord typed = gate.validate(WF, "STEP-001", "developer",
                    "{\"summary\": \"ok\", \"actions\": \"one\"}", workSchema, QualityRubric.standard());

            assertTrue(prose.errors().get(0).startsWith("output is not valid JSON"));
            assertTrue(typed.errors().get(0).contains("must be ARRAY"));
            assertEquals(2, typed.previousAttempt());
        }

        @Test
        @DisplayName("autofix fills missing containers and reports them")
        void autofix() {
            GateRecord record = validator(new HeuristicQualityAssessor()).validate(WF, "STEP-001", "developer",
                    "{\"summary\": \"Implemented the export with paging support\"}",
                    workSchema.withAutofix(true), QualityRubric.standard());

            assertEquals(SchemaCheck.PASS, record.schemaCheck());
            assertEquals(List.of("actions"), record.autofixedFields());
            assertEquals(7.15, record.qualityScore(), 0.001);
        }
    }

    @Nested
    @DisplayName("Verdict bands")
    class VerdictTests {

        @Test
        @DisplayName("score between warn and pass thresholds passes with warnings")
        void warnBand() {
            GateRecord record = validator(uniform(5.0))
                    .validate(WF, "STEP-002", "developer", GOOD, workSchema, QualityRubric.standard());

            assertEquals(GateVerdict.PASS_WITH_WARNINGS, record.verdict());
            assertTrue(record.passed());
            assertEquals(List.of("meh"), record.warnings());
        }

        @Test
        @DisplayName("score below the warn threshold fails")
        void failBand() {
            GateRecord record = validator(uniform(2.0))
                    .validate(WF, "STEP-002", "developer", GOOD, workSchema, QualityRubric.standard());

            assertEquals(GateVerdict.FAIL, record.verdict());
            assertEquals(SchemaCheck.PASS, record.schemaCheck());
            assertTrue(record.errors().get(0).startsWith("quality score 2.00"));
        }

        @Test
        @DisplayName("explicit quality scores in the output are honored")
        void explicitScores() {
            String output = """
                    {"summary": "Implemented the CSV export endpoint", "actions": ["a"],
                     "quality": {"completeness": 0, "accuracy": 0, "clarity": 0, "consistency": 0, "actionability": 0}}
                    """;
            GateRecord record = validator(new HeuristicQualityAssessor())
                    .validate(WF, "STEP-002", "developer", output, workSchema, QualityRubric.standard());

            assertEquals(GateVerdict.FAIL, record.verdict());
        }

        @Test
        @DisplayName("rubric weights change the score")
        void weights() {
            var rubric = new QualityRubric(Map.of(Criterion.ACCURACY, 100.0, Criterion.COMPLETENESS, 0.0,
                    Criterion.CLARITY, 0.0, Criterion.CONSISTENCY, 0.0, Criterion.ACTIONABILITY, 0.0), 7.0, 4.0);

            assertEquals(9.0, rubric.score(Map.of(Criterion.ACCURACY, 9.0)), 0.001);
            assertThrows(IllegalArgumentException.class, () -> new QualityRubric(Map.of(), 4.0, 7.0));
        }
    }

    @Nested
    @DisplayName("Retry budget")
    class RetryTests {

        @Test
        @DisplayName("a role gets at most three attempts per step")
        void bounded() {
            var gate = validator(new HeuristicQualityAssessor());
            for (int i = 0; i < 3; i++) {
                gate.validate(WF, "STEP-003", "developer", "{}", workSchema, QualityRubric.standard());
            }

            assertEquals(0, gate.attemptsRemaining(WF, "STEP-003", "developer"));
            assertThrows(RetryBudgetExhaustedException.class,
                    () -> gate.validate(WF, "STEP-003", "developer", GOOD, workSchema, QualityRubric.standard()));
            assertEquals(3, ledger.history(WF, "STEP-003").size());
        }

        @Test
        @DisplayName("a fallback role starts with a fresh budget and continues the attempt numbering")
        void fallbackRole() {
            var gate = validator(new HeuristicQualityAssessor());
            for (int i = 0; i < 3; i++) {
                gate.validate(WF, "STEP-003", "developer", "{}", workSchema, QualityRubric.standard());
            }

            GateRecord record = gate.validate(WF, "STEP-003", "architect", GOOD, workSchema, QualityRubric.standard());

            assertEquals(4, record.attempt());
            assertEquals(3, record.previousAttempt());
            assertEquals(0, record.retryCount());
            assertEquals(2, gate.attemptsRemaining(WF, "STEP-003", "architect"));
        }

        @Test
        @DisplayName("revalidation re-reads the stored output and ignores the budget")
        void revalidate() {
            var gate = validator(new HeuristicQualityAssessor());
            String output = "{\"summary\": \"Implemented the export with paging support\"}";
            for (int i = 0; i < 3; i++) {
                gate.validate(WF, "STEP-004", "developer", output, workSchema, QualityRubric.standard());
            }

            GateRecord rerun = gate.revalidate(WF, "STEP-004", workSchema.withAutofix(true), QualityRubric.standard());

            assertTrue(rerun.passed());
            assertEquals(4, rerun.attempt());
            assertEquals("developer", rerun.role());
            assertEquals(3, rerun.retryCount());
            assertEquals(output, ledger.readOutput(WF, rerun.outputRef()).orElseThrow());
        }

        @Test
        @DisplayName("an attempt the worker reported failed fails the gate and consumes budget despite good output")
        void workerReportedFailure() {
            var gate = validator(new HeuristicQualityAssessor());

            GateRecord record = gate.rejectFailedAttempt(WF, "STEP-005", "developer", GOOD, "tests did not compile");

            assertFalse(record.passed());
            assertEquals(SchemaCheck.FAIL, record.schemaCheck());
            assertEquals(0.0, record.qualityScore(), 0.001);
            assertEquals(List.of(GateValidator.WORKER_FAILED + ": tests did not compile"), record.errors());
            assertEquals(2, gate.attemptsRemaining(WF, "STEP-005", "developer"));
            assertEquals(GOOD, ledger.readOutput(WF, record.outputRef()).orElseThrow());
            assertThrows(IllegalStateException.class,
                    () -> gate.revalidate(WF, "STEP-005", workSchema, QualityRubric.standard()));
        }

        @Test
        @DisplayName("revalidation without any attempt is rejected")
        void revalidateNothing() {
            assertThrows(IllegalStateException.class, () -> validator(new HeuristicQualityAssessor())
                    .revalidate(WF, "STEP-009", workSchema, QualityRubric.standard()));
        }
    }

    @Nested
    @DisplayName("Ledger")
    class LedgerTests {

        @Test
        @DisplayName("records are append-only")
        void appendOnly() {
            GateRecord record = validator(new HeuristicQualityAssessor())
                    .validate(WF, "STEP-005", "qa", GOOD, workSchema, QualityRubric.standard());

            assertThrows(IllegalStateException.class, () -> ledger.append(record));
            assertEquals(record.attempt(), ledger.latest(WF, "STEP-005").orElseThrow().attempt());
            assertEquals(1, ledger.attemptsBy(WF, "STEP-005", "qa"));
            assertEquals(0, ledger.attemptsBy(WF, "STEP-005", "developer"));
        }
    }
}
