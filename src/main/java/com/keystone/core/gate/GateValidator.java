package com.keystone.core.gate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.keystone.config.KeystoneProperties;
import com.keystone.core.model.GateRecord;
import com.keystone.core.model.GateVerdict;
import com.keystone.core.model.SchemaCheck;
import com.keystone.core.persistence.JsonDocumentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Validates step outputs before anything downstream may consume them.
 * <p>
 * Validation is two-staged. The structural check parses the output as JSON and checks it
 * against the step's {@link OutputSchema}; any violation fails the attempt with score 0. A
 * structurally valid output is then scored against the {@link QualityRubric}. Every attempt,
 * pass or fail, is appended to the {@link GateLedger}.
 */
@Service
public class GateValidator {

    private static final Logger log = LoggerFactory.getLogger(GateValidator.class);

    /** Leading error of an attempt the worker itself reported as failed. */
    public static final String WORKER_FAILED = "worker reported failure";

    private final GateLedger ledger;
    private final QualityAssessor assessor;
    private final ObjectMapper mapper;
    private final int maxAttempts;
    private final QualityRubric defaultRubric;
    private final Map<String, Object> stepLocks = new ConcurrentHashMap<>();

    @Autowired
    public GateValidator(GateLedger ledger, QualityAssessor assessor, JsonDocumentStore documents,
                         KeystoneProperties properties) {
        this(ledger, assessor, documents.mapper(), properties.getMaxGateAttempts(),
                QualityRubric.from(properties.getGate()));
    }

    public GateValidator(GateLedger ledger, QualityAssessor assessor, ObjectMapper mapper,
                         int maxAttempts, QualityRubric defaultRubric) {
        this.ledger = ledger;
        this.assessor = assessor;
        this.mapper = mapper;
        this.maxAttempts = maxAttempts;
        this.defaultRubric = defaultRubric;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public QualityRubric defaultRubric() {
        return defaultRubric;
    }

    public int attemptsRemaining(String workflowId, String stepId, String role) {
        return Math.max(0, maxAttempts - ledger.attemptsBy(workflowId, stepId, role));
    }

    /**
     * Validates one attempt of a step's output.
     *
     * @throws RetryBudgetExhaustedException if the role has no attempts left for the step
     */
    public GateRecord validate(String workflowId, String stepId, String role, String output,
                               OutputSchema schema, QualityRubric rubric) {
        synchronized (lockFor(workflowId, stepId)) {
            int byRole = ledger.attemptsBy(workflowId, stepId, role);
            if (byRole >= maxAttempts) {
                throw new RetryBudgetExhaustedException(stepId, role, maxAttempts);
            }
            return evaluate(workflowId, stepId, role, output, schema, rubric, byRole);
        }
    }

    /**
     * Records an attempt the worker reported as failed. The output is stored but never assessed;
     * the attempt fails and counts against the role's retry budget.
     *
     * @throws RetryBudgetExhaustedException if the role has no attempts left for the step
     */
    public GateRecord rejectFailedAttempt(String workflowId, String stepId, String role, String output,
                                          String message) {
        synchronized (lockFor(workflowId, stepId)) {
            int byRole = ledger.attemptsBy(workflowId, stepId, role);
            if (byRole >= maxAttempts) {
                throw new RetryBudgetExhaustedException(stepId, role, maxAttempts);
            }
            int attempt = ledger.history(workflowId, stepId).size() + 1;
            String outputRef = ledger.storeOutput(workflowId, stepId, attempt, output != null ? output : "");
            String error = WORKER_FAILED + (message != null && !message.isBlank() ? ": " + message : "");
            var record = new GateRecord(workflowId, stepId, role, attempt, attempt > 1 ? attempt - 1 : null, byRole,
                    SchemaCheck.FAIL, 0.0, GateVerdict.FAIL, List.of(error), List.of(), List.of(), outputRef,
                    Instant.now());
            ledger.append(record);
            log.warn("Gate FAIL for {} [{}] attempt {}: {}", stepId, role, attempt, error);
            return record;
        }
    }

    /**
     * Re-runs the gate against the output stored with the step's latest attempt. Operator-forced,
     * so it is not bounded by the retry budget; it still appends a new record.
     */
    public GateRecord revalidate(String workflowId, String stepId, OutputSchema schema, QualityRubric rubric) {
        synchronized (lockFor(workflowId, stepId)) {
            GateRecord latest = ledger.latest(workflowId, stepId)
                    .orElseThrow(() -> new IllegalStateException("No gate attempt recorded for " + stepId));
            if (latest.errors().stream().anyMatch(e -> e.startsWith(WORKER_FAILED))) {
                throw new IllegalStateException("Latest attempt " + latest.attempt() + " of " + stepId
                        + " was reported failed by its worker; its output cannot be re-gated");
            }
            String output = ledger.readOutput(workflowId, latest.outputRef())
                    .orElseThrow(() -> new IllegalStateException("Stored output " + latest.outputRef() + " is missing"));
            log.info("Re-running gate for {} against attempt {}", stepId, latest.attempt());
            return evaluate(workflowId, stepId, latest.role(), output, schema, rubric,
                    ledger.attemptsBy(workflowId, stepId, latest.role()));
        }
    }

    private GateRecord evaluate(String workflowId, String stepId, String role, String output,
                                OutputSchema schema, QualityRubric rubric, int retryCount) {
        int attempt = ledger.history(workflowId, stepId).size() + 1;
        Integer previous = attempt > 1 ? attempt - 1 : null;
        String outputRef = ledger.storeOutput(workflowId, stepId, attempt, output);

        var errors = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        List<String> fixed = List.of();
        SchemaCheck schemaCheck;
        double score = 0.0;
        GateVerdict verdict;

        JsonNode parsed = parse(output, errors);
        OutputSchema.Result structural = parsed == null ? null : schema.check(parsed);
        if (structural == null || !structural.valid()) {
            if (structural != null) errors.addAll(structural.errors());
            schemaCheck = SchemaCheck.FAIL;
            verdict = GateVerdict.FAIL;
        } else {
            schemaCheck = SchemaCheck.PASS;
            fixed = structural.fixedFields();
            if (!fixed.isEmpty()) {
                warnings.add("autofixed fields " + fixed);
            }
            var assessment = assessor.assess(structural.output(), schema);
            score = rubric.score(assessment.scores());
            verdict = rubric.verdictFor(score);
            if (verdict == GateVerdict.FAIL) {
                errors.add("quality score %.2f below %.1f".formatted(score, rubric.warnThreshold()));
                errors.addAll(assessment.findings());
            } else {
                warnings.addAll(assessment.findings());
            }
        }

        var record = new GateRecord(workflowId, stepId, role, attempt, previous, retryCount,
                schemaCheck, score, verdict, errors, warnings, fixed, outputRef, Instant.now());
        ledger.append(record);

        switch (verdict) {
            case PASS -> log.info("Gate PASS for {} [{}] attempt {} (score {})", stepId, role, attempt, score);
            case PASS_WITH_WARNINGS -> log.warn("Gate PASS_WITH_WARNINGS for {} [{}] attempt {} (score {}): {}",
                    stepId, role, attempt, score, warnings);
            case FAIL -> log.warn("Gate FAIL for {} [{}] attempt {} (schema {}): {}",
                    stepId, role, attempt, schemaCheck, errors);
        }
        return record;
    }

    private JsonNode parse(String output, List<String> errors) {
        if (output == null || output.isBlank()) {
            errors.add("output is empty");
            return null;
        }
        try {
            return mapper.readTree(output);
        } catch (JsonProcessingException e) {
            errors.add("output is not valid JSON: " + e.getOriginalMessage());
            return null;
        }
    }

    private Object lockFor(String workflowId, String stepId) {
        return stepLocks.computeIfAbsent(workflowId + "/" + stepId, k -> new Object());
    }
}
