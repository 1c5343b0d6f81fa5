package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Append-only record of validating one step output attempt.
 *
 * @param workflowId       workflow the step belongs to
 * @param stepId           step whose output was validated
 * @param role             role that produced the output
 * @param attempt          1-based attempt number across all roles for this step
 * @param previousAttempt  attempt number this record supersedes, or null for the first
 * @param retryCount       earlier attempts by the same role
 * @param schemaCheck      structural check outcome
 * @param qualityScore     weighted rubric score in [0, 10]; 0 when the schema check failed
 * @param verdict          overall outcome
 * @param errors           structural or quality errors
 * @param warnings         non-blocking findings
 * @param autofixedFields  required fields filled with empty defaults by schema autofix
 * @param outputRef        path of the stored raw output, relative to the workflow directory
 * @param validatedAt      when the record was written
 */
public record GateRecord(
    String workflowId,
    String stepId,
    String role,
    int attempt,
    Integer previousAttempt,
    int retryCount,
    SchemaCheck schemaCheck,
    double qualityScore,
    GateVerdict verdict,
    List<String> errors,
    List<String> warnings,
    List<String> autofixedFields,
    String outputRef,
    Instant validatedAt
) implements Serializable {

    public GateRecord {
        errors = errors == null ? List.of() : List.copyOf(errors);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        autofixedFields = autofixedFields == null ? List.of() : List.copyOf(autofixedFields);
    }

    public boolean passed() {
        return verdict.passed();
    }
}
