package com.keystone.core.gate;

import com.keystone.core.model.GateRecord;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Append-only store of gate records and the raw outputs they validated.
 */
@Component
public class GateLedger {

    private final JsonDocumentStore documents;
    private final WorkspaceLayout layout;

    public GateLedger(JsonDocumentStore documents, WorkspaceLayout layout) {
        this.documents = documents;
        this.layout = layout;
    }

    public void append(GateRecord record) {
        Path target = layout.gateAttempt(record.workflowId(), record.stepId(), record.attempt());
        if (!documents.writeNew(target, record)) {
            throw new IllegalStateException("Gate record for " + record.stepId()
                    + " attempt " + record.attempt() + " already exists");
        }
    }

    /**
     * Stores the raw output of an attempt.
     *
     * @return the output reference, relative to the workflow directory
     */
    public String storeOutput(String workflowId, String stepId, int attempt, String rawOutput) {
        Path target = layout.outputAttempt(workflowId, stepId, attempt);
        documents.writeNewText(target, rawOutput == null ? "" : rawOutput);
        return layout.workflowDir(workflowId).relativize(target).toString().replace('\\', '/');
    }

    public Optional<String> readOutput(String workflowId, String outputRef) {
        return documents.readText(layout.workflowDir(workflowId).resolve(outputRef).normalize());
    }

    /** Every record for a step, ordered by attempt. */
    public List<GateRecord> history(String workflowId, String stepId) {
        return documents.list(layout.gatesDir(workflowId, stepId), ".json").stream()
                .map(p -> documents.read(p, GateRecord.class).orElseThrow())
                .sorted(Comparator.comparingInt(GateRecord::attempt))
                .toList();
    }

    public Optional<GateRecord> latest(String workflowId, String stepId) {
        var history = history(workflowId, stepId);
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    public int attemptsBy(String workflowId, String stepId, String role) {
        return (int) history(workflowId, stepId).stream().filter(r -> r.role().equals(role)).count();
    }
}
