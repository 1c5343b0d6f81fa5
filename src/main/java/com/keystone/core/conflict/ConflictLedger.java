package com.keystone.core.conflict;

import com.fasterxml.jackson.core.type.TypeReference;
import com.keystone.core.model.ConflictRecord;
import com.keystone.core.model.ConflictStatus;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persisted conflict records and the candidate contents they were detected on.
 */
@Component
public class ConflictLedger {

    private static final String CANDIDATES_SUFFIX = ".candidates.json";

    private final JsonDocumentStore documents;
    private final WorkspaceLayout layout;

    public ConflictLedger(JsonDocumentStore documents, WorkspaceLayout layout) {
        this.documents = documents;
        this.layout = layout;
    }

    public void save(ConflictRecord record) {
        documents.write(layout.conflictFile(record.workflowId(), record.conflictId()), record);
    }

    public void saveCandidates(String workflowId, String conflictId, Map<String, String> candidates) {
        documents.writeNew(candidatesFile(workflowId, conflictId), candidates);
    }

    public Map<String, String> candidates(String workflowId, String conflictId) {
        return documents.read(candidatesFile(workflowId, conflictId), new TypeReference<Map<String, String>>() {})
                .orElse(Map.of());
    }

    public Optional<ConflictRecord> find(String workflowId, String conflictId) {
        return documents.read(layout.conflictFile(workflowId, conflictId), ConflictRecord.class);
    }

    public List<ConflictRecord> list(String workflowId) {
        return documents.list(layout.conflictsDir(workflowId), ".json").stream()
                .filter(p -> !p.getFileName().toString().endsWith(CANDIDATES_SUFFIX))
                .map(p -> documents.read(p, ConflictRecord.class).orElseThrow())
                .sorted(Comparator.comparing(ConflictRecord::detectedAt))
                .toList();
    }

    public List<ConflictRecord> escalated(String workflowId) {
        return list(workflowId).stream().filter(r -> r.status() == ConflictStatus.ESCALATED).toList();
    }

    private Path candidatesFile(String workflowId, String conflictId) {
        return layout.conflictsDir(workflowId).resolve(WorkspaceLayout.safe(conflictId) + CANDIDATES_SUFFIX);
    }
}
