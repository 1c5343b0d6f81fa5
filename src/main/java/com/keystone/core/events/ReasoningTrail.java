package com.keystone.core.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Append-only record of every workflow event, one JSON line per event in {@code trail.jsonl}.
 * A handoff package references the trail instead of copying it.
 */
@Component
public class ReasoningTrail {

    private final JsonDocumentStore documents;
    private final WorkspaceLayout layout;

    public ReasoningTrail(EventBus eventBus, JsonDocumentStore documents, WorkspaceLayout layout) {
        this.documents = documents;
        this.layout = layout;
        eventBus.subscribeAll(this::append);
    }

    void append(KeystoneEvent event) {
        if (event.workflowId() == null) return;
        documents.appendLine(layout.trailFile(event.workflowId()), event);
    }

    public List<JsonNode> read(String workflowId) {
        return documents.readLines(layout.trailFile(workflowId));
    }
}
