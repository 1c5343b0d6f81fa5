package com.keystone.core.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReasoningTrailTest {

    @TempDir
    Path workspace;

    @Test
    void appendsEveryWorkflowEventAsOneLine() {
        var bus = new EventBus();
        var layout = new WorkspaceLayout(workspace);
        var trail = new ReasoningTrail(bus, new JsonDocumentStore(), layout);

        bus.publish(KeystoneEvent.of("workflow.created", "WF-1", null, Map.of("taskId", "TASK-1")));
        bus.publish(KeystoneEvent.of("step.completed", "WF-1", "STEP-001", Map.of("role", "developer")));
        bus.publish(KeystoneEvent.of("workflow.created", "WF-2", null, Map.of()));

        List<JsonNode> lines = trail.read("WF-1");
        assertEquals(2, lines.size());
        assertEquals("workflow.created", lines.get(0).path("eventType").asText());
        assertEquals("TASK-1", lines.get(0).path("payload").path("taskId").asText());
        assertEquals("STEP-001", lines.get(1).path("stepId").asText());
        assertTrue(Files.exists(layout.trailFile("WF-2")));
    }

    @Test
    void ignoresEventsWithoutWorkflowAndReadsMissingTrailAsEmpty() {
        var bus = new EventBus();
        var trail = new ReasoningTrail(bus, new JsonDocumentStore(), new WorkspaceLayout(workspace));

        bus.publish(KeystoneEvent.of("system.started", null, null, Map.of()));

        assertTrue(trail.read("WF-none").isEmpty());
    }
}
