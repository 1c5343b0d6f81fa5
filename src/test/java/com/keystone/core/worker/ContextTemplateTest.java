package com.keystone.core.worker;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextTemplateTest {

    @Test
    @DisplayName("replaces known variables and keeps unknown ones")
    void render() {
        String out = ContextTemplate.render("Step {{ step_id }} as {{role}} for {{owner}}",
                Map.of("step_id", "STEP-001", "role", "developer"));

        assertEquals("Step STEP-001 as developer for {{owner}}", out);
        assertEquals(List.of("owner"), ContextTemplate.unresolved(out));
    }

    @Test
    @DisplayName("values containing regex characters are inserted literally")
    void literalValues() {
        assertEquals("cost $5 \\ ok", ContextTemplate.render("cost {{v}}", Map.of("v", "$5 \\ ok")));
    }

    @Test
    @DisplayName("an unclosed variable is rejected")
    void unclosed() {
        assertThrows(IllegalArgumentException.class,
                () -> ContextTemplate.render("Step {{step_id", Map.of("step_id", "x")));
        assertThrows(IllegalArgumentException.class,
                () -> ContextTemplate.render("{{a {{b}}", Map.of()));
    }

    @Test
    @DisplayName("the default template resolves fully with the standard variables")
    void defaultTemplate() {
        var vars = Map.of("workflow_id", "WF-1", "step_id", "STEP-001", "role", "qa",
                "task_type", "TESTING", "complexity", "SIMPLE", "task", "cover export", "files", "none");

        assertTrue(ContextTemplate.unresolved(ContextTemplate.render(ContextTemplate.DEFAULT, vars)).isEmpty());
    }
}
