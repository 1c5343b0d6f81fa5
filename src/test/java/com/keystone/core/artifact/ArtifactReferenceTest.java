package com.keystone.core.artifact;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactReferenceTest {

    @Test
    @DisplayName("parses plain, pinned and optional references")
    void parses() {
        assertEquals(new ArtifactReference("design.json", null, false), ArtifactReference.parse("design.json"));
        assertEquals(new ArtifactReference("design.json", "STEP-002", false),
                ArtifactReference.parse("design.json (from step STEP-002)"));
        assertEquals(new ArtifactReference("design.json", "STEP-002", true),
                ArtifactReference.parse("design.json (from step STEP-002, optional)"));
        assertEquals(new ArtifactReference("design.json", "STEP-002", true),
                ArtifactReference.parse("design.json (optional, from step STEP-002)"));
    }

    @Test
    @DisplayName("toString renders the canonical form")
    void canonical() {
        assertEquals("design.json (from step STEP-002, optional)",
                ArtifactReference.parse("design.json (optional, from step STEP-002)").toString());
    }

    @Test
    @DisplayName("rejects blank and malformed references")
    void rejects() {
        assertThrows(IllegalArgumentException.class, () -> ArtifactReference.parse(" "));
        assertThrows(IllegalArgumentException.class, () -> ArtifactReference.parse("design.json (from STEP-002)"));
    }
}
