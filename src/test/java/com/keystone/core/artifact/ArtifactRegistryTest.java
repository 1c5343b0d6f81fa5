package com.keystone.core.artifact;

import com.keystone.core.gate.GateLedger;
import com.keystone.core.model.Artifact;
import com.keystone.core.model.Discrepancy;
import com.keystone.core.model.DiscrepancyType;
import com.keystone.core.model.GateRecord;
import com.keystone.core.model.GateVerdict;
import com.keystone.core.model.SchemaCheck;
import com.keystone.core.model.ValidationStatus;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArtifactRegistryTest {

    private static final String WF = "WF-art00001";

    @TempDir
    Path workspace;

    private WorkspaceLayout layout;
    private GateLedger ledger;
    private ArtifactRegistry registry;

    @BeforeEach
    void setUp() {
        var documents = new JsonDocumentStore();
        layout = new WorkspaceLayout(workspace);
        ledger = new GateLedger(documents, layout);
        registry = new ArtifactRegistry(documents, layout, new ArtifactContentStore(documents, layout), ledger);
    }

    private Artifact register(String name, String step, String content, String... deps) {
        return registry.register(new ArtifactSubmission(WF, name, step, content, ValidationStatus.PASS, List.of(deps)));
    }

    private void gate(String step, SchemaCheck check) {
        ledger.append(new GateRecord(WF, step, "developer", ledger.history(WF, step).size() + 1, null, 0, check,
                check == SchemaCheck.PASS ? 9.0 : 0.0, check == SchemaCheck.PASS ? GateVerdict.PASS : GateVerdict.FAIL,
                List.of(), List.of(), List.of(), "outputs/" + step + "/attempt-1.json", Instant.now()));
    }

    private Path dataFile(String name, int version) {
        return layout.contentDir(WF, name).resolve("v" + version + ".dat");
    }

    @Nested
    @DisplayName("register")
    class RegisterTests {

        @Test
        @DisplayName("identical content from the same step is idempotent")
        void idempotent() {
            Artifact first = register("design.md", "STEP-001", "# Design");
            Artifact again = register("design.md", "STEP-001", "# Design");

            assertEquals(first.artifactId(), again.artifactId());
            assertEquals("design.md@v1", again.artifactId());
            assertEquals(List.of(1), new ArtifactContentStore(new JsonDocumentStore(), layout).versions(WF, "design.md"));
        }

        @Test
        @DisplayName("new content creates the next version and keeps the old one")
        void versionBump() {
            register("design.md", "STEP-001", "# Design");
            Artifact second = register("design.md", "STEP-001", "# Design v2");

            assertEquals(2, second.version());
            assertEquals("# Design v2", registry.readContent(WF, second).orElseThrow());
            assertTrue(Files.isRegularFile(dataFile("design.md", 1)));
        }

        @Test
        @DisplayName("a changed validation status updates the record in place")
        void statusUpdate() {
            register("design.md", "STEP-001", "# Design");
            Artifact failed = registry.register(new ArtifactSubmission(WF, "design.md", "STEP-001", "# Design",
                    ValidationStatus.FAIL, List.of()));

            assertEquals(1, failed.version());
            assertEquals(ValidationStatus.FAIL, registry.get(WF, "design.md").orElseThrow().validationStatus());
        }

        @Test
        @DisplayName("pending submissions are refused")
        void pendingRefused() {
            assertThrows(ArtifactRejectedException.class, () -> registry.register(
                    new ArtifactSubmission(WF, "design.md", "STEP-001", "x", ValidationStatus.PENDING, List.of())));
            assertTrue(registry.list(WF).isEmpty());
        }
    }

    @Nested
    @DisplayName("requireConsumable")
    class ConsumableTests {

        @Test
        @DisplayName("unknown artifacts are not produced")
        void notProduced() {
            var e = assertThrows(MissingArtifactException.class, () -> registry.requireConsumable(WF, "api.yaml"));
            assertEquals(MissingArtifactException.Reason.NOT_PRODUCED, e.reason());
        }

        @Test
        @DisplayName("artifacts whose producer failed the schema check are not valid")
        void notValid() {
            register("api.yaml", "STEP-002", "openapi: 3.0.0");
            gate("STEP-002", SchemaCheck.FAIL);

            var e = assertThrows(MissingArtifactException.class, () -> registry.requireConsumable(WF, "api.yaml"));
            assertEquals(MissingArtifactException.Reason.NOT_VALID, e.reason());
        }

        @Test
        @DisplayName("passing artifacts are consumable, from the pinned step only")
        void consumable() {
            register("api.yaml", "STEP-002", "openapi: 3.0.0");
            gate("STEP-002", SchemaCheck.PASS);

            assertEquals("api.yaml@v1", registry.requireConsumable(WF, "api.yaml").artifactId());
            assertNotNull(registry.requireConsumable(WF, ArtifactReference.parse("api.yaml (from step STEP-002)")));
            assertThrows(MissingArtifactException.class,
                    () -> registry.requireConsumable(WF, ArtifactReference.parse("api.yaml (from step STEP-001)")));
        }
    }

    @Nested
    @DisplayName("verifyIntegrity")
    class IntegrityTests {

        @Test
        @DisplayName("a consistent registry reports nothing")
        void clean() {
            register("design.md", "STEP-001", "# Design");
            register("api.yaml", "STEP-002", "openapi: 3.0.0", "design.md");

            assertTrue(registry.verifyIntegrity(WF).isEmpty());
        }

        @Test
        @DisplayName("missing content rolls the record back to the last intact version")
        void missingContent() throws IOException {
            register("design.md", "STEP-001", "# Design");
            register("design.md", "STEP-001", "# Design v2");
            Files.delete(dataFile("design.md", 2));

            List<Discrepancy> found = registry.verifyIntegrity(WF);

            assertEquals(DiscrepancyType.MISSING_CONTENT, found.get(0).type());
            assertEquals(1, registry.get(WF, "design.md").orElseThrow().version());
            assertTrue(registry.verifyIntegrity(WF).isEmpty());
        }

        @Test
        @DisplayName("tampered content is marked FAIL")
        void tampered() throws IOException {
            register("design.md", "STEP-001", "# Design");
            Files.writeString(dataFile("design.md", 1), "# Something else");

            List<Discrepancy> found = registry.verifyIntegrity(WF);

            assertEquals(List.of(DiscrepancyType.CONTENT_MODIFIED), found.stream().map(Discrepancy::type).toList());
            assertEquals(ValidationStatus.FAIL, registry.get(WF, "design.md").orElseThrow().validationStatus());
        }

        @Test
        @DisplayName("content without a record is re-registered from its sidecar")
        void orphaned() throws IOException {
            register("design.md", "STEP-001", "# Design");
            Files.delete(layout.registryRecord(WF, "design.md"));

            List<Discrepancy> found = registry.verifyIntegrity(WF);

            assertEquals(DiscrepancyType.ORPHANED_CONTENT, found.get(0).type());
            Artifact rebuilt = registry.get(WF, "design.md").orElseThrow();
            assertEquals("STEP-001", rebuilt.producingStep());
            assertEquals(ValidationStatus.PASS, rebuilt.validationStatus());
        }

        @Test
        @DisplayName("dependencies on unregistered artifacts are reported")
        void unsatisfied() {
            register("api.yaml", "STEP-002", "openapi: 3.0.0", "design.md");

            List<Discrepancy> found = registry.verifyIntegrity(WF);

            assertEquals(DiscrepancyType.UNSATISFIED_DEPENDENCY, found.get(0).type());
            assertEquals("api.yaml", found.get(0).artifactName());
        }
    }

    @Nested
    @DisplayName("Snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("later versions still satisfy a snapshot, tampering does not")
        void compare() throws IOException {
            register("design.md", "STEP-001", "# Design");
            String ref = registry.snapshot(WF);
            RegistrySnapshot snapshot = registry.readSnapshot(ref).orElseThrow();

            register("design.md", "STEP-001", "# Design v2");
            assertTrue(registry.compareWithSnapshot(WF, snapshot).isEmpty());

            Files.writeString(dataFile("design.md", 1), "tampered");
            assertEquals(DiscrepancyType.CONTENT_MODIFIED,
                    registry.compareWithSnapshot(WF, snapshot).get(0).type());
        }

        @Test
        @DisplayName("two snapshots never overwrite each other")
        void distinctFiles() {
            register("design.md", "STEP-001", "# Design");

            assertNotEquals(registry.snapshot(WF), registry.snapshot(WF));
        }
    }
}
