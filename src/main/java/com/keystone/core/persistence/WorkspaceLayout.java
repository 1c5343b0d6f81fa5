package com.keystone.core.persistence;

import com.keystone.config.KeystoneProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Directory layout of the durable workspace:
 * <pre>
 * workflows/&lt;id&gt;/plan/index.json
 *                 plan/phase-NN.json
 *                 gates/&lt;step&gt;/attempt-N.json
 *                 outputs/&lt;step&gt;/attempt-N.json
 *                 artifacts/registry/&lt;name&gt;.json
 *                 artifacts/content/&lt;name&gt;/vN.dat, vN.meta.json
 *                 artifacts/snapshots/snapshot-&lt;millis&gt;.json
 *                 conflicts/&lt;conflictId&gt;.json
 *                 handoff/handoff-N.json
 *                 cancel/&lt;step&gt;.json
 *                 trail.jsonl
 * </pre>
 */
@Component
public class WorkspaceLayout {

    private final Path root;

    @Autowired
    public WorkspaceLayout(KeystoneProperties properties) {
        this(properties.getWorkspacePath());
    }

    public WorkspaceLayout(Path root) {
        this.root = root.toAbsolutePath().normalize();
    }

    public Path root() { return root; }
    public Path workflowsDir() { return root.resolve("workflows"); }
    public Path workflowDir(String workflowId) { return workflowsDir().resolve(safe(workflowId)); }

    public Path planDir(String workflowId) { return workflowDir(workflowId).resolve("plan"); }
    public Path planIndex(String workflowId) { return planDir(workflowId).resolve("index.json"); }
    public Path phaseFile(String workflowId, int ordinal) {
        return planDir(workflowId).resolve("phase-%02d.json".formatted(ordinal));
    }

    public Path gatesDir(String workflowId, String stepId) {
        return workflowDir(workflowId).resolve("gates").resolve(safe(stepId));
    }
    public Path gateAttempt(String workflowId, String stepId, int attempt) {
        return gatesDir(workflowId, stepId).resolve("attempt-" + attempt + ".json");
    }
    public Path outputAttempt(String workflowId, String stepId, int attempt) {
        return workflowDir(workflowId).resolve("outputs").resolve(safe(stepId)).resolve("attempt-" + attempt + ".json");
    }

    public Path artifactsDir(String workflowId) { return workflowDir(workflowId).resolve("artifacts"); }
    public Path registryDir(String workflowId) { return artifactsDir(workflowId).resolve("registry"); }
    public Path registryRecord(String workflowId, String artifactName) {
        return registryDir(workflowId).resolve(safe(artifactName) + ".json");
    }
    public Path contentRoot(String workflowId) { return artifactsDir(workflowId).resolve("content"); }
    public Path contentDir(String workflowId, String artifactName) {
        return contentRoot(workflowId).resolve(safe(artifactName));
    }
    public Path snapshotsDir(String workflowId) { return artifactsDir(workflowId).resolve("snapshots"); }

    public Path conflictsDir(String workflowId) { return workflowDir(workflowId).resolve("conflicts"); }
    public Path conflictFile(String workflowId, String conflictId) {
        return conflictsDir(workflowId).resolve(safe(conflictId) + ".json");
    }

    public Path handoffDir(String workflowId) { return workflowDir(workflowId).resolve("handoff"); }
    public Path handoffFile(String workflowId, int generation) {
        return handoffDir(workflowId).resolve("handoff-" + generation + ".json");
    }

    public Path trailFile(String workflowId) { return workflowDir(workflowId).resolve("trail.jsonl"); }

    public Path cancelMarker(String workflowId, String stepId) {
        return workflowDir(workflowId).resolve("cancel").resolve(safe(stepId) + ".json");
    }

    /** Workspace-relative form of {@code path}, with forward slashes, for references in documents. */
    public String relativize(Path path) {
        return root.relativize(path.toAbsolutePath().normalize()).toString().replace('\\', '/');
    }

    public Path resolve(String relative) {
        return root.resolve(relative).normalize();
    }

    /** Maps a name to a single safe path segment. */
    public static String safe(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Name must not be blank");
        }
        String cleaned = name.replaceAll("[^A-Za-z0-9._@-]", "_");
        if (cleaned.equals(".") || cleaned.equals("..")) {
            throw new IllegalArgumentException("Invalid name: " + name);
        }
        return cleaned;
    }
}
