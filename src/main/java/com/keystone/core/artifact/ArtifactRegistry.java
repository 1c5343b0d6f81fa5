package com.keystone.core.artifact;

import com.keystone.core.gate.GateLedger;
import com.keystone.core.model.Artifact;
import com.keystone.core.model.Discrepancy;
import com.keystone.core.model.DiscrepancyType;
import com.keystone.core.model.SchemaCheck;
import com.keystone.core.model.ValidationStatus;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable name-to-metadata registry of the artifacts a workflow produced; the source of truth
 * for artifact integrity.
 * <p>
 * Content is written to the {@link ArtifactContentStore} before the registry record, so the
 * registry can always be rebuilt from the store. Records are re-read from disk on every call.
 */
@Service
public class ArtifactRegistry {

    private static final Logger log = LoggerFactory.getLogger(ArtifactRegistry.class);

    private final JsonDocumentStore documents;
    private final WorkspaceLayout layout;
    private final ArtifactContentStore contentStore;
    private final GateLedger gateLedger;
    private final Map<String, Object> locks = new ConcurrentHashMap<>();

    public ArtifactRegistry(JsonDocumentStore documents, WorkspaceLayout layout,
                            ArtifactContentStore contentStore, GateLedger gateLedger) {
        this.documents = documents;
        this.layout = layout;
        this.contentStore = contentStore;
        this.gateLedger = gateLedger;
    }

    /**
     * Registers an artifact version.
     * <p>
     * Re-registering identical content from the same step returns the existing record (updating
     * only its validation status if that changed). Different content creates the next version.
     *
     * @throws ArtifactRejectedException if the submission is PENDING or incomplete
     */
    public Artifact register(ArtifactSubmission submission) {
        if (submission.validationStatus() == null || submission.validationStatus() == ValidationStatus.PENDING) {
            throw new ArtifactRejectedException("Artifact '" + submission.name()
                    + "' must be validated before registration");
        }
        if (submission.name() == null || submission.name().isBlank() || submission.producingStep() == null) {
            throw new ArtifactRejectedException("Artifact submission needs a name and a producing step");
        }
        String workflowId = submission.workflowId();
        synchronized (lockFor(workflowId)) {
            String hash = ArtifactContentStore.hash(submission.content());
            Optional<Artifact> current = get(workflowId, submission.name());

            if (current.isPresent() && current.get().contentHash().equals(hash)
                    && current.get().producingStep().equals(submission.producingStep())) {
                Artifact existing = current.get();
                if (existing.validationStatus() == submission.validationStatus()) {
                    log.debug("Artifact {} already registered; idempotent", existing.artifactId());
                    return existing;
                }
                Artifact updated = existing.withValidationStatus(submission.validationStatus());
                contentStore.updateMeta(workflowId, metaOf(updated));
                writeRecord(workflowId, updated);
                log.info("Artifact {} validation {} -> {}", updated.artifactId(),
                        existing.validationStatus(), updated.validationStatus());
                return updated;
            }

            int stored = contentStore.versions(workflowId, submission.name()).stream()
                    .max(Integer::compare).orElse(0);
            int version = Math.max(stored, current.map(Artifact::version).orElse(0)) + 1;
            var dependencies = new TreeSet<>(submission.dependencies());
            for (String dep : dependencies) {
                if (get(workflowId, dep).isEmpty()) {
                    log.warn("Artifact {} depends on unregistered artifact {}", submission.name(), dep);
                }
            }

            Instant now = Instant.now();
            var meta = new ArtifactContentStore.ContentMeta(submission.name(), version, submission.producingStep(),
                    hash, dependencies, submission.validationStatus(), now);
            String handle = contentStore.write(workflowId, meta, submission.content());
            var artifact = new Artifact(submission.name(), submission.producingStep(), now, handle,
                    submission.validationStatus(), version, dependencies, hash);
            writeRecord(workflowId, artifact);
            log.info("Registered {} from {} ({})", artifact.artifactId(), artifact.producingStep(),
                    artifact.validationStatus());
            return artifact;
        }
    }

    public Optional<Artifact> get(String workflowId, String name) {
        return documents.read(layout.registryRecord(workflowId, name), Artifact.class);
    }

    public List<Artifact> list(String workflowId) {
        return documents.list(layout.registryDir(workflowId), ".json").stream()
                .map(p -> documents.read(p, Artifact.class).orElseThrow())
                .sorted(Comparator.comparing(Artifact::name))
                .toList();
    }

    public Optional<String> readContent(String workflowId, Artifact artifact) {
        return contentStore.read(workflowId, artifact.handle());
    }

    /**
     * Returns the artifact if a downstream step may consume it: its status is PASS and the
     * producing step's latest gate record passed the structural check.
     *
     * @throws MissingArtifactException with NOT_PRODUCED or NOT_VALID otherwise
     */
    public Artifact requireConsumable(String workflowId, String name) {
        Artifact artifact = get(workflowId, name).orElseThrow(() ->
                new MissingArtifactException(name, MissingArtifactException.Reason.NOT_PRODUCED,
                        "no registry record in " + workflowId));
        if (artifact.validationStatus() != ValidationStatus.PASS) {
            throw new MissingArtifactException(name, MissingArtifactException.Reason.NOT_VALID,
                    artifact.artifactId() + " has status " + artifact.validationStatus());
        }
        var gate = gateLedger.latest(workflowId, artifact.producingStep());
        if (gate.isEmpty() || gate.get().schemaCheck() != SchemaCheck.PASS) {
            throw new MissingArtifactException(name, MissingArtifactException.Reason.NOT_VALID,
                    "latest gate of " + artifact.producingStep() + " did not pass the schema check");
        }
        return artifact;
    }

    public Artifact requireConsumable(String workflowId, ArtifactReference reference) {
        Artifact artifact = requireConsumable(workflowId, reference.name());
        if (reference.fromStep() != null && !reference.fromStep().equals(artifact.producingStep())) {
            throw new MissingArtifactException(reference.name(), MissingArtifactException.Reason.NOT_PRODUCED,
                    "expected from " + reference.fromStep() + " but " + artifact.artifactId()
                            + " came from " + artifact.producingStep());
        }
        return artifact;
    }

    /**
     * Reconciles registry records against the backing store and repairs the registry:
     * <ul>
     *   <li>missing content rolls the record back to the newest intact version, or drops it</li>
     *   <li>content newer than its record (or without one) is re-registered from its sidecar</li>
     *   <li>content whose hash no longer matches is marked FAIL</li>
     *   <li>dependencies on unknown artifacts are reported</li>
     * </ul>
     *
     * @return every discrepancy found, before repair
     */
    public List<Discrepancy> verifyIntegrity(String workflowId) {
        synchronized (lockFor(workflowId)) {
            var discrepancies = new ArrayList<Discrepancy>();
            Map<String, Artifact> records = new HashMap<>();
            for (Artifact a : list(workflowId)) {
                records.put(a.name(), a);
            }

            for (Artifact record : List.copyOf(records.values())) {
                Optional<String> content = contentStore.read(workflowId, record.handle());
                if (content.isEmpty()) {
                    discrepancies.add(new Discrepancy(DiscrepancyType.MISSING_CONTENT, record.name(),
                            record.version(), "no stored content at " + record.handle()));
                    rollBack(workflowId, record).ifPresentOrElse(
                            a -> records.put(a.name(), a),
                            () -> records.remove(record.name()));
                } else if (!ArtifactContentStore.hash(content.get()).equals(record.contentHash())) {
                    discrepancies.add(new Discrepancy(DiscrepancyType.CONTENT_MODIFIED, record.name(),
                            record.version(), "stored content hash differs from the recorded hash"));
                    Artifact failed = record.withValidationStatus(ValidationStatus.FAIL);
                    writeRecord(workflowId, failed);
                    contentStore.updateMeta(workflowId, metaOf(failed));
                    records.put(failed.name(), failed);
                }
            }

            for (Path dir : contentStore.contentDirectories(workflowId)) {
                List<Integer> versions = contentStore.versionsIn(dir);
                if (versions.isEmpty()) continue;
                int newest = versions.get(versions.size() - 1);
                var meta = contentStore.readMeta(dir, newest);
                if (meta.isEmpty()) {
                    log.warn("Content {}/v{} has no metadata sidecar; cannot rebuild", dir.getFileName(), newest);
                    continue;
                }
                Artifact record = records.get(meta.get().name());
                if (record == null || record.version() < newest) {
                    discrepancies.add(new Discrepancy(DiscrepancyType.ORPHANED_CONTENT, meta.get().name(), newest,
                            record == null ? "stored content has no registry record"
                                    : "registry record is at v" + record.version()));
                    Artifact rebuilt = fromMeta(workflowId, meta.get());
                    writeRecord(workflowId, rebuilt);
                    records.put(rebuilt.name(), rebuilt);
                }
            }

            for (Artifact record : records.values()) {
                for (String dep : record.dependencies()) {
                    if (!records.containsKey(dep)) {
                        discrepancies.add(new Discrepancy(DiscrepancyType.UNSATISFIED_DEPENDENCY, record.name(),
                                record.version(), "depends on unregistered artifact " + dep));
                    }
                }
            }

            for (Discrepancy d : discrepancies) {
                log.warn("Registry integrity mismatch in {}: {} {}@v{} - {}", workflowId, d.type(),
                        d.artifactName(), d.version(), d.detail());
            }
            return discrepancies;
        }
    }

    /**
     * Writes a snapshot of the current records.
     *
     * @return the snapshot path, relative to the workspace root
     */
    public String snapshot(String workflowId) {
        var snapshot = new RegistrySnapshot(workflowId, list(workflowId), Instant.now());
        Path dir = layout.snapshotsDir(workflowId);
        long stamp = snapshot.takenAt().toEpochMilli();
        Path target = dir.resolve("snapshot-" + stamp + ".json");
        for (int i = 1; !documents.writeNew(target, snapshot); i++) {
            target = dir.resolve("snapshot-" + stamp + "-" + i + ".json");
        }
        log.info("Snapshot of {} artifact record(s) written to {}", snapshot.artifacts().size(), target.getFileName());
        return layout.relativize(target);
    }

    public Optional<RegistrySnapshot> readSnapshot(String snapshotRef) {
        return documents.read(layout.resolve(snapshotRef), RegistrySnapshot.class);
    }

    /**
     * Compares the live registry with a snapshot: every artifact in the snapshot must still be
     * registered at the same or a later version, with unchanged content at the snapshot version.
     */
    public List<Discrepancy> compareWithSnapshot(String workflowId, RegistrySnapshot snapshot) {
        var discrepancies = new ArrayList<Discrepancy>();
        for (Artifact expected : snapshot.artifacts()) {
            Optional<Artifact> live = get(workflowId, expected.name());
            if (live.isEmpty() || live.get().version() < expected.version()) {
                discrepancies.add(new Discrepancy(DiscrepancyType.MISSING_CONTENT, expected.name(),
                        expected.version(), "snapshot version no longer registered"));
                continue;
            }
            Optional<String> content = contentStore.read(workflowId, expected.handle());
            if (content.isEmpty()) {
                discrepancies.add(new Discrepancy(DiscrepancyType.MISSING_CONTENT, expected.name(),
                        expected.version(), "snapshot content missing"));
            } else if (!ArtifactContentStore.hash(content.get()).equals(expected.contentHash())) {
                discrepancies.add(new Discrepancy(DiscrepancyType.CONTENT_MODIFIED, expected.name(),
                        expected.version(), "content changed since the snapshot"));
            }
        }
        return discrepancies;
    }

    private Optional<Artifact> rollBack(String workflowId, Artifact record) {
        List<Integer> versions = contentStore.versions(workflowId, record.name());
        for (int i = versions.size() - 1; i >= 0; i--) {
            int version = versions.get(i);
            if (version >= record.version()) continue;
            var meta = contentStore.readMeta(workflowId, record.name(), version);
            if (meta.isPresent()) {
                Artifact previous = fromMeta(workflowId, meta.get());
                writeRecord(workflowId, previous);
                log.warn("Rolled {} back to {}", record.artifactId(), previous.artifactId());
                return Optional.of(previous);
            }
        }
        try {
            Files.deleteIfExists(layout.registryRecord(workflowId, record.name()));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to drop record of " + record.name(), e);
        }
        log.warn("Dropped {}: no intact stored version", record.artifactId());
        return Optional.empty();
    }

    private Artifact fromMeta(String workflowId, ArtifactContentStore.ContentMeta meta) {
        String handle = contentStore.handle(workflowId, meta.name(), meta.version());
        ValidationStatus status = contentStore.read(workflowId, handle)
                .map(ArtifactContentStore::hash)
                .filter(h -> h.equals(meta.contentHash()))
                .map(h -> meta.validationStatus())
                .orElse(ValidationStatus.FAIL);
        return new Artifact(meta.name(), meta.producingStep(), meta.createdAt(), handle, status,
                meta.version(), meta.dependencies(), meta.contentHash());
    }

    private static ArtifactContentStore.ContentMeta metaOf(Artifact artifact) {
        return new ArtifactContentStore.ContentMeta(artifact.name(), artifact.version(), artifact.producingStep(),
                artifact.contentHash(), artifact.dependencies(), artifact.validationStatus(), artifact.createdAt());
    }

    private void writeRecord(String workflowId, Artifact artifact) {
        documents.write(layout.registryRecord(workflowId, artifact.name()), artifact);
    }

    private Object lockFor(String workflowId) {
        return locks.computeIfAbsent(workflowId, k -> new Object());
    }
}
