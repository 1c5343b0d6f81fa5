package com.keystone.core.artifact;

import com.keystone.core.model.ValidationStatus;
import com.keystone.core.persistence.JsonDocumentStore;
import com.keystone.core.persistence.WorkspaceLayout;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Backing store of artifact content: one immutable {@code vN.dat} per version plus a
 * {@code vN.meta.json} sidecar carrying enough metadata to rebuild the registry record.
 */
@Component
public class ArtifactContentStore {

    private static final Pattern DATA_FILE = Pattern.compile("v(\\d+)\\.dat");

    /**
     * Sidecar metadata for one stored version.
     */
    public record ContentMeta(String name, int version, String producingStep, String contentHash,
                              SortedSet<String> dependencies, ValidationStatus validationStatus,
                              Instant createdAt) {}

    private final JsonDocumentStore documents;
    private final WorkspaceLayout layout;

    public ArtifactContentStore(JsonDocumentStore documents, WorkspaceLayout layout) {
        this.documents = documents;
        this.layout = layout;
    }

    /**
     * Writes a new version's content, then its sidecar.
     *
     * @return the content handle, relative to the content root
     */
    public String write(String workflowId, ContentMeta meta, String content) {
        Path data = dataFile(workflowId, meta.name(), meta.version());
        if (!documents.writeNewText(data, content)) {
            throw new ArtifactRejectedException("Content for " + meta.name() + " v" + meta.version()
                    + " already stored; versions are immutable");
        }
        documents.write(metaFile(workflowId, meta.name(), meta.version()), meta);
        return handle(workflowId, meta.name(), meta.version());
    }

    public void updateMeta(String workflowId, ContentMeta meta) {
        documents.write(metaFile(workflowId, meta.name(), meta.version()), meta);
    }

    public Optional<String> read(String workflowId, String handle) {
        return documents.readText(layout.contentRoot(workflowId).resolve(handle).normalize());
    }

    public boolean exists(String workflowId, String handle) {
        return Files.isRegularFile(layout.contentRoot(workflowId).resolve(handle).normalize());
    }

    public Optional<ContentMeta> readMeta(String workflowId, String name, int version) {
        return documents.read(metaFile(workflowId, name, version), ContentMeta.class);
    }

    /** Stored version numbers for an artifact name, ascending. */
    public List<Integer> versions(String workflowId, String name) {
        return versionsIn(layout.contentDir(workflowId, name));
    }

    /** Content directories, one per stored artifact name. */
    public List<Path> contentDirectories(String workflowId) {
        return documents.listDirectories(layout.contentRoot(workflowId));
    }

    public List<Integer> versionsIn(Path contentDir) {
        return documents.list(contentDir, ".dat").stream()
                .map(p -> DATA_FILE.matcher(p.getFileName().toString()))
                .filter(Matcher::matches)
                .map(m -> Integer.parseInt(m.group(1)))
                .sorted(Comparator.naturalOrder())
                .toList();
    }

    public Optional<ContentMeta> readMeta(Path contentDir, int version) {
        return documents.read(contentDir.resolve("v" + version + ".meta.json"), ContentMeta.class);
    }

    public String handle(String workflowId, String name, int version) {
        return layout.contentRoot(workflowId).relativize(dataFile(workflowId, name, version))
                .toString().replace('\\', '/');
    }

    public static String hash(String content) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(content.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private Path dataFile(String workflowId, String name, int version) {
        return layout.contentDir(workflowId, name).resolve("v" + version + ".dat");
    }

    private Path metaFile(String workflowId, String name, int version) {
        return layout.contentDir(workflowId, name).resolve("v" + version + ".meta.json");
    }
}
