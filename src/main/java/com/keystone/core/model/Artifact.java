package com.keystone.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Registry record for the latest version of a named artifact.
 *
 * @param name             artifact name, unique within a workflow
 * @param producingStep    step that produced this version
 * @param createdAt        when this version was registered
 * @param handle           path of the stored content, relative to the content store root
 * @param validationStatus gate outcome for this version; never PENDING once registered
 * @param version          1-based version number
 * @param dependencies     names of artifacts this one was derived from
 * @param contentHash      SHA-256 of the stored content
 */
public record Artifact(
    String name,
    String producingStep,
    Instant createdAt,
    String handle,
    ValidationStatus validationStatus,
    int version,
    SortedSet<String> dependencies,
    String contentHash
) implements Serializable {

    public Artifact {
        dependencies = dependencies == null
                ? Collections.unmodifiableSortedSet(new TreeSet<>())
                : Collections.unmodifiableSortedSet(new TreeSet<>(dependencies));
    }

    public String artifactId() {
        return idOf(name, version);
    }

    public Artifact withValidationStatus(ValidationStatus status) {
        return new Artifact(name, producingStep, createdAt, handle, status, version, dependencies, contentHash);
    }

    public static String idOf(String name, int version) {
        return name + "@v" + version;
    }
}
