package com.keystone.core.artifact;

import com.keystone.core.model.ValidationStatus;

import java.util.List;

/**
 * Request to register an artifact version.
 *
 * @param workflowId       owning workflow
 * @param name             artifact name
 * @param producingStep    step that produced the content
 * @param content          artifact content
 * @param validationStatus gate outcome; PENDING is refused
 * @param dependencies     names of artifacts the content was derived from
 */
public record ArtifactSubmission(
    String workflowId,
    String name,
    String producingStep,
    String content,
    ValidationStatus validationStatus,
    List<String> dependencies
) {

    public ArtifactSubmission {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
        content = content == null ? "" : content;
    }
}
