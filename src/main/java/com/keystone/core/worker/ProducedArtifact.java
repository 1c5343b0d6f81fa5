package com.keystone.core.worker;

import java.util.List;

/**
 * An artifact a worker produced alongside its output.
 *
 * @param name         artifact name
 * @param content      artifact content
 * @param dependencies names of input artifacts it was derived from
 */
public record ProducedArtifact(String name, String content, List<String> dependencies) {

    public ProducedArtifact {
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }
}
