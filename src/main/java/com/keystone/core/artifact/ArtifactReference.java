package com.keystone.core.artifact;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A step's declared input: an artifact name, optionally pinned to the step that produces it.
 * <p>
 * Textual forms accepted by {@link #parse(String)}:
 * <pre>
 * design.json
 * design.json (from step STEP-002)
 * design.json (from step STEP-002, optional)
 * design.json (optional, from step STEP-002)
 * </pre>
 *
 * @param name     artifact name
 * @param fromStep producing step, or null when unpinned
 * @param optional true when the consumer can run without the artifact
 */
public record ArtifactReference(String name, String fromStep, boolean optional) {

    private static final Pattern FROM_STEP =
            Pattern.compile("^(.+?)\\s*\\(from step\\s+([^,()\\s]+)\\s*(,\\s*optional)?\\)$");
    private static final Pattern OPTIONAL_FIRST =
            Pattern.compile("^(.+?)\\s*\\(optional,\\s*from step\\s+([^,()\\s]+)\\s*\\)$");

    public static ArtifactReference parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Artifact reference must not be blank");
        }
        String trimmed = text.trim();
        Matcher m = FROM_STEP.matcher(trimmed);
        if (m.matches()) {
            return new ArtifactReference(m.group(1).trim(), m.group(2), m.group(3) != null);
        }
        m = OPTIONAL_FIRST.matcher(trimmed);
        if (m.matches()) {
            return new ArtifactReference(m.group(1).trim(), m.group(2), true);
        }
        if (trimmed.contains("(")) {
            throw new IllegalArgumentException("Malformed artifact reference: '" + text
                    + "'; expected 'name (from step X)' or 'name (from step X, optional)'");
        }
        return new ArtifactReference(trimmed, null, false);
    }

    @Override
    public String toString() {
        if (fromStep == null) {
            return name;
        }
        return name + " (from step " + fromStep + (optional ? ", optional)" : ")");
    }
}
