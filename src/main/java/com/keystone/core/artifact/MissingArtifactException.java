package com.keystone.core.artifact;

/**
 * A step requested an artifact it cannot consume. Fatal for the requesting step.
 */
public class MissingArtifactException extends RuntimeException {

    public enum Reason {
        NOT_PRODUCED,  // no registry record (or not from the pinned step)
        NOT_VALID      // recorded, but its gate did not pass
    }

    private final String artifactName;
    private final Reason reason;

    public MissingArtifactException(String artifactName, Reason reason, String detail) {
        super("Artifact '" + artifactName + "' is " + reason + ": " + detail);
        this.artifactName = artifactName;
        this.reason = reason;
    }

    public String artifactName() {
        return artifactName;
    }

    public Reason reason() {
        return reason;
    }
}
