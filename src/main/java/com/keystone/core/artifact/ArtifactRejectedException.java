package com.keystone.core.artifact;

public class ArtifactRejectedException extends RuntimeException {

    public ArtifactRejectedException(String message) {
        super(message);
    }
}
