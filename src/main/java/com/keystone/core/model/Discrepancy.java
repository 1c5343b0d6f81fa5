package com.keystone.core.model;

import java.io.Serializable;

/**
 * A mismatch between the artifact registry and its backing store.
 */
public record Discrepancy(
    DiscrepancyType type,
    String artifactName,
    int version,
    String detail
) implements Serializable {}
