package com.keystone.core.model;

import java.io.Serializable;

/**
 * Resource consumption snapshot carried in a handoff package.
 *
 * @param instanceTokens   tokens consumed by the handing-off instance
 * @param cumulativeTokens tokens consumed by every instance of the workflow so far
 * @param ceilingTokens    per-instance budget ceiling
 * @param utilization      instanceTokens / ceilingTokens
 */
public record ResourceUsage(
    long instanceTokens,
    long cumulativeTokens,
    long ceilingTokens,
    double utilization
) implements Serializable {

    public static final ResourceUsage NONE = new ResourceUsage(0, 0, 0, 0.0);
}
