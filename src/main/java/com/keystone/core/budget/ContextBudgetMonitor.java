package com.keystone.core.budget;

import com.keystone.config.KeystoneProperties;
import com.keystone.core.model.ResourceUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks resource consumption of one orchestration instance against its ceiling.
 * One monitor per instance; a resumed instance starts a fresh monitor and carries the
 * cumulative total of its predecessors only for reporting.
 */
public class ContextBudgetMonitor {

    private static final Logger log = LoggerFactory.getLogger(ContextBudgetMonitor.class);

    private final long ceilingTokens;
    private final double warnThreshold;
    private final double handoffThreshold;
    private final long carriedTokens;
    private long instanceTokens;
    private boolean warned;

    public ContextBudgetMonitor(long ceilingTokens, double warnThreshold, double handoffThreshold, long carriedTokens) {
        if (ceilingTokens <= 0) {
            throw new IllegalArgumentException("ceilingTokens must be positive");
        }
        if (warnThreshold <= 0 || handoffThreshold > 1.0 || warnThreshold > handoffThreshold) {
            throw new IllegalArgumentException("Thresholds must satisfy 0 < warn <= handoff <= 1, got warn="
                    + warnThreshold + " handoff=" + handoffThreshold);
        }
        this.ceilingTokens = ceilingTokens;
        this.warnThreshold = warnThreshold;
        this.handoffThreshold = handoffThreshold;
        this.carriedTokens = carriedTokens;
    }

    public static ContextBudgetMonitor fromProperties(KeystoneProperties properties, long carriedTokens) {
        return new ContextBudgetMonitor(properties.getBudgetCeilingTokens(), properties.getBudgetWarnThreshold(),
                properties.getBudgetHandoffThreshold(), carriedTokens);
    }

    public synchronized void track(UsageDelta delta) {
        instanceTokens += delta.tokens();
        if (!warned && isWarning()) {
            warned = true;
            log.warn("Budget warning: {} of {} tokens used ({}%) after {}", instanceTokens, ceilingTokens,
                    Math.round(utilization() * 100), delta.source());
        }
        if (shouldHandoff()) {
            log.warn("Budget handoff threshold {} crossed ({} tokens)", handoffThreshold, instanceTokens);
        }
    }

    public synchronized double utilization() {
        return (double) instanceTokens / ceilingTokens;
    }

    /** Fraction of the ceiling still available, in [0, 1]. */
    public synchronized double remainingBudget() {
        return Math.max(0.0, 1.0 - utilization());
    }

    public synchronized boolean isWarning() {
        return utilization() >= warnThreshold;
    }

    public synchronized boolean shouldHandoff() {
        return utilization() >= handoffThreshold;
    }

    public synchronized ResourceUsage usage() {
        return new ResourceUsage(instanceTokens, carriedTokens + instanceTokens, ceilingTokens, utilization());
    }
}
