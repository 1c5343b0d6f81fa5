package com.keystone.core.routing;

import com.keystone.core.classifier.KeywordMatcher;
import com.keystone.core.roles.Capability;

import java.util.List;

/**
 * Versioned trigger table for cross-cutting concerns. Each constant is one tagged variant:
 * the keywords that detect the concern and the capability whose role it injects. Keywords
 * match whole words (plural allowed); a trailing {@code *} marks a stem.
 * Bump {@link #TABLE_VERSION} whenever an entry changes so recorded chains stay auditable.
 */
public enum CrossCuttingTrigger {
    SECURITY(Capability.SECURITY_REVIEW, List.of(
            "security", "secure", "auth", "authenticat*", "authoriz*", "login", "password", "credential",
            "token", "encrypt*", "oauth", "jwt", "secret", "permission", "vulnerab*")),
    ACCESSIBILITY(Capability.ACCESSIBILITY_REVIEW, List.of(
            "accessib*", "a11y", "wcag", "screen reader", "aria", "keyboard navigation")),
    COMPLIANCE(Capability.COMPLIANCE_REVIEW, List.of(
            "compliance", "compliant", "gdpr", "hipaa", "pci", "sox", "audit*", "pii", "regulat*")),
    PERFORMANCE(Capability.PERFORMANCE_REVIEW, List.of(
            "performance", "latency", "throughput", "slow*", "optimiz*", "optimis*", "scalab*", "load test")),
    DATABASE(Capability.DATA_MODELING, List.of(
            "database", "schema", "migration", "sql", "db", "postgres*", "mysql", "query", "queries", "table"));

    /** Version 2: entries match whole words or explicit stems instead of substrings. */
    public static final int TABLE_VERSION = 2;

    private final Capability capability;
    private final List<String> keywords;

    CrossCuttingTrigger(Capability capability, List<String> keywords) {
        this.capability = capability;
        this.keywords = keywords;
    }

    public Capability capability() {
        return capability;
    }

    public List<String> keywords() {
        return keywords;
    }

    public List<String> matchedKeywords(String text) {
        return KeywordMatcher.matchesWords(text, keywords);
    }

    public boolean matches(String text) {
        return !matchedKeywords(text).isEmpty();
    }
}
