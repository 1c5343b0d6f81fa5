package com.keystone.core.roles;

import java.util.EnumSet;
import java.util.Set;

import static com.keystone.core.roles.Capability.*;

/**
 * Built-in role catalog. Declaration order is the capability lookup order, so the first
 * role declaring a capability is the one routing selects for it.
 */
public enum StandardRole implements WorkerRole {
    PLANNER("planner", Domain.PRODUCT, PLANNING),
    IMPACT_ANALYST("impact-analyst", Domain.TECHNICAL, IMPACT_ANALYSIS),
    DEVELOPER("developer", Domain.TECHNICAL, IMPLEMENTATION),
    ARCHITECT("architect", Domain.TECHNICAL, ARCHITECTURE_DESIGN, TECHNICAL_AUTHORITY),
    CODE_REVIEWER("code-reviewer", Domain.TECHNICAL, CODE_REVIEW),
    QA("qa", Domain.QUALITY, QUALITY_ASSURANCE, TESTING),
    TECHNICAL_WRITER("technical-writer", Domain.PRODUCT, DOCUMENTATION),
    PM("pm", Domain.PRODUCT, SPECIFICATION, PRODUCT_AUTHORITY),
    ANALYST("analyst", Domain.PRODUCT, REQUIREMENTS),
    UX_DESIGNER("ux-designer", Domain.PRODUCT, UX_DESIGN),
    DEVOPS("devops", Domain.TECHNICAL, INFRASTRUCTURE),
    RESEARCHER("researcher", Domain.PRODUCT, RESEARCH),
    SECURITY_ARCHITECT("security-architect", Domain.SECURITY, SECURITY_REVIEW),
    ACCESSIBILITY_EXPERT("accessibility-expert", Domain.PRODUCT, ACCESSIBILITY_REVIEW),
    COMPLIANCE_AUDITOR("compliance-auditor", Domain.SECURITY, COMPLIANCE_REVIEW),
    PERFORMANCE_ENGINEER("performance-engineer", Domain.TECHNICAL, PERFORMANCE_REVIEW),
    DATABASE_ARCHITECT("database-architect", Domain.TECHNICAL, DATA_MODELING);

    private final String roleName;
    private final Domain domain;
    private final Set<Capability> capabilities;

    StandardRole(String roleName, Domain domain, Capability first, Capability... rest) {
        this.roleName = roleName;
        this.domain = domain;
        this.capabilities = Set.copyOf(EnumSet.of(first, rest));
    }

    @Override
    public String roleName() {
        return roleName;
    }

    @Override
    public Set<Capability> capabilities() {
        return capabilities;
    }

    @Override
    public Domain domain() {
        return domain;
    }
}
