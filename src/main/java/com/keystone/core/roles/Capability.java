package com.keystone.core.roles;

/**
 * Units of work a worker role declares it can perform. Routing selects roles by
 * capability, never by role name.
 */
public enum Capability {
    PLANNING,
    IMPACT_ANALYSIS,
    IMPLEMENTATION,
    ARCHITECTURE_DESIGN,
    TECHNICAL_AUTHORITY,
    CODE_REVIEW,
    QUALITY_ASSURANCE,
    TESTING,
    DOCUMENTATION,
    SPECIFICATION,
    REQUIREMENTS,
    PRODUCT_AUTHORITY,
    UX_DESIGN,
    INFRASTRUCTURE,
    RESEARCH,
    SECURITY_REVIEW,
    ACCESSIBILITY_REVIEW,
    COMPLIANCE_REVIEW,
    PERFORMANCE_REVIEW,
    DATA_MODELING
}
