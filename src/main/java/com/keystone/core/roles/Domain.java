package com.keystone.core.roles;

/**
 * Area of authority a role belongs to. Conflicts confined to one domain are settled by
 * that domain's authority role.
 */
public enum Domain {
    TECHNICAL(Capability.TECHNICAL_AUTHORITY),
    PRODUCT(Capability.PRODUCT_AUTHORITY),
    SECURITY(Capability.SECURITY_REVIEW),
    QUALITY(Capability.QUALITY_ASSURANCE);

    private final Capability authority;

    Domain(Capability authority) {
        this.authority = authority;
    }

    /** Capability whose holder has the final say on conflicts inside this domain. */
    public Capability authority() {
        return authority;
    }
}
