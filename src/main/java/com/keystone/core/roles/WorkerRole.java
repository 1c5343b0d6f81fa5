package com.keystone.core.roles;

import java.util.Set;

/**
 * A worker role with a declared capability set.
 */
public interface WorkerRole {

    /** Stable role name used in plans, gate records and worker registrations. */
    String roleName();

    Set<Capability> capabilities();

    Domain domain();

    default boolean can(Capability capability) {
        return capabilities().contains(capability);
    }
}
