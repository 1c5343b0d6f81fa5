package com.keystone.core.roles;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capability-set lookup over the known worker roles.
 */
@Component
public class RoleCatalog {

    private final Map<String, WorkerRole> rolesByName = new LinkedHashMap<>();

    public RoleCatalog() {
        this(List.of(StandardRole.values()));
    }

    public RoleCatalog(List<? extends WorkerRole> roles) {
        for (var role : roles) {
            rolesByName.putIfAbsent(role.roleName(), role);
        }
    }

    /**
     * Returns the first role, in catalog order, that declares the capability.
     *
     * @throws IllegalStateException if no role declares it; the catalog is static, so this is a
     *                               configuration error rather than a runtime condition
     */
    public WorkerRole resolve(Capability capability) {
        return rolesByName.values().stream()
                .filter(r -> r.can(capability))
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No role declares capability " + capability));
    }

    public Optional<WorkerRole> byName(String roleName) {
        return Optional.ofNullable(rolesByName.get(roleName));
    }

    public WorkerRole require(String roleName) {
        return byName(roleName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown role: " + roleName));
    }

    /**
     * Domain of the named role; unknown roles are treated as technical.
     */
    public Domain domainOf(String roleName) {
        return byName(roleName).map(WorkerRole::domain).orElse(Domain.TECHNICAL);
    }

    public List<WorkerRole> all() {
        return List.copyOf(rolesByName.values());
    }
}
