package com.aegis.security;

import java.util.List;
import java.util.Set;

/**
 * Everything the route guard needs to know about one operation.
 *
 * @param operationId   stable key, e.g. {@code "GET /api/v1/users/{id}"}
 * @param permissions   conjunctive permission descriptors (may be empty)
 * @param tenantExempt  whether the operation runs without a tenant context
 * @param requiredRoles roles of which the principal must imply at least one (may be empty)
 */
public record OperationPolicy(
        String operationId,
        List<PermissionDescriptor> permissions,
        boolean tenantExempt,
        Set<Role> requiredRoles) {

    public OperationPolicy {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
        requiredRoles = requiredRoles == null ? Set.of() : Set.copyOf(requiredRoles);
    }

    /** Tenant-aware operation without permission requirements. */
    public static OperationPolicy tenantScoped(String operationId) {
        return new OperationPolicy(operationId, List.of(), false, Set.of());
    }

    /** Whether a principal must be present. */
    public boolean requiresPrincipal() {
        return !permissions.isEmpty() || !requiredRoles.isEmpty();
    }
}
