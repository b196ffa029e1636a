package com.aegis.security;

import java.util.Collection;

/**
 * Role-based checks with hierarchy support, used for operations that declare required roles.
 */
public final class RoleChecker {

    private RoleChecker() {
        // utility class
    }

    /**
     * Checks if the principal has the required role (directly or via hierarchy).
     * <p>
     * Example: a ROOT principal satisfies {@code hasRole(p, ADMIN)}.
     */
    public static boolean hasRole(Principal principal, Role required) {
        return principal.role().implies(required);
    }

    /**
     * Checks if the principal has ANY of the required roles. An empty requirement is satisfied.
     */
    public static boolean hasAnyRole(Principal principal, Collection<Role> required) {
        if (required.isEmpty()) {
            return true;
        }
        for (Role role : required) {
            if (hasRole(principal, role)) {
                return true;
            }
        }
        return false;
    }
}
