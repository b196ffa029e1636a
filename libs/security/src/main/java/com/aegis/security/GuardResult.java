package com.aegis.security;

import java.util.Optional;

/**
 * Outcome of {@link RouteGuard#evaluate}.
 *
 * @param operationId      the guarded operation
 * @param state            terminal state, {@link GuardState#ALLOWED} or {@link GuardState#DENIED}
 * @param decision         the deciding decision; for an allow, the last one evaluated
 * @param tenant           resolved tenant, {@code null} for tenant-exempt calls without one
 * @param deniedBy         descriptor that denied, {@code null} when allowed
 * @param deniedResource   resource the denying descriptor was evaluated against
 */
public record GuardResult(
        String operationId,
        GuardState state,
        AuthorizationDecision decision,
        TenantContext tenant,
        PermissionDescriptor deniedBy,
        ResourceRef deniedResource) {

    public GuardResult {
        if (state == null || !state.isTerminal()) {
            throw new IllegalArgumentException("guard result must be in a terminal state");
        }
    }

    static GuardResult allowed(
            String operationId, AuthorizationDecision decision, TenantContext tenant) {
        return new GuardResult(operationId, GuardState.ALLOWED, decision, tenant, null, null);
    }

    static GuardResult denied(
            String operationId,
            AuthorizationDecision decision,
            TenantContext tenant,
            PermissionDescriptor deniedBy,
            ResourceRef deniedResource) {
        return new GuardResult(
                operationId, GuardState.DENIED, decision, tenant, deniedBy, deniedResource);
    }

    public boolean allowed() {
        return state == GuardState.ALLOWED;
    }

    public Optional<TenantContext> findTenant() {
        return Optional.ofNullable(tenant);
    }
}
