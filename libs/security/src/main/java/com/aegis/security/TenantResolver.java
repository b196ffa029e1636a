package com.aegis.security;

import java.util.Optional;

/**
 * Extracts the active tenant from a request context.
 *
 * <p>Upstream middleware stashes the tenant id under {@link #TENANT_CONTEXT_KEY}. Resolution
 * reads nothing else and has no side effects; in particular it never falls back to a default
 * tenant.
 */
public final class TenantResolver {

    /** Well-known context attribute holding the tenant id. */
    public static final String TENANT_CONTEXT_KEY = "tenantId";

    /**
     * Resolves the tenant for an operation.
     *
     * @param context      the request
     * @param operationId  the operation being invoked, for error reporting
     * @param tenantExempt whether the operation may run without a tenant
     * @return the tenant, or empty when absent and the operation is exempt
     * @throws TenantContextMissingException when absent and the operation is not exempt
     */
    public Optional<TenantContext> resolve(
            RequestContext context, String operationId, boolean tenantExempt) {
        Optional<TenantContext> tenant = context.attribute(TENANT_CONTEXT_KEY)
                .map(Object::toString)
                .filter(id -> !id.isBlank())
                .map(TenantContext::of);
        if (tenant.isEmpty() && !tenantExempt) {
            throw new TenantContextMissingException(operationId);
        }
        return tenant;
    }

    /**
     * Resolves the tenant of a tenant-aware call.
     *
     * @throws TenantContextMissingException when the context carries no tenant
     */
    public TenantContext require(RequestContext context, String operationId) {
        return resolve(context, operationId, false)
                .orElseThrow(() -> new TenantContextMissingException(operationId));
    }
}
