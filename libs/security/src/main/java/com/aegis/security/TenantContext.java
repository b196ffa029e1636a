package com.aegis.security;

/**
 * Tenant context for multi-tenant isolation.
 *
 * <p>Immutable value object created by {@link TenantResolver} at the start of a request and passed
 * explicitly to every tenant-scoped call. There is no ambient "current tenant".
 *
 * @param tenantId unique tenant identifier
 */
public record TenantContext(String tenantId) {

    public TenantContext {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId must not be null or blank");
        }
    }

    public static TenantContext of(String tenantId) {
        return new TenantContext(tenantId);
    }
}
