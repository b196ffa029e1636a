package com.aegis.security;

/**
 * Tells the route guard whether a tenant is active.
 *
 * <p>Consulted for every tenant-aware operation once the tenant is resolved. Unknown tenants are
 * reported as inactive. Implementations are called concurrently.
 */
@FunctionalInterface
public interface TenantDirectory {

    boolean isActive(String tenantId);
}
