package com.aegis.security;

/**
 * Enforces that a principal only acts inside its own tenant.
 */
public final class TenantIsolationEnforcer {

    private TenantIsolationEnforcer() {
        // utility class
    }

    /**
     * Verifies that the principal's tenant matches the request's tenant.
     *
     * @param principal the authenticated principal
     * @param tenant    the tenant resolved for the request
     * @throws TenantMismatchException if the tenants do not match
     */
    public static void enforce(Principal principal, TenantContext tenant) {
        String principalTenantId = principal.tenantId();
        if (principalTenantId == null || !principalTenantId.equals(tenant.tenantId())) {
            throw new TenantMismatchException(principalTenantId, tenant.tenantId());
        }
    }

    /**
     * Verifies that a row read from storage belongs to the given tenant.
     *
     * @return true if the row's tenant id equals the context's
     */
    public static boolean belongsTo(TenantOwned<?> row, TenantContext tenant) {
        return row != null && tenant.tenantId().equals(row.tenantId());
    }
}
