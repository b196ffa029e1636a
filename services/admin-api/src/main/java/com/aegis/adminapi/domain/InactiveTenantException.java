package com.aegis.adminapi.domain;

/**
 * Users can only be created in an active tenant.
 */
public class InactiveTenantException extends RuntimeException {

    public InactiveTenantException(String tenantId) {
        super("Tenant '%s' is not active".formatted(tenantId));
    }
}
