package com.aegis.security;

/**
 * Thrown when a tenant-aware operation targets a tenant that is deactivated or unknown.
 */
public class TenantInactiveException extends RuntimeException {

    private final String operationId;
    private final String tenantId;

    public TenantInactiveException(String operationId, String tenantId) {
        super("Tenant '%s' is not active for operation '%s'".formatted(tenantId, operationId));
        this.operationId = operationId;
        this.tenantId = tenantId;
    }

    public String operationId() {
        return operationId;
    }

    public String tenantId() {
        return tenantId;
    }
}
