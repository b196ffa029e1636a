package com.aegis.security;

/**
 * Thrown when an operation requires a tenant context and the request carries none.
 * <p>
 * Surfaced as a client error. The core never substitutes a default tenant.
 */
public class TenantContextMissingException extends RuntimeException {

    private final String operationId;

    public TenantContextMissingException(String operationId) {
        super("Tenant context missing for operation '%s'".formatted(operationId));
        this.operationId = operationId;
    }

    public String operationId() {
        return operationId;
    }
}
