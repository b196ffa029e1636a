package com.aegis.adminapi.infrastructure.web;

/**
 * The tenant id supplied with a request is not a UUID.
 */
public class InvalidTenantIdException extends RuntimeException {

    public InvalidTenantIdException(String tenantId) {
        super("Invalid tenant id format: '%s'".formatted(tenantId));
    }
}
