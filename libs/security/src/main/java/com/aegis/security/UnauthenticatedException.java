package com.aegis.security;

/**
 * Thrown when a protected operation is invoked without an authenticated principal.
 * Always fatal to the request.
 */
public class UnauthenticatedException extends RuntimeException {

    private final String operationId;

    public UnauthenticatedException(String operationId) {
        super("Authentication required for operation '%s'".formatted(operationId));
        this.operationId = operationId;
    }

    public String operationId() {
        return operationId;
    }
}
