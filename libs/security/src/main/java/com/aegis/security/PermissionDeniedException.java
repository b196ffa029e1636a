package com.aegis.security;

/**
 * Thrown when the principal is authenticated but a permission descriptor denies the operation.
 * <p>
 * Carries the failing descriptor's resource and action for audit logging.
 */
public class PermissionDeniedException extends RuntimeException {

    private final String operationId;
    private final String resource;
    private final String action;
    private final String reason;

    public PermissionDeniedException(
            String operationId, String resource, String action, String reason) {
        super("Permission denied for operation '%s': %s on %s (%s)"
                .formatted(operationId, action, resource, reason));
        this.operationId = operationId;
        this.resource = resource;
        this.action = action;
        this.reason = reason;
    }

    public String operationId() {
        return operationId;
    }

    public String resource() {
        return resource;
    }

    public String action() {
        return action;
    }

    public String reason() {
        return reason;
    }
}
