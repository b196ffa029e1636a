package com.aegis.security;

/**
 * A tenant-scoped lookup found nothing visible to the current tenant.
 * <p>
 * Also raised when the row exists but belongs to another tenant, so that existence is never
 * leaked across tenants.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super("%s '%s' not found".formatted(resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String resourceType() {
        return resourceType;
    }

    public String resourceId() {
        return resourceId;
    }
}
