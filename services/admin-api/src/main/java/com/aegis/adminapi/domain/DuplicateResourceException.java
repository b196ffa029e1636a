package com.aegis.adminapi.domain;

/**
 * A unique attribute (tenant name or domain, user email) is already taken.
 */
public class DuplicateResourceException extends RuntimeException {

    private final String resourceType;
    private final String field;

    public DuplicateResourceException(String resourceType, String field, String value) {
        super("%s with %s '%s' already exists".formatted(resourceType, field, value));
        this.resourceType = resourceType;
        this.field = field;
    }

    public String resourceType() {
        return resourceType;
    }

    public String field() {
        return field;
    }
}
