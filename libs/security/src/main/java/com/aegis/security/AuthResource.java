package com.aegis.security;

/**
 * A single resource an authorization decision is made about.
 *
 * <p>The {@code type} (e.g. {@code "user"}, {@code "tenant"}) is what grant tables are keyed on.
 * The optional {@code id} identifies a concrete instance when the resource was extracted from the
 * request.
 *
 * @param type resource type, never blank for a well-formed resource
 * @param id   instance identifier, or {@code null} for the resource type as a whole
 */
public record AuthResource(String type, String id) {

    public static AuthResource of(String type) {
        return new AuthResource(type, null);
    }

    public static AuthResource of(String type, String id) {
        return new AuthResource(type, id);
    }

    /** Whether this resource can be evaluated at all. */
    public boolean isWellFormed() {
        return type != null && !type.isBlank();
    }

    @Override
    public String toString() {
        return id == null ? String.valueOf(type) : type + ":" + id;
    }
}
