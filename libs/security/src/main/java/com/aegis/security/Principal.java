package com.aegis.security;

/**
 * The authenticated actor of a request.
 * <p>
 * Lives exactly as long as the request it was decoded from. The {@code tenantId} is the
 * tenant the principal was authenticated against; the route guard rejects requests whose
 * resolved tenant differs from it.
 *
 * @param id       unique user identifier
 * @param role     the principal's platform role
 * @param tenantId tenant the principal belongs to
 */
public record Principal(String id, Role role, String tenantId) {

    public Principal {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("principal id must not be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("principal role must not be null");
        }
    }
}
