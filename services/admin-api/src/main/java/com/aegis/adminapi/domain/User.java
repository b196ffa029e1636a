package com.aegis.adminapi.domain;

import com.aegis.security.Role;
import com.aegis.security.TenantOwned;
import java.time.Instant;
import java.util.UUID;

/**
 * A tenant member. Soft-deleted by clearing {@code active}.
 *
 * @param passwordHash BCrypt hash; never leaves the service
 */
public record User(
        String id,
        String tenantId,
        String email,
        String passwordHash,
        String fullName,
        Role role,
        boolean active,
        Instant createdAt,
        Instant updatedAt)
        implements TenantOwned<User> {

    public static User create(
            String email, String passwordHash, String fullName, Role role, Instant now) {
        return new User(UUID.randomUUID().toString(), null, email, passwordHash, fullName, role,
                true, now, now);
    }

    @Override
    public User withTenantId(String tenantId) {
        return new User(id, tenantId, email, passwordHash, fullName, role, active, createdAt,
                updatedAt);
    }

    public User withProfile(String fullName, Instant now) {
        return new User(id, tenantId, email, passwordHash, fullName, role, active, createdAt, now);
    }

    public User withRole(Role role, Instant now) {
        return new User(id, tenantId, email, passwordHash, fullName, role, active, createdAt, now);
    }

    public User withActive(boolean active, Instant now) {
        return new User(id, tenantId, email, passwordHash, fullName, role, active, createdAt, now);
    }
}
