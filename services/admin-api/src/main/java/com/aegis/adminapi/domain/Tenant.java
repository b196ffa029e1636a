package com.aegis.adminapi.domain;

import java.time.Instant;
import java.util.UUID;

/**
 * A customer organisation. Tenants are global (not tenant-scoped themselves) and are never
 * hard-deleted; deleting one deactivates it.
 *
 * @param id        UUID
 * @param name      display name, unique ignoring case
 * @param domain    subdomain used for tenant lookup, unique ignoring case, may be null
 * @param active    inactive tenants keep their data but accept no new users
 * @param createdAt creation time
 * @param updatedAt last modification time
 */
public record Tenant(
        String id,
        String name,
        String domain,
        boolean active,
        Instant createdAt,
        Instant updatedAt) {

    public static Tenant create(String name, String domain, boolean active, Instant now) {
        return new Tenant(UUID.randomUUID().toString(), name, domain, active, now, now);
    }

    public Tenant rename(String name, String domain, Instant now) {
        return new Tenant(id, name, domain, active, createdAt, now);
    }

    public Tenant withActive(boolean active, Instant now) {
        return new Tenant(id, name, domain, active, createdAt, now);
    }
}
