package com.aegis.security;

/**
 * An entity partitioned by tenant.
 *
 * @param <T> the entity type itself
 */
public interface TenantOwned<T extends TenantOwned<T>> {

    /** Primary key. */
    String id();

    /** Owning tenant. Never null once persisted. */
    String tenantId();

    /** A copy of this entity owned by the given tenant. */
    T withTenantId(String tenantId);
}
