package com.aegis.security;

import java.util.List;
import java.util.Optional;

/**
 * Persistence port for tenant-owned entities.
 *
 * <p>Every operation takes the tenant id explicitly and implementations must include it as an
 * equality predicate ({@code tenant_id = :tenantId}) in every statement. Callers go through
 * {@link TenantScopedRepositoryGate} rather than using this port directly.
 *
 * @param <T> the entity type
 */
public interface TenantScopedRepository<T extends TenantOwned<T>> {

    /** Resource type name used in not-found errors, e.g. {@code "user"}. */
    String resourceType();

    Optional<T> findById(String tenantId, String id);

    List<T> findAll(String tenantId, int offset, int limit);

    long count(String tenantId);

    /** Inserts an entity whose tenant id has already been set. */
    T insert(T entity);

    /**
     * Updates the row matching both the entity id and the tenant id.
     *
     * @return the updated entity, or empty if no row matched
     */
    Optional<T> update(String tenantId, T entity);

    /** @return true if a row matching both ids was deleted */
    boolean delete(String tenantId, String id);
}
