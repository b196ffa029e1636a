package com.aegis.security;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a {@link TenantScopedRepository} so that every call is bound to an explicit {@link
 * TenantContext}.
 *
 * <ul>
 *   <li>reads, updates and deletes are filtered by {@code tenantId = context.tenantId()}
 *   <li>creates are stamped with the context's tenant id, whatever the payload carried
 *   <li>rows of another tenant are reported as not found, never as forbidden
 * </ul>
 *
 * <p>Rows the port returns with a foreign tenant id are dropped as not found and logged, since
 * they indicate a port that ignores its tenant predicate.
 *
 * @param <T> the entity type
 */
public final class TenantScopedRepositoryGate<T extends TenantOwned<T>> {

    private static final Logger log = LoggerFactory.getLogger(TenantScopedRepositoryGate.class);

    private final TenantScopedRepository<T> repository;

    public TenantScopedRepositoryGate(TenantScopedRepository<T> repository) {
        if (repository == null) {
            throw new IllegalArgumentException("repository must not be null");
        }
        this.repository = repository;
    }

    public Optional<T> findById(TenantContext tenant, String id) {
        if (id == null || id.isBlank()) {
            return Optional.empty();
        }
        return repository.findById(tenant.tenantId(), id).filter(row -> visible(row, tenant));
    }

    /**
     * @throws ResourceNotFoundException if no row with this id is visible to the tenant
     */
    public T getById(TenantContext tenant, String id) {
        return findById(tenant, id)
                .orElseThrow(() -> new ResourceNotFoundException(repository.resourceType(), id));
    }

    public List<T> findAll(TenantContext tenant, int offset, int limit) {
        if (offset < 0 || limit <= 0) {
            throw new IllegalArgumentException("offset must be >= 0 and limit > 0");
        }
        return repository.findAll(tenant.tenantId(), offset, limit).stream()
                .filter(row -> visible(row, tenant))
                .toList();
    }

    /**
     * Runs a port-specific query bound to the context's tenant. The query receives the tenant id
     * and must use it in its predicate; rows of another tenant are dropped from the result.
     */
    public List<T> query(TenantContext tenant, Function<String, List<T>> query) {
        return query.apply(tenant.tenantId()).stream()
                .filter(row -> visible(row, tenant))
                .toList();
    }

    public long count(TenantContext tenant) {
        return repository.count(tenant.tenantId());
    }

    /** Persists the entity under the context's tenant, ignoring any tenant id it carries. */
    public T create(TenantContext tenant, T entity) {
        T stamped = entity.withTenantId(tenant.tenantId());
        if (entity.tenantId() != null && !entity.tenantId().equals(tenant.tenantId())) {
            log.info("Ignoring client-supplied tenant '{}' on create, using '{}'",
                    entity.tenantId(), tenant.tenantId());
        }
        return repository.insert(stamped);
    }

    /**
     * Reads the row within the tenant, applies the change and writes it back under the same id
     * and tenant.
     *
     * @throws ResourceNotFoundException if no row with this id is visible to the tenant
     */
    public T update(TenantContext tenant, String id, UnaryOperator<T> change) {
        T current = getById(tenant, id);
        T changed = change.apply(current).withTenantId(tenant.tenantId());
        if (!current.id().equals(changed.id())) {
            throw new IllegalArgumentException("update must not change the entity id");
        }
        return repository.update(tenant.tenantId(), changed)
                .filter(row -> visible(row, tenant))
                .orElseThrow(() -> new ResourceNotFoundException(repository.resourceType(), id));
    }

    /**
     * @throws ResourceNotFoundException if no row with this id is visible to the tenant
     */
    public void delete(TenantContext tenant, String id) {
        if (id == null || !repository.delete(tenant.tenantId(), id)) {
            throw new ResourceNotFoundException(repository.resourceType(), id);
        }
    }

    private boolean visible(T row, TenantContext tenant) {
        if (TenantIsolationEnforcer.belongsTo(row, tenant)) {
            return true;
        }
        log.error("Repository for '{}' returned row '{}' of tenant '{}' to tenant '{}'",
                repository.resourceType(), row.id(), row.tenantId(), tenant.tenantId());
        return false;
    }
}
