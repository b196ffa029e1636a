package com.aegis.adminapi.domain;

import com.aegis.adminapi.infrastructure.persistence.JdbcTenantRepository;
import com.aegis.security.ResourceNotFoundException;
import com.aegis.security.TenantDirectory;
import java.time.Instant;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Tenant lifecycle: create, rename, deactivate, reactivate.
 *
 * <p>Names and domains are unique across all tenants, compared ignoring case. Deactivating a
 * tenant locks its users out: the route guard consults {@link #isActive} on every tenant-aware
 * request.
 */
@Service
public class TenantService implements TenantDirectory {

    private static final Logger log = LoggerFactory.getLogger(TenantService.class);

    private final JdbcTenantRepository tenants;

    public TenantService(JdbcTenantRepository tenants) {
        this.tenants = tenants;
    }

    public Page<Tenant> list(PageRequest request) {
        return new Page<>(
                tenants.findAll(request.offset(), request.limit()),
                Page.Meta.of(tenants.count(), request.page(), request.limit()));
    }

    public Tenant get(String id) {
        return tenants.findById(id).orElseThrow(() -> new ResourceNotFoundException("tenant", id));
    }

    @Override
    public boolean isActive(String tenantId) {
        return tenants.findById(tenantId).map(Tenant::active).orElse(false);
    }

    public Tenant getByDomain(String domain) {
        return tenants.findByDomain(domain)
                .orElseThrow(() -> new ResourceNotFoundException("tenant", domain));
    }

    @Transactional
    public Tenant create(String name, String domain, Boolean active) {
        String trimmedName = name.strip();
        String trimmedDomain = blankToNull(domain);
        if (tenants.findByName(trimmedName).isPresent()) {
            throw new DuplicateResourceException("tenant", "name", trimmedName);
        }
        if (trimmedDomain != null && tenants.findByDomain(trimmedDomain).isPresent()) {
            throw new DuplicateResourceException("tenant", "domain", trimmedDomain);
        }
        Tenant tenant = tenants.insert(
                Tenant.create(trimmedName, trimmedDomain, active == null || active, Instant.now()));
        log.info("Created tenant {} ({})", tenant.id(), tenant.name());
        return tenant;
    }

    /**
     * Renames a tenant. A {@code null} name keeps the current one; a {@code null} domain keeps
     * the current one and a blank domain removes it.
     */
    @Transactional
    public Tenant update(String id, String name, String domain) {
        Tenant current = get(id);
        String newName = name == null ? current.name() : name.strip();
        String newDomain = domain == null ? current.domain() : blankToNull(domain);

        if (!newName.equalsIgnoreCase(current.name())) {
            tenants.findByName(newName).ifPresent(other -> {
                throw new DuplicateResourceException("tenant", "name", newName);
            });
        }
        String currentDomain = Objects.toString(current.domain(), "");
        if (newDomain != null && !newDomain.equalsIgnoreCase(currentDomain)) {
            tenants.findByDomain(newDomain).ifPresent(other -> {
                throw new DuplicateResourceException("tenant", "domain", newDomain);
            });
        }
        return save(current.rename(newName, newDomain, Instant.now()));
    }

    @Transactional
    public Tenant activate(String id) {
        Tenant current = get(id);
        if (current.active()) {
            return current;
        }
        log.info("Activating tenant {}", id);
        return save(current.withActive(true, Instant.now()));
    }

    /** Soft delete. Users of the tenant are kept but can no longer act in it. */
    @Transactional
    public void deactivate(String id) {
        Tenant current = get(id);
        if (current.active()) {
            save(current.withActive(false, Instant.now()));
            log.info("Deactivated tenant {}", id);
        }
    }

    private Tenant save(Tenant tenant) {
        return tenants.update(tenant)
                .orElseThrow(() -> new ResourceNotFoundException("tenant", tenant.id()));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.strip();
    }
}
