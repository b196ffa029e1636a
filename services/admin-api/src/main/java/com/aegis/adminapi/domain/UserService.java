package com.aegis.adminapi.domain;

import com.aegis.adminapi.infrastructure.persistence.JdbcTenantRepository;
import com.aegis.adminapi.infrastructure.persistence.JdbcUserRepository;
import com.aegis.security.PermissionDeniedException;
import com.aegis.security.Principal;
import com.aegis.security.ResourceNotFoundException;
import com.aegis.security.Role;
import com.aegis.security.TenantContext;
import com.aegis.security.TenantScopedRepositoryGate;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * User administration within one tenant.
 *
 * <p>All reads and writes go through a {@link TenantScopedRepositoryGate}, so a user of another
 * tenant is always reported as not found.
 */
@Service
public class UserService {

    private static final Logger log = LoggerFactory.getLogger(UserService.class);

    private final TenantScopedRepositoryGate<User> users;
    private final JdbcUserRepository userRepository;
    private final JdbcTenantRepository tenants;
    private final PasswordEncoder passwordEncoder;

    public UserService(
            JdbcUserRepository userRepository,
            JdbcTenantRepository tenants,
            PasswordEncoder passwordEncoder) {
        this.users = new TenantScopedRepositoryGate<>(userRepository);
        this.userRepository = userRepository;
        this.tenants = tenants;
        this.passwordEncoder = passwordEncoder;
    }

    /** Users matching the filter, newest first. */
    public Page<User> list(TenantContext tenant, UserFilter filter, PageRequest request) {
        List<User> page = users.query(tenant, tenantId ->
                userRepository.findMatching(tenantId, filter, request.offset(), request.limit()));
        long total = userRepository.countMatching(tenant.tenantId(), filter);
        return new Page<>(page, Page.Meta.of(total, request.page(), request.limit()));
    }

    public User get(TenantContext tenant, String id) {
        return users.getById(tenant, id);
    }

    /**
     * @throws ResourceNotFoundException  if the tenant does not exist
     * @throws InactiveTenantException    if the tenant is deactivated
     * @throws DuplicateResourceException if the email is taken in this tenant
     * @throws PermissionDeniedException  if the role exceeds the creator's own
     */
    @Transactional
    public User create(
            TenantContext tenant,
            Principal creator,
            String email,
            String password,
            String fullName,
            Role role) {
        Tenant owner = tenants.findById(tenant.tenantId())
                .orElseThrow(() -> new ResourceNotFoundException("tenant", tenant.tenantId()));
        if (!owner.active()) {
            throw new InactiveTenantException(owner.id());
        }
        Role assigned = role == null ? Role.USER : role;
        requireAssignable(creator, assigned, "POST /api/v1/users");

        String normalizedEmail = email.strip().toLowerCase(Locale.ROOT);
        if (userRepository.findByEmail(tenant.tenantId(), normalizedEmail).isPresent()) {
            throw new DuplicateResourceException("user", "email", normalizedEmail);
        }
        String hash = passwordEncoder.encode(password);
        User created = users.create(tenant,
                User.create(normalizedEmail, hash, fullName.strip(), assigned, Instant.now()));
        log.info("Created user {} with role {}", created.id(), assigned.value());
        return created;
    }

    /**
     * Partial update. Changing role or active flag needs an ADMIN principal that outranks or
     * equals the target's current role, and the new role may not exceed the principal's own.
     */
    @Transactional
    public User update(
            TenantContext tenant,
            Principal actor,
            String id,
            String fullName,
            Role role,
            Boolean active) {
        String operation = "PATCH /api/v1/users/{id}";
        boolean privileged = role != null || active != null;
        if (privileged && !actor.role().implies(Role.ADMIN)) {
            throw new PermissionDeniedException(operation, "user:" + id, "update",
                    "only administrators may change role or status");
        }
        if (role != null) {
            requireAssignable(actor, role, operation);
        }
        Instant now = Instant.now();
        return users.update(tenant, id, current -> {
            if (privileged) {
                requireOutranks(actor, current, operation, "update");
            }
            User changed = current;
            if (fullName != null) {
                changed = changed.withProfile(fullName.strip(), now);
            }
            if (role != null) {
                changed = changed.withRole(role, now);
            }
            if (active != null) {
                changed = changed.withActive(active, now);
            }
            return changed;
        });
    }

    /** Changes the principal's own display name. Role and status are never touched. */
    @Transactional
    public User updateProfile(TenantContext tenant, Principal actor, String fullName) {
        Instant now = Instant.now();
        return users.update(tenant, actor.id(),
                current -> current.withProfile(fullName.strip(), now));
    }

    /** Soft delete. */
    @Transactional
    public void delete(TenantContext tenant, Principal actor, String id) {
        users.update(tenant, id, current -> {
            requireOutranks(actor, current, "DELETE /api/v1/users/{id}", "delete");
            return current.withActive(false, Instant.now());
        });
        log.info("Deactivated user {}", id);
    }

    /**
     * Deactivates every listed user or none.
     *
     * @throws ResourceNotFoundException if any id is not visible to the tenant
     * @throws PermissionDeniedException if any listed user has a higher role than the actor
     */
    @Transactional
    public int deactivateAll(TenantContext tenant, Principal actor, List<String> ids) {
        Instant now = Instant.now();
        for (String id : ids) {
            users.update(tenant, id, current -> {
                requireOutranks(actor, current, "POST /api/v1/users/deactivate", "update");
                return current.withActive(false, now);
            });
        }
        log.info("Deactivated {} users", ids.size());
        return ids.size();
    }

    private static void requireAssignable(Principal actor, Role role, String operation) {
        if (!actor.role().implies(role)) {
            throw new PermissionDeniedException(operation, "user", "assign-role",
                    "role %s cannot assign role %s".formatted(actor.role().value(), role.value()));
        }
    }

    private static void requireOutranks(
            Principal actor, User target, String operation, String action) {
        if (!actor.role().implies(target.role())) {
            throw new PermissionDeniedException(operation, "user:" + target.id(), action,
                    "role %s cannot manage a %s user"
                            .formatted(actor.role().value(), target.role().value()));
        }
    }
}
