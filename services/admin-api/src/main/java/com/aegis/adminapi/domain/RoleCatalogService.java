package com.aegis.adminapi.domain;

import com.aegis.security.ResourceNotFoundException;
import com.aegis.security.Role;
import com.aegis.security.RoleGrantTable;
import java.util.List;
import java.util.stream.Stream;
import org.springframework.stereotype.Service;

/**
 * Read-only view of the roles and of the grant table loaded at startup.
 */
@Service
public class RoleCatalogService {

    private final RoleGrantTable grants;

    public RoleCatalogService(RoleGrantTable grants) {
        this.grants = grants;
    }

    public List<Role> roles() {
        return List.of(Role.values());
    }

    /**
     * @throws ResourceNotFoundException if no role has this name
     */
    public Role role(String name) {
        return Role.fromString(name).orElseThrow(() -> new ResourceNotFoundException("role", name));
    }

    /** Grants the role holds, its own and those inherited from the roles it implies. */
    public List<RoleGrant> effectiveGrants(Role role) {
        return Stream.of(Role.values())
                .filter(role::implies)
                .flatMap(this::declaredGrants)
                .sorted(RoleGrant.ORDER)
                .toList();
    }

    /** Every grant of the table, by declaring role. */
    public List<RoleGrant> allGrants() {
        return Stream.of(Role.values())
                .flatMap(this::declaredGrants)
                .sorted(RoleGrant.ORDER)
                .toList();
    }

    private Stream<RoleGrant> declaredGrants(Role role) {
        return grants.grantsOf(role).stream().map(grant -> new RoleGrant(role, grant));
    }
}
