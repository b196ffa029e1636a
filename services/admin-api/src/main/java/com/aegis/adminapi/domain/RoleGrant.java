package com.aegis.adminapi.domain;

import com.aegis.security.Role;
import com.aegis.security.RoleGrantTable;
import java.util.Comparator;

/**
 * A grant of the role table together with the role that declares it.
 */
public record RoleGrant(Role grantedTo, RoleGrantTable.Grant grant) {

    static final Comparator<RoleGrant> ORDER = Comparator
            .comparing((RoleGrant g) -> g.grant().resourceType())
            .thenComparing(g -> g.grant().action())
            .thenComparing(g -> g.grant().scope())
            .thenComparing(RoleGrant::grantedTo);
}
