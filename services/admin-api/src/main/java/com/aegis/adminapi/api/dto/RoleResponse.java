package com.aegis.adminapi.api.dto;

import com.aegis.security.Role;
import java.util.List;

/** A role and the roles it implies. */
public record RoleResponse(String name, List<String> implies) {

    public static RoleResponse from(Role role) {
        return new RoleResponse(role.value(),
                role.impliedRoles().stream().map(Role::value).sorted().toList());
    }
}
