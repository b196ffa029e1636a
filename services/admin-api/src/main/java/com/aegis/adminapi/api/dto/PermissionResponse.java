package com.aegis.adminapi.api.dto;

import com.aegis.adminapi.domain.RoleGrant;

/** One {@code resource:action:possession} grant and the role declaring it. */
public record PermissionResponse(String resource, String action, String possession, String role) {

    public static PermissionResponse from(RoleGrant grant) {
        return new PermissionResponse(grant.grant().resourceType(), grant.grant().action(),
                grant.grant().scope().value(), grant.grantedTo().value());
    }
}
