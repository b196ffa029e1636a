package com.aegis.adminapi.config;

import com.aegis.security.AuthActionVerb;
import com.aegis.security.AuthPossession;
import com.aegis.security.AuthResource;
import com.aegis.security.BatchApproval;
import com.aegis.security.OperationRegistry;
import com.aegis.security.OwnershipPredicate;
import com.aegis.security.PermissionDescriptor;
import com.aegis.security.ResourceExtractor;
import com.aegis.security.ResourceRef;
import com.aegis.security.Role;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

/**
 * Permission table of the admin API, keyed by {@code "METHOD pattern"} as matched by Spring MVC.
 *
 * <p>Tenant endpoints are tenant-exempt: they manage tenants themselves, and so are the role and
 * permission endpoints, which read the global grant table. Every user endpoint is tenant-aware.
 * Listing, deleting and batch-deactivating users are reserved to administrators on top of their
 * grants.
 */
public final class AdminApiOperations {

    public static final String LIST_TENANTS = "GET /api/v1/tenants";
    public static final String GET_TENANT = "GET /api/v1/tenants/{id}";
    public static final String GET_TENANT_BY_DOMAIN = "GET /api/v1/tenants/by-domain";
    public static final String CREATE_TENANT = "POST /api/v1/tenants";
    public static final String UPDATE_TENANT = "PUT /api/v1/tenants/{id}";
    public static final String ACTIVATE_TENANT = "POST /api/v1/tenants/{id}/activate";
    public static final String DELETE_TENANT = "DELETE /api/v1/tenants/{id}";

    public static final String LIST_USERS = "GET /api/v1/users";
    public static final String GET_PROFILE = "GET /api/v1/users/profile";
    public static final String UPDATE_PROFILE = "PATCH /api/v1/users/profile";
    public static final String GET_USER = "GET /api/v1/users/{id}";
    public static final String CREATE_USER = "POST /api/v1/users";
    public static final String UPDATE_USER = "PATCH /api/v1/users/{id}";
    public static final String DELETE_USER = "DELETE /api/v1/users/{id}";
    public static final String DEACTIVATE_USERS = "POST /api/v1/users/deactivate";

    public static final String LIST_ROLES = "GET /api/v1/roles";
    public static final String GET_ROLE_PERMISSIONS = "GET /api/v1/roles/{id}/permissions";
    public static final String LIST_PERMISSIONS = "GET /api/v1/permissions";

    static final String TENANT = "tenant";
    static final String USER = "user";
    static final String ROLE = "role";
    static final String PERMISSION = "permission";

    private static final Set<Role> ADMINISTRATORS = Set.of(Role.ADMIN);

    private AdminApiOperations() {
        // utility class
    }

    public static OperationRegistry registry() {
        return OperationRegistry.builder()
                .tenantExempt(LIST_TENANTS, anyTenant(AuthActionVerb.READ))
                .tenantExempt(GET_TENANT, anyTenant(AuthActionVerb.READ))
                .tenantExempt(GET_TENANT_BY_DOMAIN, anyTenant(AuthActionVerb.READ))
                .tenantExempt(CREATE_TENANT, anyTenant(AuthActionVerb.CREATE))
                .tenantExempt(UPDATE_TENANT, anyTenant(AuthActionVerb.UPDATE))
                .tenantExempt(ACTIVATE_TENANT, anyTenant(AuthActionVerb.UPDATE))
                .tenantExempt(DELETE_TENANT, anyTenant(AuthActionVerb.DELETE))
                .tenantExempt(LIST_ROLES,
                        PermissionDescriptor.on(ROLE, AuthActionVerb.READ).build())
                .tenantExempt(GET_ROLE_PERMISSIONS,
                        PermissionDescriptor.on(ROLE, AuthActionVerb.READ).build())
                .tenantExempt(LIST_PERMISSIONS,
                        PermissionDescriptor.on(PERMISSION, AuthActionVerb.READ).build())
                .protect(LIST_USERS, ADMINISTRATORS,
                        PermissionDescriptor.on(USER, AuthActionVerb.READ).build())
                .protect(GET_PROFILE, PermissionDescriptor.on(USER, AuthActionVerb.READ)
                        .possession(AuthPossession.OWN)
                        .isOwn(ctx -> true)
                        .build())
                .protect(UPDATE_PROFILE, PermissionDescriptor.on(USER, AuthActionVerb.UPDATE)
                        .possession(AuthPossession.OWN)
                        .isOwn(ctx -> true)
                        .build())
                .protect(GET_USER, PermissionDescriptor.on(USER, AuthActionVerb.READ)
                        .possession(AuthPossession.OWN_ANY)
                        .isOwn(principalIsPathUser())
                        .resourceFromContext(userFromPath())
                        .build())
                .protect(CREATE_USER, PermissionDescriptor.on(USER, AuthActionVerb.CREATE).build())
                .protect(UPDATE_USER, PermissionDescriptor.on(USER, AuthActionVerb.UPDATE)
                        .possession(AuthPossession.OWN_ANY)
                        .isOwn(principalIsPathUser())
                        .resourceFromContext(userFromPath())
                        .build())
                .protect(DELETE_USER, ADMINISTRATORS,
                        PermissionDescriptor.on(USER, AuthActionVerb.DELETE)
                        .resourceFromContext(userFromPath())
                        .build())
                .protect(DEACTIVATE_USERS, ADMINISTRATORS,
                        PermissionDescriptor.on(USER, AuthActionVerb.UPDATE)
                        .resourceFromContext(usersFromIds())
                        .batchApproval(BatchApproval.ALL)
                        .build())
                .build();
    }

    private static PermissionDescriptor anyTenant(AuthActionVerb verb) {
        return PermissionDescriptor.on(TENANT, verb).build();
    }

    /** The principal addresses its own user record through {@code {id}}. */
    static OwnershipPredicate principalIsPathUser() {
        return ctx -> ctx.findPrincipal()
                .map(principal -> ctx.parameter("id").map(principal.id()::equals).orElse(false))
                .orElse(false);
    }

    /** {@code user:{id}} from the path variable. */
    static ResourceExtractor userFromPath() {
        return (ctx, data) -> ResourceRef.single(
                AuthResource.of(USER, ctx.parameter("id").orElse(null)));
    }

    /**
     * One {@code user:<id>} per entry of the comma-separated {@code ids} parameter. Without ids
     * the check falls back to the {@code user} type, and the handler rejects the empty request.
     */
    static ResourceExtractor usersFromIds() {
        return (ctx, data) -> {
            List<String> ids = parseIds(ctx.parameter("ids").orElse(""));
            if (ids.isEmpty()) {
                return ResourceRef.single(USER);
            }
            return ResourceRef.batch(ids.stream().map(id -> AuthResource.of(USER, id)).toList());
        };
    }

    /** Splits a comma-separated id list, dropping blanks and duplicates. */
    public static List<String> parseIds(String ids) {
        return Arrays.stream(ids.split(","))
                .map(String::strip)
                .filter(id -> !id.isEmpty())
                .distinct()
                .toList();
    }
}
