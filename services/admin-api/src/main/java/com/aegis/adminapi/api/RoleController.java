package com.aegis.adminapi.api;

import com.aegis.adminapi.api.dto.PermissionResponse;
import com.aegis.adminapi.api.dto.RoleResponse;
import com.aegis.adminapi.domain.RoleCatalogService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Roles and their grants. The grant table is fixed at startup, so this API only reads.
 */
@RestController
@RequestMapping("/api/v1/roles")
public class RoleController {

    private final RoleCatalogService catalog;

    public RoleController(RoleCatalogService catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public List<RoleResponse> list() {
        return catalog.roles().stream().map(RoleResponse::from).toList();
    }

    /** Effective grants of the role named {@code id}, inherited ones included. */
    @GetMapping("/{id}/permissions")
    public List<PermissionResponse> permissions(@PathVariable String id) {
        return catalog.effectiveGrants(catalog.role(id)).stream()
                .map(PermissionResponse::from)
                .toList();
    }
}
