package com.aegis.adminapi.api;

import com.aegis.adminapi.api.dto.PermissionResponse;
import com.aegis.adminapi.domain.RoleCatalogService;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/permissions")
public class PermissionController {

    private final RoleCatalogService catalog;

    public PermissionController(RoleCatalogService catalog) {
        this.catalog = catalog;
    }

    @GetMapping
    public List<PermissionResponse> list() {
        return catalog.allGrants().stream().map(PermissionResponse::from).toList();
    }
}
