package com.aegis.adminapi.api;

import com.aegis.adminapi.api.dto.CreateTenantRequest;
import com.aegis.adminapi.api.dto.TenantResponse;
import com.aegis.adminapi.api.dto.UpdateTenantRequest;
import com.aegis.adminapi.domain.Page;
import com.aegis.adminapi.domain.PageRequest;
import com.aegis.adminapi.domain.TenantService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tenant administration. These operations manage tenants themselves and are therefore
 * tenant-exempt; the route guard still requires the matching {@code tenant} grant.
 */
@RestController
@RequestMapping("/api/v1/tenants")
public class TenantController {

    private final TenantService tenantService;

    public TenantController(TenantService tenantService) {
        this.tenantService = tenantService;
    }

    @GetMapping
    public Page<TenantResponse> list(
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return tenantService.list(PageRequest.of(page, limit)).map(TenantResponse::from);
    }

    @GetMapping("/by-domain")
    public TenantResponse getByDomain(@RequestParam String domain) {
        return TenantResponse.from(tenantService.getByDomain(domain));
    }

    @GetMapping("/{id}")
    public TenantResponse get(@PathVariable String id) {
        return TenantResponse.from(tenantService.get(id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public TenantResponse create(@Valid @RequestBody CreateTenantRequest request) {
        return TenantResponse.from(
                tenantService.create(request.name(), request.domain(), request.isActive()));
    }

    @PutMapping("/{id}")
    public TenantResponse update(
            @PathVariable String id, @Valid @RequestBody UpdateTenantRequest request) {
        return TenantResponse.from(tenantService.update(id, request.name(), request.domain()));
    }

    @PostMapping("/{id}/activate")
    public TenantResponse activate(@PathVariable String id) {
        return TenantResponse.from(tenantService.activate(id));
    }

    /** Deactivates the tenant. */
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        tenantService.deactivate(id);
    }
}
