package com.aegis.adminapi.api.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code PUT /api/v1/tenants/{id}}. Absent fields are left unchanged; an empty domain
 * removes it. Activation has its own endpoint.
 */
public record UpdateTenantRequest(
        @Size(min = 1, max = 100) String name,
        @Size(max = 255)
                @Pattern(regexp = "^$|" + TenantDomain.PATTERN, message = TenantDomain.MESSAGE)
                String domain) {}
