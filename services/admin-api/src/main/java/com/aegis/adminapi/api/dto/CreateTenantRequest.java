package com.aegis.adminapi.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/v1/tenants}.
 *
 * @param isActive defaults to {@code true}
 */
public record CreateTenantRequest(
        @NotBlank @Size(max = 100) String name,
        @Size(max = 255) @Pattern(regexp = TenantDomain.PATTERN, message = TenantDomain.MESSAGE)
                String domain,
        @JsonProperty("isActive") Boolean isActive) {}
