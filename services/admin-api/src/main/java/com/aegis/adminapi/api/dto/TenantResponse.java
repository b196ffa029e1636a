package com.aegis.adminapi.api.dto;

import com.aegis.adminapi.domain.Tenant;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

public record TenantResponse(
        String id,
        String name,
        String domain,
        @JsonProperty("isActive") boolean isActive,
        Instant createdAt,
        Instant updatedAt) {

    public static TenantResponse from(Tenant tenant) {
        return new TenantResponse(tenant.id(), tenant.name(), tenant.domain(), tenant.active(),
                tenant.createdAt(), tenant.updatedAt());
    }
}
